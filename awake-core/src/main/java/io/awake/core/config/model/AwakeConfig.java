package io.awake.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AwakeConfig(
    StorageConfig storage,
    HttpConfig http,
    SchedulerConfig scheduler
) {

    public AwakeConfig {
        storage = storage == null ? StorageConfig.defaults() : storage;
        http = http == null ? HttpConfig.defaults() : http;
        scheduler = scheduler == null ? SchedulerConfig.defaults() : scheduler;
    }

    public static AwakeConfig defaults() {
        return new AwakeConfig(
            StorageConfig.defaults(),
            HttpConfig.defaults(),
            SchedulerConfig.defaults()
        );
    }

    public AwakeConfig withStorage(StorageConfig newStorage) {
        return new AwakeConfig(newStorage, http, scheduler);
    }
}
