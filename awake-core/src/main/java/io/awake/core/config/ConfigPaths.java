package io.awake.core.config;

import io.awake.core.config.model.StorageConfig;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".awake", "config.json");
    }

    public static Path resolveStoragePath(String rawPath, String backend) {
        if (rawPath == null || rawPath.isBlank()) {
            String fileName = StorageConfig.FILE.equals(backend) ? "jobs.json" : "awake.db";
            return Path.of(System.getProperty("user.home"), ".awake", fileName);
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
