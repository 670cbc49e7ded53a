package io.awake.cli;

import io.awake.core.config.ConfigService;
import io.awake.core.engine.JobService;
import java.nio.file.Path;

public record CliContext(
    JobService jobService,
    ConfigService configService,
    Path configPath,
    EngineRunner engineRunner
) {
    public CliContext(JobService jobService, ConfigService configService, Path configPath) {
        this(jobService, configService, configPath, () -> {
            throw new UnsupportedOperationException("engine runner is not configured");
        });
    }
}
