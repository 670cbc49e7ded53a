package io.awake.cli;

import io.awake.core.config.ConfigPaths;
import io.awake.core.config.model.AwakeConfig;
import io.awake.core.job.Job;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job counts")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AwakeConfig config = context.configService().load(context.configPath());
            List<Job> jobs = context.jobService().list();
            long active = jobs.stream().filter(Job::active).count();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store backend: " + config.storage().backend());
            System.out.println("Store path: " + ConfigPaths.resolveStoragePath(config.storage().path(), config.storage().backend()));
            System.out.println("Jobs: " + jobs.size() + " (" + active + " active)");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
