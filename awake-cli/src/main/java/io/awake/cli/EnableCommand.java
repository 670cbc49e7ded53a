package io.awake.cli;

import io.awake.core.job.Job;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "enable", description = "Re-activate a job from its stored next run time")
public final class EnableCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    public EnableCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Job job = context.jobService().enable(id);
            System.out.println("Enabled " + JobFormatter.summary(job));
            return 0;
        } catch (Exception e) {
            System.err.println("Enable command failed: " + e.getMessage());
            return 1;
        }
    }
}
