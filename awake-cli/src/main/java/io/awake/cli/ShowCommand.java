package io.awake.cli;

import io.awake.core.job.Job;
import io.awake.core.job.JobNotFoundException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Show one job")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Job job = context.jobService().get(id).orElseThrow(() -> new JobNotFoundException(id));
            System.out.println(JobFormatter.details(job));
            return 0;
        } catch (Exception e) {
            System.err.println("Show command failed: " + e.getMessage());
            return 1;
        }
    }
}
