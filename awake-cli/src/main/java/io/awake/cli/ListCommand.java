package io.awake.cli;

import io.awake.core.job.Job;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "list", description = "List all jobs, newest first")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<Job> jobs = context.jobService().list();
            if (jobs.isEmpty()) {
                System.out.println("No jobs");
            }
            for (Job job : jobs) {
                System.out.println(JobFormatter.summary(job));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List command failed: " + e.getMessage());
            return 1;
        }
    }
}
