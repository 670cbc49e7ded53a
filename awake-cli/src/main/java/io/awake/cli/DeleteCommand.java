package io.awake.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete a job and its run history")
public final class DeleteCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    public DeleteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.jobService().delete(id)) {
                System.err.println("Delete command failed: job not found: " + id);
                return 1;
            }
            System.out.println("Deleted job #" + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Delete command failed: " + e.getMessage());
            return 1;
        }
    }
}
