package io.awake.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "disable", description = "Stop a job without deleting it")
public final class DisableCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    public DisableCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.jobService().disable(id);
            System.out.println("Disabled job #" + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Disable command failed: " + e.getMessage());
            return 1;
        }
    }
}
