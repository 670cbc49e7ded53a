package io.awake.cli;

import io.awake.core.job.JobNotFoundException;
import io.awake.core.job.RunLog;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "logs", description = "Show recent runs of a job, newest first")
public final class LogsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    @Option(names = {"-n", "--limit"}, description = "Maximum number of runs to show")
    Integer limit;

    public LogsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (context.jobService().get(id).isEmpty()) {
                throw new JobNotFoundException(id);
            }
            List<RunLog> logs = limit == null
                ? context.jobService().runLogs(id)
                : context.jobService().runLogs(id, limit);
            if (logs.isEmpty()) {
                System.out.println("No runs yet");
            }
            for (RunLog log : logs) {
                System.out.println(JobFormatter.runLog(log));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Logs command failed: " + e.getMessage());
            return 1;
        }
    }
}
