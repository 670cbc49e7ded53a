package io.awake.app;

import io.awake.cli.AddCommand;
import io.awake.cli.AwakeCliCommand;
import io.awake.cli.CliContext;
import io.awake.cli.DeleteCommand;
import io.awake.cli.DisableCommand;
import io.awake.cli.EnableCommand;
import io.awake.cli.ListCommand;
import io.awake.cli.LogsCommand;
import io.awake.cli.OnboardCommand;
import io.awake.cli.RunCommand;
import io.awake.cli.ShowCommand;
import io.awake.cli.StatusCommand;
import io.awake.cli.UpdateCommand;
import io.awake.core.config.ConfigPaths;
import io.awake.core.config.ConfigService;
import io.awake.core.config.model.AwakeConfig;
import io.awake.core.config.model.StorageConfig;
import io.awake.core.engine.JobExecutor;
import io.awake.core.engine.JobScheduler;
import io.awake.core.engine.JobService;
import io.awake.core.engine.Rehydrator;
import io.awake.core.http.OkHttpOutboundCaller;
import io.awake.core.store.FileJobStore;
import io.awake.core.store.JobStore;
import io.awake.core.store.SqliteJobStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class AwakeApplication {
    private static final Logger LOG = LoggerFactory.getLogger(AwakeApplication.class);

    private AwakeApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        AwakeConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        JobStore store = buildJobStore(config.storage());
        JobExecutor executor = new JobExecutor(OkHttpOutboundCaller.fromConfig(config.http()), store, clock);
        JobScheduler scheduler = new JobScheduler(
            store,
            executor,
            clock,
            config.scheduler().timerThreads(),
            Duration.ofSeconds(config.scheduler().shutdownGraceSeconds())
        );
        if (!runsEngine(args)) {
            // one-shot commands only touch the store; wakes belong to the `run` process
            scheduler.close();
        }
        JobService jobService = new JobService(store, scheduler, clock, config.scheduler().runLogLimit());

        CliContext context = new CliContext(
            jobService,
            configService,
            configPath,
            () -> runEngine(store, scheduler, Duration.ofSeconds(config.scheduler().rescanSeconds()))
        );

        CommandLine commandLine = new CommandLine(new AwakeCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("add", new AddCommand(context));
        commandLine.addSubcommand("update", new UpdateCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("enable", new EnableCommand(context));
        commandLine.addSubcommand("disable", new DisableCommand(context));
        commandLine.addSubcommand("delete", new DeleteCommand(context));
        commandLine.addSubcommand("logs", new LogsCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static AwakeConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to read config at {}, using defaults", configPath, e);
            return AwakeConfig.defaults();
        }
    }

    private static JobStore buildJobStore(StorageConfig storage) {
        Path path = ConfigPaths.resolveStoragePath(storage.path(), storage.backend());
        if (storage.sqlite()) {
            try {
                return new SqliteJobStore(path);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to initialize SQLite job store at " + path, e);
            }
        }
        if (StorageConfig.FILE.equals(storage.backend())) {
            return new FileJobStore(path);
        }
        throw new IllegalStateException("Unknown storage backend: " + storage.backend());
    }

    private static boolean runsEngine(String[] args) {
        return args.length > 0 && "run".equals(args[0]);
    }

    private static int runEngine(JobStore store, JobScheduler scheduler, Duration rescanEvery) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.close();
            shutdown.countDown();
        }, "awake-shutdown"));

        Rehydrator rehydrator = new Rehydrator(store, scheduler);
        int armed = rehydrator.start();
        ScheduledExecutorService rescans = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "awake-rescan");
            thread.setDaemon(true);
            return thread;
        });
        try {
            long period = rescanEvery.toMillis();
            rescans.scheduleAtFixedRate(() -> rescan(rehydrator), period, period, TimeUnit.MILLISECONDS);
            System.out.println("Engine started with " + armed + " active job(s); press Ctrl+C to stop");
            shutdown.await();
        } finally {
            rescans.shutdownNow();
        }
        return 0;
    }

    // a failed pass must not cancel the fixed-rate task
    private static void rescan(Rehydrator rehydrator) {
        try {
            rehydrator.rescan();
        } catch (Exception e) {
            LOG.warn("Failed to rescan store for new or re-enabled jobs", e);
        }
    }
}
