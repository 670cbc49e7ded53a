package io.awake.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.awake.core.http.OutboundRequest;
import io.awake.core.job.Job;
import io.awake.core.job.JobBody;
import io.awake.core.job.RunLog;
import io.awake.core.job.RunResult;
import io.awake.core.store.FileJobStore;
import io.awake.core.store.JobStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobExecutorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private JobStore store;

    @BeforeEach
    void setUp() {
        store = new FileJobStore(tempDir.resolve("jobs.json"));
    }

    @Test
    void shouldRetryWithFixedDelayAndRescheduleAfterExhaustion() throws Exception {
        Job job = store.insert(job(Duration.ofMillis(1000), 2, Duration.ofMillis(100), Map.of(), null));
        RecordingCaller caller = RecordingCaller.alwaysFailing();
        JobExecutor executor = new JobExecutor(caller, store, Clock.systemUTC());

        ExecutionResult execution = executor.run(job);

        RunResult result = execution.result();
        assertThat(result.attemptCount()).isEqualTo(3);
        assertThat(result.success()).isFalse();
        assertThat(result.statusCode()).isNull();
        assertThat(result.errorMessage()).isEqualTo("connection refused");

        List<Long> times = caller.callTimesNanos();
        assertThat(times).hasSize(3);
        assertThat(Duration.ofNanos(times.get(1) - times.get(0))).isGreaterThanOrEqualTo(Duration.ofMillis(90));
        assertThat(Duration.ofNanos(times.get(2) - times.get(1))).isGreaterThanOrEqualTo(Duration.ofMillis(90));

        Job rescheduled = execution.job();
        assertThat(rescheduled.lastRunAt()).isEqualTo(result.finishedAt());
        assertThat(rescheduled.nextRunAt()).isEqualTo(result.finishedAt().plusMillis(1000));
        assertThat(rescheduled.active()).isTrue();

        Job stored = store.get(job.id()).orElseThrow();
        assertThat(stored.nextRunAt()).isEqualTo(rescheduled.nextRunAt());
        assertThat(stored.lastRunAt()).isEqualTo(rescheduled.lastRunAt());

        List<RunLog> logs = store.listRunLogs(job.id(), 10);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).attemptCount()).isEqualTo(3);
        assertThat(logs.get(0).success()).isFalse();
        assertThat(logs.get(0).errorMessage()).isEqualTo("connection refused");
    }

    @Test
    void shouldRecordFirstAttemptSuccessWithoutWaiting() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 0, Duration.ofSeconds(5), Map.of(), null));
        JobExecutor executor = new JobExecutor(RecordingCaller.respondingWith(204), store, Clock.systemUTC());

        RunResult result = executor.run(job).result();

        assertThat(result.attemptCount()).isEqualTo(1);
        assertThat(result.success()).isTrue();
        assertThat(result.statusCode()).isEqualTo(204);
        assertThat(result.errorMessage()).isNull();
        assertThat(result.elapsed()).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void shouldTreatErrorStatusAsCompletedCall() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 3, Duration.ZERO, Map.of(), null));
        RecordingCaller caller = RecordingCaller.respondingWith(503);
        JobExecutor executor = new JobExecutor(caller, store, Clock.systemUTC());

        RunResult result = executor.run(job).result();

        assertThat(result.success()).isTrue();
        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(caller.callCount()).isEqualTo(1);
    }

    @Test
    void shouldStopRetryingOnceACallCompletes() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 3, Duration.ZERO, Map.of(), null));
        RecordingCaller caller = RecordingCaller.respondingWith(200).failingFirst();
        JobExecutor executor = new JobExecutor(caller, store, Clock.systemUTC());

        RunResult result = executor.run(job).result();

        assertThat(result.attemptCount()).isEqualTo(2);
        assertThat(result.success()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.errorMessage()).isNull();
    }

    @Test
    void attemptCountNeverExceedsRetryBudget() throws Exception {
        for (int retries = 0; retries <= 3; retries++) {
            Job job = store.insert(job(Duration.ofMinutes(1), retries, Duration.ZERO, Map.of(), null));
            JobExecutor executor = new JobExecutor(RecordingCaller.alwaysFailing(), store, Clock.systemUTC());

            RunResult result = executor.run(job).result();

            assertThat(result.attemptCount()).isBetween(1, retries + 1).isEqualTo(retries + 1);
        }
    }

    @Test
    void shouldComputeNextRunFromFinishTimeRegardlessOfOutcome() throws Exception {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        Job failing = store.insert(job(Duration.ofSeconds(30), 1, Duration.ZERO, Map.of(), null));
        Job passing = store.insert(job(Duration.ofSeconds(30), 1, Duration.ZERO, Map.of(), null));

        Job afterFailure = new JobExecutor(RecordingCaller.alwaysFailing(), store, clock).run(failing).job();
        Job afterSuccess = new JobExecutor(RecordingCaller.respondingWith(200), store, clock).run(passing).job();

        assertThat(afterFailure.lastRunAt()).isEqualTo(NOW);
        assertThat(afterFailure.nextRunAt()).isEqualTo(NOW.plusSeconds(30));
        assertThat(afterSuccess.nextRunAt()).isEqualTo(afterFailure.nextRunAt());
    }

    @Test
    void shouldDefaultJsonContentTypeForStructuredBody() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 0, Duration.ZERO, Map.of("X-Token", "abc"), JobBody.json("{\"ping\":true}")));
        RecordingCaller caller = RecordingCaller.respondingWith(200);

        new JobExecutor(caller, store, Clock.systemUTC()).run(job);

        OutboundRequest request = caller.requests().get(0);
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.body()).isEqualTo("{\"ping\":true}");
        assertThat(request.header("Content-Type")).isEqualTo("application/json");
        assertThat(request.header("x-token")).isEqualTo("abc");
    }

    @Test
    void shouldKeepCallerSuppliedContentType() throws Exception {
        Job job = store.insert(job(
            Duration.ofMinutes(1),
            0,
            Duration.ZERO,
            Map.of("Content-Type", "application/vnd.api+json"),
            JobBody.json("{}")
        ));
        RecordingCaller caller = RecordingCaller.respondingWith(200);

        new JobExecutor(caller, store, Clock.systemUTC()).run(job);

        OutboundRequest request = caller.requests().get(0);
        assertThat(request.headers()).hasSize(1);
        assertThat(request.header("content-type")).isEqualTo("application/vnd.api+json");
    }

    @Test
    void shouldSendRawTextAsIs() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 0, Duration.ZERO, Map.of(), JobBody.raw("plain words")));
        RecordingCaller caller = RecordingCaller.respondingWith(200);

        new JobExecutor(caller, store, Clock.systemUTC()).run(job);

        OutboundRequest request = caller.requests().get(0);
        assertThat(request.body()).isEqualTo("plain words");
        assertThat(request.header("Content-Type")).isNull();
    }

    @Test
    void shouldOmitBodyWhenJobHasNone() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 0, Duration.ZERO, Map.of(), null));
        RecordingCaller caller = RecordingCaller.respondingWith(200);

        new JobExecutor(caller, store, Clock.systemUTC()).run(job);

        assertThat(caller.requests().get(0).hasBody()).isFalse();
    }

    @Test
    void shouldRescheduleEvenWhenPersistenceFails() throws Exception {
        Job job = store.insert(job(Duration.ofSeconds(10), 0, Duration.ZERO, Map.of(), null));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JobExecutor executor = new JobExecutor(RecordingCaller.respondingWith(200), new FailingWritesJobStore(store), clock);

        ExecutionResult execution = executor.run(job);

        assertThat(execution.result().success()).isTrue();
        assertThat(execution.job().nextRunAt()).isEqualTo(NOW.plusSeconds(10));
        assertThat(store.listRunLogs(job.id(), 10)).isEmpty();
        assertThat(store.get(job.id()).orElseThrow().lastRunAt()).isNull();
    }

    @Test
    void shouldRecordNothingForJobDeletedMidRun() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 0, Duration.ZERO, Map.of(), null));
        JobExecutor executor = new JobExecutor(request -> {
            try {
                store.delete(job.id());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return 200;
        }, store, Clock.systemUTC());

        ExecutionResult execution = executor.run(job);

        assertThat(execution.jobRemoved()).isTrue();
        assertThat(execution.result().statusCode()).isEqualTo(200);
        assertThat(store.get(job.id())).isEmpty();
        assertThat(store.listRunLogs(job.id(), 10)).isEmpty();
    }

    @Test
    void shouldEndRetriesWhenInterrupted() throws Exception {
        Job job = store.insert(job(Duration.ofMinutes(1), 5, Duration.ofSeconds(30), Map.of(), null));
        JobExecutor executor = new JobExecutor(RecordingCaller.alwaysFailing(), store, Clock.systemUTC());

        Thread.currentThread().interrupt();
        RunResult result;
        try {
            result = executor.run(job).result();
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(result.attemptCount()).isEqualTo(1);
        assertThat(result.success()).isFalse();
    }

    private Job job(Duration interval, int maxRetries, Duration retryDelay, Map<String, String> headers, JobBody body) {
        return new Job(
            0L,
            "http://localhost:9/hook",
            body == null ? "GET" : "POST",
            headers,
            body,
            interval,
            maxRetries,
            retryDelay,
            NOW,
            null,
            NOW.plus(interval),
            true
        );
    }
}
