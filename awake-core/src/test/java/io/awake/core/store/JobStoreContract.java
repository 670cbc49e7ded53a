package io.awake.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.awake.core.job.Job;
import io.awake.core.job.JobBody;
import io.awake.core.job.JobPatch;
import io.awake.core.job.RunLog;
import io.awake.core.job.RunResult;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Behaviour every {@link JobStore} backend must share. Instants are whole milliseconds so both
 * backends round-trip them exactly.
 */
abstract class JobStoreContract {
    static final Instant CREATED = Instant.parse("2026-02-01T08:00:00Z");

    @TempDir
    Path tempDir;

    JobStore store;

    abstract JobStore open(Path dir) throws Exception;

    @BeforeEach
    void openStore() throws Exception {
        store = open(tempDir);
    }

    @Test
    void insertShouldAssignIncreasingIds() throws Exception {
        Job first = store.insert(job("https://example.com/1", true));
        Job second = store.insert(job("https://example.com/2", true));

        assertThat(first.id()).isPositive();
        assertThat(second.id()).isGreaterThan(first.id());
        assertThat(store.get(first.id())).contains(first);
        assertThat(store.get(12_345L)).isEmpty();
    }

    @Test
    void shouldRoundTripFullDefinition() throws Exception {
        Job job = new Job(
            0L,
            "https://example.com/hook?x=1",
            "PATCH",
            Map.of("Authorization", "Bearer abc", "X-Trace", "t-1"),
            JobBody.json("{\"n\":[1,2,3]}"),
            Duration.ofSeconds(90),
            4,
            Duration.ofMillis(250),
            CREATED,
            CREATED.plusSeconds(5),
            CREATED.plusSeconds(95),
            true
        );

        Job stored = store.insert(job);

        assertThat(store.get(stored.id())).contains(job.withId(stored.id()));
    }

    @Test
    void shouldKeepRawBodyDistinctFromJson() throws Exception {
        Job raw = store.insert(job("https://example.com/raw", true));
        store.updateFields(raw.id(), new JobPatch(null, "POST", null, JobBody.raw("a=1&b=2"), null, null, null));

        Job reloaded = store.get(raw.id()).orElseThrow();

        assertThat(reloaded.body()).isEqualTo(JobBody.raw("a=1&b=2"));
        assertThat(reloaded.body().json()).isFalse();
    }

    @Test
    void listShouldBeNewestFirstAndListActiveOnlyActive() throws Exception {
        Job first = store.insert(job("https://example.com/1", true));
        Job second = store.insert(job("https://example.com/2", false));
        Job third = store.insert(job("https://example.com/3", true));

        assertThat(store.list()).extracting(Job::id).containsExactly(third.id(), second.id(), first.id());
        assertThat(store.listActive()).extracting(Job::id).containsExactlyInAnyOrder(first.id(), third.id());
    }

    @Test
    void updateScheduleShouldTouchOnlyScheduleFields() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));
        store.setActive(job.id(), false);
        Instant ran = CREATED.plusSeconds(60);

        assertThat(store.updateSchedule(job.id(), ran, ran.plusSeconds(60))).isTrue();

        Job reloaded = store.get(job.id()).orElseThrow();
        assertThat(reloaded.lastRunAt()).isEqualTo(ran);
        assertThat(reloaded.nextRunAt()).isEqualTo(ran.plusSeconds(60));
        assertThat(reloaded.active()).isFalse();
        assertThat(reloaded.url()).isEqualTo(job.url());
        assertThat(store.updateSchedule(999L, ran, ran.plusSeconds(60))).isFalse();
    }

    @Test
    void runLogForMissingJobShouldNotBeWritten() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));
        store.delete(job.id());

        assertThat(store.appendRunLog(log(job.id(), 0, true))).isEmpty();
        assertThat(store.appendRunLog(log(999L, 0, true))).isEmpty();
        assertThat(store.listRunLogs(job.id(), 10)).isEmpty();

        Job next = store.insert(job("https://example.com/2", true));
        assertThat(store.appendRunLog(log(next.id(), 0, true))).isPresent();
    }

    @Test
    void updateFieldsShouldApplyOnlyGivenFields() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));

        Job updated = store.updateFields(job.id(), JobPatch.empty()
            .withInterval(Duration.ofMinutes(10))
            .withRetries(3, null)).orElseThrow();

        assertThat(updated.interval()).isEqualTo(Duration.ofMinutes(10));
        assertThat(updated.maxRetries()).isEqualTo(3);
        assertThat(updated.retryDelay()).isEqualTo(job.retryDelay());
        assertThat(updated.url()).isEqualTo(job.url());
        assertThat(updated.nextRunAt()).isEqualTo(job.nextRunAt());
        assertThat(store.get(job.id())).contains(updated);
        assertThat(store.updateFields(999L, JobPatch.empty().withUrl("https://x.test"))).isEmpty();
    }

    @Test
    void setActiveShouldReturnUpdatedJob() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));

        assertThat(store.setActive(job.id(), false)).map(Job::active).contains(false);
        assertThat(store.setActive(job.id(), true)).map(Job::active).contains(true);
        assertThat(store.setActive(999L, true)).isEmpty();
    }

    @Test
    void deleteShouldCascadeToRunLogs() throws Exception {
        Job doomed = store.insert(job("https://example.com/1", true));
        Job kept = store.insert(job("https://example.com/2", true));
        store.appendRunLog(log(doomed.id(), 0, true));
        store.appendRunLog(log(kept.id(), 0, true));

        assertThat(store.delete(doomed.id())).isTrue();
        assertThat(store.delete(doomed.id())).isFalse();

        assertThat(store.get(doomed.id())).isEmpty();
        assertThat(store.listRunLogs(doomed.id(), 10)).isEmpty();
        assertThat(store.listRunLogs(kept.id(), 10)).hasSize(1);
    }

    @Test
    void runLogsShouldBeNewestFirstAndLimited() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));
        for (int i = 0; i < 4; i++) {
            store.appendRunLog(log(job.id(), i, i % 2 == 0));
        }

        List<RunLog> logs = store.listRunLogs(job.id(), 3);

        assertThat(logs).hasSize(3);
        assertThat(logs).extracting(RunLog::startedAt)
            .containsExactly(CREATED.plusSeconds(3), CREATED.plusSeconds(2), CREATED.plusSeconds(1));
        assertThat(logs.get(0).id()).isGreaterThan(logs.get(1).id());
    }

    @Test
    void shouldKeepMissingStatusCodeAsNull() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));
        RunLog appended = store.appendRunLog(log(job.id(), 0, false)).orElseThrow();

        RunLog reloaded = store.listRunLogs(job.id(), 1).get(0);

        assertThat(appended.id()).isPositive();
        assertThat(reloaded).isEqualTo(appended);
        assertThat(reloaded.statusCode()).isNull();
        assertThat(reloaded.errorMessage()).isEqualTo("timeout");
        assertThat(reloaded.attemptCount()).isEqualTo(2);
    }

    @Test
    void shouldSurviveReopen() throws Exception {
        Job job = store.insert(job("https://example.com/1", true));
        store.appendRunLog(log(job.id(), 0, true));

        JobStore reopened = open(tempDir);

        assertThat(reopened.get(job.id())).contains(job);
        assertThat(reopened.listRunLogs(job.id(), 5)).hasSize(1);
        assertThat(reopened.insert(job("https://example.com/2", true)).id()).isGreaterThan(job.id());
    }

    static Job job(String url, boolean active) {
        return new Job(0L, url, "GET", Map.of(), null, Duration.ofMinutes(1), 0, Duration.ZERO,
            CREATED, null, CREATED.plus(Duration.ofMinutes(1)), active);
    }

    static RunLog log(long jobId, int offsetSeconds, boolean success) {
        Instant start = CREATED.plusSeconds(offsetSeconds);
        RunResult result = success
            ? RunResult.succeeded(start, start.plusMillis(120), 200, 1)
            : RunResult.failed(start, start.plusMillis(120), "timeout", 2);
        return result.toRunLog(jobId);
    }
}
