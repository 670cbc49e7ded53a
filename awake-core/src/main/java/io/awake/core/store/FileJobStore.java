package io.awake.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.awake.core.job.Job;
import io.awake.core.job.JobPatch;
import io.awake.core.job.RunLog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keeps every job and run log in one JSON document, rewritten atomically on each mutation. Suited to
 * small installations; run history is capped at {@link #MAX_RUN_LOGS} entries.
 */
public final class FileJobStore implements JobStore {
    static final int MAX_RUN_LOGS = 10_000;

    private final Path path;
    private final int maxRunLogs;
    private final ObjectMapper mapper;

    public FileJobStore(Path path) {
        this(path, MAX_RUN_LOGS);
    }

    FileJobStore(Path path, int maxRunLogs) {
        this.path = path;
        this.maxRunLogs = Math.max(1, maxRunLogs);
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized Optional<Job> get(long id) throws IOException {
        return find(load(), id);
    }

    @Override
    public synchronized List<Job> list() throws IOException {
        return load().jobs().stream()
            .sorted(Comparator.comparingLong(Job::id).reversed())
            .toList();
    }

    @Override
    public synchronized List<Job> listActive() throws IOException {
        return load().jobs().stream()
            .filter(Job::active)
            .sorted(Comparator.comparingLong(Job::id))
            .toList();
    }

    @Override
    public synchronized Job insert(Job job) throws IOException {
        JobStoreState current = load();
        long id = current.lastJobId() + 1;
        Job stored = job.withId(id);
        List<Job> jobs = new ArrayList<>(current.jobs());
        jobs.add(stored);
        save(new JobStoreState(jobs, current.runLogs(), id, current.lastRunLogId()));
        return stored;
    }

    @Override
    public synchronized boolean updateSchedule(long id, Instant lastRunAt, Instant nextRunAt) throws IOException {
        return replace(id, job -> job.withSchedule(lastRunAt, nextRunAt)).isPresent();
    }

    @Override
    public synchronized Optional<Job> updateFields(long id, JobPatch patch) throws IOException {
        return replace(id, job -> job.patchedWith(patch));
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        JobStoreState current = load();
        List<Job> jobs = new ArrayList<>(current.jobs());
        boolean removed = jobs.removeIf(job -> job.id() == id);
        if (!removed) {
            return false;
        }
        List<RunLog> runLogs = current.runLogs().stream()
            .filter(log -> log.jobId() != id)
            .toList();
        save(new JobStoreState(jobs, runLogs, current.lastJobId(), current.lastRunLogId()));
        return true;
    }

    @Override
    public synchronized Optional<Job> setActive(long id, boolean active) throws IOException {
        return replace(id, job -> job.withActive(active));
    }

    @Override
    public synchronized Optional<RunLog> appendRunLog(RunLog runLog) throws IOException {
        JobStoreState current = load();
        if (find(current, runLog.jobId()).isEmpty()) {
            return Optional.empty();
        }
        long id = current.lastRunLogId() + 1;
        RunLog stored = runLog.withId(id);
        List<RunLog> runLogs = new ArrayList<>(current.runLogs());
        runLogs.add(stored);
        if (runLogs.size() > maxRunLogs) {
            runLogs = new ArrayList<>(runLogs.subList(runLogs.size() - maxRunLogs, runLogs.size()));
        }
        save(new JobStoreState(current.jobs(), runLogs, current.lastJobId(), id));
        return Optional.of(stored);
    }

    @Override
    public synchronized List<RunLog> listRunLogs(long jobId, int limit) throws IOException {
        return load().runLogs().stream()
            .filter(log -> log.jobId() == jobId)
            .sorted(Comparator.comparingLong(RunLog::id).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    private Optional<Job> replace(long id, UnaryOperator<Job> change) throws IOException {
        JobStoreState current = load();
        Optional<Job> existing = find(current, id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Job updated = change.apply(existing.get());
        List<Job> jobs = current.jobs().stream()
            .map(job -> job.id() == id ? updated : job)
            .toList();
        save(new JobStoreState(jobs, current.runLogs(), current.lastJobId(), current.lastRunLogId()));
        return Optional.of(updated);
    }

    private Optional<Job> find(JobStoreState state, long id) {
        return state.jobs().stream().filter(job -> job.id() == id).findFirst();
    }

    private JobStoreState load() throws IOException {
        if (!Files.exists(path)) {
            return JobStoreState.empty();
        }
        return mapper.readValue(Files.readString(path), JobStoreState.class);
    }

    private void save(JobStoreState state) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
