package io.awake.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awake.core.job.Job;
import io.awake.core.job.JobBody;
import io.awake.core.job.JobPatch;
import io.awake.core.job.RunLog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SqliteJobStore implements JobStore {
    private static final TypeReference<Map<String, String>> HEADERS = new TypeReference<>() {
    };
    private static final String JOB_COLUMNS = """
        id, url, method, headers_json, body_json, body_is_json, interval_ms, max_retries,
        retry_delay_ms, created_at, last_run_at, next_run_at, active
        """;

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteJobStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized Optional<Job> get(long id) throws IOException {
        try (Connection connection = openConnection()) {
            return selectJob(connection, id);
        } catch (SQLException e) {
            throw new IOException("Failed to load job " + id, e);
        }
    }

    @Override
    public synchronized List<Job> list() throws IOException {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM jobs ORDER BY id DESC", "Failed to list jobs");
    }

    @Override
    public synchronized List<Job> listActive() throws IOException {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM jobs WHERE active = 1 ORDER BY id ASC", "Failed to list active jobs");
    }

    @Override
    public synchronized Job insert(Job job) throws IOException {
        String sql = """
            INSERT INTO jobs (url, method, headers_json, body_json, body_is_json, interval_ms, max_retries,
                              retry_delay_ms, created_at, last_run_at, next_run_at, active)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            long id;
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, job.url());
                statement.setString(2, job.method());
                statement.setString(3, mapper.writeValueAsString(job.headers()));
                bindBody(statement, 4, job.body());
                statement.setLong(6, job.interval().toMillis());
                statement.setInt(7, job.maxRetries());
                statement.setLong(8, job.retryDelay().toMillis());
                statement.setLong(9, job.createdAt().toEpochMilli());
                bindInstant(statement, 10, job.lastRunAt());
                bindInstant(statement, 11, job.nextRunAt());
                statement.setInt(12, job.active() ? 1 : 0);
                statement.executeUpdate();
                id = lastInsertId(connection);
            }
            connection.commit();
            return job.withId(id);
        } catch (SQLException e) {
            throw new IOException("Failed to insert job", e);
        }
    }

    @Override
    public synchronized boolean updateSchedule(long id, Instant lastRunAt, Instant nextRunAt) throws IOException {
        String sql = "UPDATE jobs SET last_run_at = ?, next_run_at = ? WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindInstant(statement, 1, lastRunAt);
            bindInstant(statement, 2, nextRunAt);
            statement.setLong(3, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update schedule of job " + id, e);
        }
    }

    @Override
    public synchronized Optional<Job> updateFields(long id, JobPatch patch) throws IOException {
        String sql = """
            UPDATE jobs
            SET url = ?, method = ?, headers_json = ?, body_json = ?, body_is_json = ?,
                interval_ms = ?, max_retries = ?, retry_delay_ms = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            Optional<Job> existing = selectJob(connection, id);
            if (existing.isEmpty()) {
                connection.rollback();
                return Optional.empty();
            }
            Job patched = existing.get().patchedWith(patch);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, patched.url());
                statement.setString(2, patched.method());
                statement.setString(3, mapper.writeValueAsString(patched.headers()));
                bindBody(statement, 4, patched.body());
                statement.setLong(6, patched.interval().toMillis());
                statement.setInt(7, patched.maxRetries());
                statement.setLong(8, patched.retryDelay().toMillis());
                statement.setLong(9, id);
                statement.executeUpdate();
            }
            connection.commit();
            return Optional.of(patched);
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + id, e);
        }
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement logs = connection.prepareStatement("DELETE FROM run_logs WHERE job_id = ?");
                 PreparedStatement jobs = connection.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                logs.setLong(1, id);
                logs.executeUpdate();
                jobs.setLong(1, id);
                int removed = jobs.executeUpdate();
                connection.commit();
                return removed > 0;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + id, e);
        }
    }

    @Override
    public synchronized Optional<Job> setActive(long id, boolean active) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement("UPDATE jobs SET active = ? WHERE id = ?")) {
                statement.setInt(1, active ? 1 : 0);
                statement.setLong(2, id);
                if (statement.executeUpdate() == 0) {
                    connection.rollback();
                    return Optional.empty();
                }
            }
            Optional<Job> updated = selectJob(connection, id);
            connection.commit();
            return updated;
        } catch (SQLException e) {
            throw new IOException("Failed to set active flag of job " + id, e);
        }
    }

    @Override
    public synchronized Optional<RunLog> appendRunLog(RunLog runLog) throws IOException {
        // inserts nothing once the job row is gone
        String sql = """
            INSERT INTO run_logs (job_id, started_at, finished_at, success, status_code, error_message, attempt_count)
            SELECT ?, ?, ?, ?, ?, ?, ?
            WHERE EXISTS (SELECT 1 FROM jobs WHERE id = ?)
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            long id;
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, runLog.jobId());
                statement.setLong(2, runLog.startedAt().toEpochMilli());
                statement.setLong(3, runLog.finishedAt().toEpochMilli());
                statement.setInt(4, runLog.success() ? 1 : 0);
                if (runLog.statusCode() == null) {
                    statement.setNull(5, Types.INTEGER);
                } else {
                    statement.setInt(5, runLog.statusCode());
                }
                statement.setString(6, runLog.errorMessage());
                statement.setInt(7, runLog.attemptCount());
                statement.setLong(8, runLog.jobId());
                if (statement.executeUpdate() == 0) {
                    connection.rollback();
                    return Optional.empty();
                }
                id = lastInsertId(connection);
            }
            connection.commit();
            return Optional.of(runLog.withId(id));
        } catch (SQLException e) {
            throw new IOException("Failed to append run log for job " + runLog.jobId(), e);
        }
    }

    @Override
    public synchronized List<RunLog> listRunLogs(long jobId, int limit) throws IOException {
        String sql = """
            SELECT id, job_id, started_at, finished_at, success, status_code, error_message, attempt_count
            FROM run_logs
            WHERE job_id = ?
            ORDER BY id DESC
            LIMIT ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, jobId);
            statement.setInt(2, Math.max(1, limit));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<RunLog> logs = new ArrayList<>();
                while (resultSet.next()) {
                    Object status = resultSet.getObject("status_code");
                    logs.add(new RunLog(
                        resultSet.getLong("id"),
                        resultSet.getLong("job_id"),
                        Instant.ofEpochMilli(resultSet.getLong("started_at")),
                        Instant.ofEpochMilli(resultSet.getLong("finished_at")),
                        resultSet.getInt("success") == 1,
                        status == null ? null : ((Number) status).intValue(),
                        resultSet.getString("error_message"),
                        resultSet.getInt("attempt_count")
                    ));
                }
                return logs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list run logs for job " + jobId, e);
        }
    }

    private List<Job> queryJobs(String sql, String failure) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<Job> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(readJob(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException(failure, e);
        }
    }

    private Optional<Job> selectJob(Connection connection, long id) throws SQLException, IOException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT " + JOB_COLUMNS + " FROM jobs WHERE id = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readJob(resultSet)) : Optional.empty();
            }
        }
    }

    private Job readJob(ResultSet resultSet) throws SQLException, IOException {
        String headersJson = resultSet.getString("headers_json");
        String bodyJson = resultSet.getString("body_json");
        return new Job(
            resultSet.getLong("id"),
            resultSet.getString("url"),
            resultSet.getString("method"),
            headersJson == null || headersJson.isBlank() ? Map.of() : mapper.readValue(headersJson, HEADERS),
            bodyJson == null ? null : new JobBody(bodyJson, resultSet.getInt("body_is_json") == 1),
            Duration.ofMillis(resultSet.getLong("interval_ms")),
            resultSet.getInt("max_retries"),
            Duration.ofMillis(resultSet.getLong("retry_delay_ms")),
            Instant.ofEpochMilli(resultSet.getLong("created_at")),
            readInstant(resultSet, "last_run_at"),
            readInstant(resultSet, "next_run_at"),
            resultSet.getInt("active") == 1
        );
    }

    private Instant readInstant(ResultSet resultSet, String column) throws SQLException {
        Object value = resultSet.getObject(column);
        return value == null ? null : Instant.ofEpochMilli(((Number) value).longValue());
    }

    private void bindInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    // binds body_json and body_is_json at index and index + 1
    private void bindBody(PreparedStatement statement, int index, JobBody body) throws SQLException {
        if (body == null) {
            statement.setNull(index, Types.VARCHAR);
            statement.setInt(index + 1, 0);
        } else {
            statement.setString(index, body.content());
            statement.setInt(index + 1, body.json() ? 1 : 0);
        }
    }

    private long lastInsertId(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String jobs = """
            CREATE TABLE IF NOT EXISTS jobs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                url TEXT NOT NULL,
                method TEXT NOT NULL,
                headers_json TEXT,
                body_json TEXT,
                body_is_json INTEGER NOT NULL DEFAULT 0,
                interval_ms INTEGER NOT NULL,
                max_retries INTEGER NOT NULL DEFAULT 0,
                retry_delay_ms INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL,
                last_run_at INTEGER,
                next_run_at INTEGER,
                active INTEGER NOT NULL DEFAULT 1
            )
            """;
        String runLogs = """
            CREATE TABLE IF NOT EXISTS run_logs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                job_id INTEGER NOT NULL,
                started_at INTEGER NOT NULL,
                finished_at INTEGER NOT NULL,
                success INTEGER NOT NULL,
                status_code INTEGER,
                error_message TEXT,
                attempt_count INTEGER NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_run_logs_job_id
            ON run_logs(job_id, id DESC)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(jobs);
            statement.execute(runLogs);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }
}
