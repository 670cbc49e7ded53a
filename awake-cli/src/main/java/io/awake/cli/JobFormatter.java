package io.awake.cli;

import io.awake.core.job.Job;
import io.awake.core.job.RunLog;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

final class JobFormatter {

    private JobFormatter() {
    }

    static String summary(Job job) {
        return "#" + job.id()
            + " [" + (job.active() ? "active" : "disabled") + "] "
            + job.method() + " " + job.url()
            + " every " + job.interval().toMillis() + "ms"
            + " next=" + time(job.nextRunAt());
    }

    static String details(Job job) {
        StringBuilder out = new StringBuilder();
        out.append("Job #").append(job.id()).append(System.lineSeparator());
        out.append("  Request: ").append(job.method()).append(' ').append(job.url()).append(System.lineSeparator());
        for (Map.Entry<String, String> header : new TreeMap<>(job.headers()).entrySet()) {
            out.append("  Header: ").append(header.getKey()).append(": ").append(header.getValue()).append(System.lineSeparator());
        }
        if (job.body() != null) {
            out.append("  Body (").append(job.body().json() ? "json" : "raw").append("): ")
                .append(job.body().content()).append(System.lineSeparator());
        }
        out.append("  Interval: ").append(job.interval().toMillis()).append("ms").append(System.lineSeparator());
        out.append("  Retries: ").append(job.maxRetries())
            .append(" every ").append(job.retryDelay().toMillis()).append("ms").append(System.lineSeparator());
        out.append("  Active: ").append(job.active()).append(System.lineSeparator());
        out.append("  Created: ").append(time(job.createdAt())).append(System.lineSeparator());
        out.append("  Last run: ").append(time(job.lastRunAt())).append(System.lineSeparator());
        out.append("  Next run: ").append(time(job.nextRunAt()));
        return out.toString();
    }

    static String runLog(RunLog log) {
        String outcome = log.success()
            ? "ok status=" + log.statusCode()
            : "failed error=" + log.errorMessage();
        return time(log.startedAt())
            + " " + outcome
            + " attempts=" + log.attemptCount()
            + " took=" + (log.finishedAt().toEpochMilli() - log.startedAt().toEpochMilli()) + "ms";
    }

    private static String time(Instant instant) {
        return instant == null ? "-" : instant.toString();
    }
}
