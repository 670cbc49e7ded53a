package io.awake.core.engine;

public enum JobState {
    /** A wake is armed and has not fired yet. */
    PENDING,
    /** A fired wake is being executed. */
    RUNNING,
    /** No wake and no run. */
    DISABLED
}
