package io.awake.core.job;

/**
 * Raised at the engine boundary for job definitions that cannot be scheduled meaningfully.
 */
public final class InvalidJobException extends IllegalArgumentException {

    public InvalidJobException(String message) {
        super(message);
    }
}
