package io.awake.cli;

/**
 * Starts the scheduling engine and blocks until the process is asked to stop.
 */
@FunctionalInterface
public interface EngineRunner {
    int run() throws Exception;
}
