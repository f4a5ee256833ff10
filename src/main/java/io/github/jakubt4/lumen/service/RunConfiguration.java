package io.github.jakubt4.lumen.service;

/**
 * Settings of one batch run.
 *
 * @param workers number of targets observed in parallel, 1 for a sequential run
 * @param debug   log the full stack trace of failed targets
 */
public record RunConfiguration(int workers, boolean debug) {

    public RunConfiguration {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
    }

    public static RunConfiguration sequential() {
        return new RunConfiguration(1, false);
    }

    public RunConfiguration withWorkers(final int workers) {
        return new RunConfiguration(workers, debug);
    }
}
