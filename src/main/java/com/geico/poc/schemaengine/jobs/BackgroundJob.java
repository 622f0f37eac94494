package com.geico.poc.schemaengine.jobs;

/**
 * Interface for periodic maintenance jobs.
 *
 * Jobs are discovered as beans and run by {@link BackgroundJobScheduler}:
 * - Snapshot retention: prune old snapshot rows, optionally purge orphaned payloads
 */
public interface BackgroundJob {

    /**
     * Execute the background job
     */
    void execute();

    /**
     * Get job name for logging
     */
    String getName();

    /**
     * Get initial delay before first execution (milliseconds)
     */
    long getInitialDelayMs();

    /**
     * Get period between executions (milliseconds)
     */
    long getPeriodMs();

    /**
     * Check if job is enabled
     */
    boolean isEnabled();
}
