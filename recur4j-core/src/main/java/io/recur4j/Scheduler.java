package io.recur4j;

import io.recur4j.core.ExecutionRecord;
import io.recur4j.core.Job;
import io.recur4j.core.JobState;
import io.recur4j.core.Recurrence;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Jobs repeat on one of three fixed shapes:
 * <ul>
 *   <li>Hourly at a given minute</li>
 *   <li>Daily at a given hour and minute</li>
 *   <li>Weekly on a given day (0=Sunday..6=Saturday) at a given hour and minute</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * Job job = scheduler.createJob("nightly-report", new Recurrence.Daily(2, 30));
 * scheduler.createJob("weekly-digest", "weekly mon 09:00");
 *
 * scheduler.toggleJob(job.id());
 * scheduler.stop();
 * }</pre>
 */
public interface Scheduler {

    /**
     * Start the periodic scan. Idempotent.
     */
    void start();

    /**
     * Stop the periodic scan and wait for in-flight actions. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Register a job; its first {@code nextRun} is computed against the current time.
     */
    Job createJob(String name, Recurrence recurrence);

    /**
     * Register a job using the text form accepted by {@link io.recur4j.utils.RecurrenceParser}.
     */
    Job createJob(String name, String recurrence);

    /**
     * All jobs, newest first.
     */
    List<Job> listJobs();

    Job getJob(String id);

    /**
     * Flip the active flag of a job and return the updated job.
     */
    Job toggleJob(String id);

    Job setActive(String id, boolean active);

    /**
     * Remove a job. Unknown ids are ignored.
     *
     * @return true when a job was removed
     */
    boolean deleteJob(String id);

    /**
     * Most recent executions, newest first, bounded by the configured retention.
     */
    List<ExecutionRecord> listExecutions();

    JobState jobState(String id);

    /**
     * Run one scan on the calling thread and return the number of dispatched jobs.
     * Dispatched actions run on the dispatch executor given at construction, or on the
     * worker pool created by {@link #start()}.
     *
     * @throws IllegalStateException if no dispatch executor was given and the scheduler is not started
     */
    int runScan();
}
