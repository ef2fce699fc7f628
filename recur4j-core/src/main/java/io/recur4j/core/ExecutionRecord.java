package io.recur4j.core;

import java.time.Duration;
import java.time.Instant;

/**
 * One finished execution of a job.
 *
 * jobId      : id of the job at dispatch time (the job may since have been deleted)
 * executedAt : completion time, also the reference used to advance the job
 * duration   : wall time spent in the action
 */
public record ExecutionRecord(
        String jobId,
        String jobName,
        Instant executedAt,
        Duration duration,
        ExecutionOutcome outcome
) {
    public boolean succeeded() {
        return outcome != null && outcome.success();
    }
}
