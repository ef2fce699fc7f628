package io.recur4j.core;

import java.time.Instant;

/**
 * Scheduling state of a job. Derived from the job and the clock, never stored.
 */
public enum JobState {
    /** Paused. */
    IDLE,
    /** Active, next run in the future. */
    ARMED,
    /** Active, next run reached; picked up by the next scan. */
    DUE,
    /** Action in flight. */
    DISPATCHED;

    public static JobState of(Job job, Instant now, boolean inFlight) {
        if (inFlight) {
            return DISPATCHED;
        }
        if (!job.active()) {
            return IDLE;
        }
        return job.isDueAt(now) ? DUE : ARMED;
    }
}
