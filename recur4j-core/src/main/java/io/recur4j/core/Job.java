package io.recur4j.core;

import java.time.Instant;

/**
 * Immutable snapshot of a registered job. Updates produce a new snapshot.
 */
public record Job(

        // identity
        String id,
        String name,

        // scheduling
        Recurrence recurrence,
        boolean active,
        Instant nextRun,
        Instant lastRun,

        // bookkeeping
        Instant createdAt
) {

    /**
     * Active and {@code nextRun <= now}.
     */
    public boolean isDueAt(Instant now) {
        return active && nextRun != null && !nextRun.isAfter(now);
    }

    public Job withActive(boolean active) {
        return new Job(id, name, recurrence, active, nextRun, lastRun, createdAt);
    }

    public Job withNextRun(Instant nextRun) {
        return new Job(id, name, recurrence, active, nextRun, lastRun, createdAt);
    }

    public Job withExecution(Instant lastRun, Instant nextRun) {
        return new Job(id, name, recurrence, active, nextRun, lastRun, createdAt);
    }
}
