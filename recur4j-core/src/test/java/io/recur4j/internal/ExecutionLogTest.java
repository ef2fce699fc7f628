package io.recur4j.internal;

import io.recur4j.core.ExecutionOutcome;
import io.recur4j.core.ExecutionRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionLogTest {

    @Test
    void appendShouldKeepNewestFirstAndEvictOldest() {
        ExecutionLog log = new ExecutionLog(10);
        for (int i = 0; i < 15; i++) {
            log.append(record("job-" + i, Instant.parse("2026-01-05T10:00:00Z").plusSeconds(i)));
        }

        List<ExecutionRecord> records = log.list();
        assertEquals(10, records.size());
        assertEquals("job-14", records.get(0).jobId());
        assertEquals("job-5", records.get(9).jobId());
    }

    @Test
    void zeroRetentionShouldKeepNothing() {
        ExecutionLog log = new ExecutionLog(0);
        log.append(record("job-1", Instant.parse("2026-01-05T10:00:00Z")));
        assertTrue(log.list().isEmpty());
    }

    @Test
    void restoreShouldFillEmptyLogUpToRetention() {
        ExecutionLog log = new ExecutionLog(2);
        List<ExecutionRecord> persisted = List.of(
                record("job-3", Instant.parse("2026-01-05T12:00:00Z")),
                record("job-2", Instant.parse("2026-01-05T11:00:00Z")),
                record("job-1", Instant.parse("2026-01-05T10:00:00Z")));

        assertEquals(2, log.restore(persisted));
        assertEquals("job-3", log.list().get(0).jobId());
        assertEquals("job-2", log.list().get(1).jobId());

        log.append(record("job-4", Instant.parse("2026-01-05T13:00:00Z")));
        assertEquals("job-4", log.list().get(0).jobId());
        assertEquals(2, log.size());
    }

    @Test
    void restoreShouldLeaveNonEmptyLogAlone() {
        ExecutionLog log = new ExecutionLog(10);
        log.append(record("live", Instant.parse("2026-01-05T10:00:00Z")));

        assertEquals(0, log.restore(List.of(record("persisted", Instant.parse("2026-01-05T09:00:00Z")))));
        assertEquals(1, log.size());
        assertEquals("live", log.list().get(0).jobId());
    }

    @Test
    void negativeRetentionShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutionLog(-1));
    }

    @Test
    void listShouldReturnDetachedSnapshot() {
        ExecutionLog log = new ExecutionLog(3);
        log.append(record("a", Instant.parse("2026-01-05T10:00:00Z")));
        List<ExecutionRecord> snapshot = log.list();

        log.append(record("b", Instant.parse("2026-01-05T10:01:00Z")));

        assertEquals(1, snapshot.size());
        assertEquals(2, log.size());
    }

    private static ExecutionRecord record(String jobId, Instant at) {
        return new ExecutionRecord(jobId, "name-" + jobId, at, Duration.ZERO, ExecutionOutcome.succeeded(null));
    }
}
