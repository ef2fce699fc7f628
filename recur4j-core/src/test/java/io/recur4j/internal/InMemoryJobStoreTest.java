package io.recur4j.internal;

import io.recur4j.core.Job;
import io.recur4j.core.Recurrence;
import io.recur4j.exception.JobNotFoundException;
import io.recur4j.exception.JobValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private MutableClock clock;
    private RecordingJobRepository repository;
    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-05T10:05:00Z"));
        repository = new RecordingJobRepository();
        store = new InMemoryJobStore(repository, clock, false);
    }

    @Test
    void createShouldComputeInitialNextRunAndPersist() {
        Job job = store.create("report", new Recurrence.Hourly(30));

        assertNotNull(job.id());
        assertTrue(job.active());
        assertNull(job.lastRun());
        assertEquals(Instant.parse("2026-01-05T10:30:00Z"), job.nextRun());
        assertEquals(job, repository.jobs.get(job.id()));
    }

    @Test
    void createShouldRejectBlankNameAndInvalidRule() {
        JobValidationException invalid = assertThrows(JobValidationException.class,
                () -> store.create("", new Recurrence.Hourly(0)));
        assertEquals("VALIDATION", invalid.getErrorCode());
        assertThrows(JobValidationException.class, () -> store.create("   ", new Recurrence.Hourly(0)));
        assertThrows(JobValidationException.class, () -> store.create(null, new Recurrence.Hourly(0)));
        assertThrows(JobValidationException.class, () -> store.create("x", new Recurrence.Daily(25, 0)));
        assertEquals(0, store.size());
        assertTrue(repository.jobs.isEmpty());
    }

    @Test
    void listShouldReturnNewestFirst() {
        Job first = store.create("first", new Recurrence.Hourly(0));
        clock.advance(Duration.ofSeconds(1));
        Job second = store.create("second", new Recurrence.Hourly(0));

        List<Job> jobs = store.list();
        assertEquals(List.of(second.id(), first.id()), jobs.stream().map(Job::id).toList());
    }

    @Test
    void pausingShouldKeepStaleNextRunSoResumedJobIsDue() {
        Job job = store.create("sync", new Recurrence.Hourly(30));
        store.setActive(job.id(), false);

        clock.advance(Duration.ofHours(3));
        assertTrue(store.findDue(clock.instant()).isEmpty());

        Job resumed = store.toggle(job.id());
        assertTrue(resumed.active());
        assertEquals(job.nextRun(), resumed.nextRun());
        assertEquals(List.of(job.id()), store.findDue(clock.instant()).stream().map(Job::id).toList());
    }

    @Test
    void resumeShouldRecomputeNextRunWhenConfigured() {
        store = new InMemoryJobStore(repository, clock, true);
        Job job = store.create("sync", new Recurrence.Hourly(30));
        store.setActive(job.id(), false);
        clock.advance(Duration.ofHours(3));

        Job resumed = store.setActive(job.id(), true);

        assertEquals(Instant.parse("2026-01-05T13:30:00Z"), resumed.nextRun());
        assertTrue(store.findDue(clock.instant()).isEmpty());
    }

    @Test
    void unknownIdsShouldFailExceptForDelete() {
        JobNotFoundException notFound = assertThrows(JobNotFoundException.class, () -> store.setActive("missing", false));
        assertEquals("NOT_FOUND", notFound.getErrorCode());
        assertEquals("missing", notFound.getJobId());
        assertEquals("Job not found: missing", notFound.getMessage());
        assertThrows(JobNotFoundException.class, () -> store.toggle("missing"));
        assertThrows(JobNotFoundException.class, () -> store.recordExecution("missing", clock.instant()));
        assertFalse(store.delete("missing"));
        assertFalse(store.delete(null));
    }

    @Test
    void deleteShouldRemoveFromStoreAndRepository() {
        Job job = store.create("cleanup", new Recurrence.Daily(3, 0));

        assertTrue(store.delete(job.id()));
        assertFalse(store.delete(job.id()));
        assertTrue(store.find(job.id()).isEmpty());
        assertFalse(repository.jobs.containsKey(job.id()));
    }

    @Test
    void recordExecutionShouldAdvanceFromExecutionTime() {
        Job job = store.create("report", new Recurrence.Hourly(30));
        Instant executedAt = Instant.parse("2026-01-05T10:30:02Z");

        Job updated = store.recordExecution(job.id(), executedAt);

        assertEquals(executedAt, updated.lastRun());
        assertEquals(Instant.parse("2026-01-05T11:30:00Z"), updated.nextRun());
        assertEquals(updated, repository.jobs.get(job.id()));
    }

    @Test
    void recordExecutionShouldUpdateMemoryEvenWhenWriteBackFails() {
        Job job = store.create("report", new Recurrence.Hourly(30));
        repository.failSaves = true;

        assertThrows(IllegalStateException.class,
                () -> store.recordExecution(job.id(), Instant.parse("2026-01-05T10:30:00Z")));

        assertEquals(Instant.parse("2026-01-05T11:30:00Z"), store.get(job.id()).nextRun());
    }

    @Test
    void loadAllShouldMergeRepositoryJobsInCreationOrder() {
        Job persisted = new Job("p-1", "persisted", new Recurrence.Daily(1, 0), false,
                Instant.parse("2026-01-06T01:00:00Z"), null, Instant.parse("2026-01-01T00:00:00Z"));
        repository.jobs.put(persisted.id(), persisted);
        Job local = store.create("local", new Recurrence.Hourly(0));

        int loaded = store.loadAll();

        assertEquals(2, loaded);
        assertEquals(List.of(local.id(), persisted.id()), store.list().stream().map(Job::id).toList());
    }
}
