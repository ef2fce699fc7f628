package io.recur4j.internal;

import io.recur4j.core.Job;
import io.recur4j.core.JobRepository;
import io.recur4j.core.Recurrence;
import io.recur4j.exception.JobNotFoundException;
import io.recur4j.exception.JobValidationException;
import io.recur4j.utils.RecurrenceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative in-memory collection of jobs.
 *
 * <p>All operations are serialized on the store monitor, so a due scan never observes a job
 * halfway through {@link #recordExecution(String, Instant)}. Mutations are written through to
 * the {@link JobRepository}.
 */
public class InMemoryJobStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    // insertion order = creation order
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final JobRepository repository;
    private final Clock clock;
    private final ZoneId zone;
    private final boolean recomputeNextRunOnResume;

    public InMemoryJobStore(JobRepository repository, Clock clock, boolean recomputeNextRunOnResume) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = clock.getZone();
        this.recomputeNextRunOnResume = recomputeNextRunOnResume;
    }

    /**
     * Merge the jobs held by the repository into the store. A repository copy replaces an
     * in-memory job with the same id; creation order is kept.
     *
     * @return number of loaded jobs
     */
    public synchronized int loadAll() {
        List<Job> loaded = repository.loadAll();

        Map<String, Job> merged = new LinkedHashMap<>(jobs);
        for (Job job : loaded) {
            merged.put(job.id(), job);
        }
        List<Job> ordered = new ArrayList<>(merged.values());
        ordered.sort(Comparator.comparing(Job::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())));

        jobs.clear();
        for (Job job : ordered) {
            jobs.put(job.id(), job);
        }
        return loaded.size();
    }

    public synchronized Job create(String name, Recurrence recurrence) {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("Job name is required");
        }
        RecurrenceCalculator.validate(recurrence);

        Instant now = clock.instant();
        Job job = new Job(
                UUID.randomUUID().toString(),
                name,
                recurrence,
                true,
                RecurrenceCalculator.nextRun(recurrence, now, zone),
                null,
                now
        );

        repository.save(job);
        jobs.put(job.id(), job);
        log.debug("recur4j job created id={} name={} recurrence={} nextRun={}",
                job.id(), name, recurrence, job.nextRun());
        return job;
    }

    /**
     * Snapshot of all jobs, newest first.
     */
    public synchronized List<Job> list() {
        List<Job> snapshot = new ArrayList<>(jobs.values());
        Collections.reverse(snapshot);
        return snapshot;
    }

    public synchronized Optional<Job> find(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public synchronized Job get(String id) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        return job;
    }

    /**
     * Active jobs whose next run is at or before {@code now}, oldest first.
     */
    public synchronized List<Job> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<Job> due = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.isDueAt(now)) {
                due.add(job);
            }
        }
        return due;
    }

    /**
     * Pausing keeps {@code nextRun}. On resume a stale {@code nextRun} fires on the next scan
     * unless the store recomputes on resume.
     */
    public synchronized Job setActive(String id, boolean active) {
        Job current = get(id);
        if (current.active() == active) {
            return current;
        }

        Job updated = current.withActive(active);
        if (active && recomputeNextRunOnResume) {
            updated = updated.withNextRun(RecurrenceCalculator.nextRun(current.recurrence(), clock.instant(), zone));
        }

        repository.save(updated);
        jobs.put(id, updated);
        log.debug("recur4j job {} id={} nextRun={}", active ? "resumed" : "paused", id, updated.nextRun());
        return updated;
    }

    public synchronized Job toggle(String id) {
        return setActive(id, !get(id).active());
    }

    /**
     * Remove a job; unknown ids are a no-op.
     *
     * @return true when a job was removed
     */
    public synchronized boolean delete(String id) {
        if (id == null || !jobs.containsKey(id)) {
            return false;
        }
        repository.deleteById(id);
        jobs.remove(id);
        log.debug("recur4j job deleted id={}", id);
        return true;
    }

    /**
     * Set {@code lastRun} and advance {@code nextRun} from the execution time.
     */
    public synchronized Job recordExecution(String id, Instant executionTime) {
        Objects.requireNonNull(executionTime, "executionTime must not be null");
        Job current = get(id);
        Job updated = current.withExecution(
                executionTime,
                RecurrenceCalculator.nextRun(current.recurrence(), executionTime, zone)
        );

        // memory first: a failed write-back must not leave the job due again
        jobs.put(id, updated);
        repository.save(updated);
        return updated;
    }

    public synchronized int size() {
        return jobs.size();
    }

    public ZoneId zone() {
        return zone;
    }
}
