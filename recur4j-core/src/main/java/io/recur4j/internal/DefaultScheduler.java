package io.recur4j.internal;

import io.recur4j.Scheduler;
import io.recur4j.config.SchedulerProperties;
import io.recur4j.core.ExecutionRecord;
import io.recur4j.core.Job;
import io.recur4j.core.JobActionProvider;
import io.recur4j.core.JobRepository;
import io.recur4j.core.JobState;
import io.recur4j.core.Recurrence;
import io.recur4j.utils.RecurrenceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory recurring job scheduler.
 *
 * <p>Wires the job store, execution log, executor and scan loop together. The store is the
 * only writer of job state; after creation {@code lastRun}/{@code nextRun} only change through
 * the scan loop.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Scheduler scheduler = new DefaultScheduler(props, JobHandlerRegistry.withLoggingFallback(handlers), JobRepository.none());
 * scheduler.start();
 * scheduler.createJob("cleanup", "daily 03:00");
 * scheduler.stop();
 * }</pre>
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private final SchedulerProperties props;
    private final JobRepository repository;
    private final InMemoryJobStore store;
    private final ExecutionLog executionLog;
    private final JobExecutor jobExecutor;
    private final SchedulerLoop loop;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultScheduler(SchedulerProperties props, JobActionProvider actions, JobRepository repository) {
        this(props, actions, repository, null, null);
    }

    public DefaultScheduler(SchedulerProperties props, JobActionProvider actions, JobRepository repository, Clock clock) {
        this(props, actions, repository, clock, null);
    }

    /**
     * @param clock            time source; null means the system clock
     * @param dispatchExecutor runs dispatched jobs; null means a worker pool owned by the scheduler
     */
    public DefaultScheduler(SchedulerProperties props,
                            JobActionProvider actions,
                            JobRepository repository,
                            Clock clock,
                            Executor dispatchExecutor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(actions, "actions must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        props.validate();

        ZoneId zone = props.resolveZone();
        this.clock = clock == null ? Clock.system(zone) : clock.withZone(zone);
        this.store = new InMemoryJobStore(repository, this.clock, props.isRecomputeNextRunOnResume());
        this.executionLog = new ExecutionLog(props.getExecutionLogRetention());
        this.jobExecutor = new JobExecutor(actions, props.getExecutionTimeout(), props.getMaxConcurrency() * 2);
        this.loop = new SchedulerLoop(
                store,
                executionLog,
                jobExecutor,
                repository,
                this.clock,
                props.getScanPeriod(),
                props.getMaxConcurrency(),
                props.getShutdownTimeout(),
                dispatchExecutor
        );
    }

    /**
     * Load persisted jobs and start scanning. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("recur4j starting with scanPeriod={}, timezone={}, maxConcurrency={}, executionLogRetention={}, executionTimeout={}",
                props.getScanPeriod(),
                clock.getZone(),
                props.getMaxConcurrency(),
                props.getExecutionLogRetention(),
                props.getExecutionTimeout());

        try {
            int loaded = store.loadAll();
            log.info("recur4j loaded {} job(s) from {}", loaded, repository.getClass().getSimpleName());
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        restoreExecutionLog();

        loop.start();
        log.info("recur4j started successfully.");
    }

    private void restoreExecutionLog() {
        if (executionLog.retention() == 0) {
            return;
        }
        try {
            int restored = executionLog.restore(repository.recentExecutions(executionLog.retention()));
            log.info("recur4j restored {} execution record(s)", restored);
        } catch (RuntimeException e) {
            // history only feeds listExecutions(); scheduling does not depend on it
            log.warn("recur4j could not restore execution history msg={}", e.getMessage(), e);
        }
    }

    /**
     * Stop scanning. In-flight actions complete and are recorded. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("recur4j stopping...");
        loop.stop();
        log.info("recur4j stopped successfully.");
    }

    /**
     * Release the action pool used for timeouts. The scheduler cannot be restarted afterwards.
     */
    public void close() {
        stop();
        jobExecutor.shutdown();
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public Job createJob(String name, Recurrence recurrence) {
        Job job = store.create(name, recurrence);
        log.info("recur4j job created name={} id={} rule=\"{}\" nextRun={}",
                job.name(), job.id(), recurrence.describe(), job.nextRun());
        return job;
    }

    @Override
    public Job createJob(String name, String recurrence) {
        return createJob(name, RecurrenceParser.parse(recurrence));
    }

    @Override
    public List<Job> listJobs() {
        return store.list();
    }

    @Override
    public Job getJob(String id) {
        return store.get(id);
    }

    @Override
    public Job toggleJob(String id) {
        return store.toggle(id);
    }

    @Override
    public Job setActive(String id, boolean active) {
        return store.setActive(id, active);
    }

    @Override
    public boolean deleteJob(String id) {
        return store.delete(id);
    }

    @Override
    public List<ExecutionRecord> listExecutions() {
        return executionLog.list();
    }

    @Override
    public JobState jobState(String id) {
        return JobState.of(store.get(id), clock.instant(), loop.isInFlight(id));
    }

    @Override
    public int runScan() {
        return loop.scanOnce();
    }
}
