package io.recur4j.internal;

import io.recur4j.core.ExecutionOutcome;
import io.recur4j.core.ExecutionRecord;
import io.recur4j.core.Job;
import io.recur4j.core.JobRepository;
import io.recur4j.exception.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic scan that dispatches due jobs.
 *
 * <p>The scan runs on its own thread and only hands jobs to the worker pool, so a slow action
 * never delays the next scan or another job. A job id stays in the in-flight set from dispatch
 * until its execution has been recorded; while it is there the job is not dispatched again.
 */
public class SchedulerLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final InMemoryJobStore store;
    private final ExecutionLog executionLog;
    private final JobExecutor jobExecutor;
    private final JobRepository repository;
    private final Clock clock;
    private final Duration scanPeriod;
    private final int maxConcurrency;
    private final Duration shutdownTimeout;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    // supplied by the caller, or created on start()
    private final Executor dispatchExecutor;
    private volatile ExecutorService workerPool;
    private Thread scannerThread;
    private int scanErrorCount = 0;

    public SchedulerLoop(InMemoryJobStore store,
                         ExecutionLog executionLog,
                         JobExecutor jobExecutor,
                         JobRepository repository,
                         Clock clock,
                         Duration scanPeriod,
                         int maxConcurrency,
                         Duration shutdownTimeout,
                         Executor dispatchExecutor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
        this.jobExecutor = Objects.requireNonNull(jobExecutor, "jobExecutor must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scanPeriod = Objects.requireNonNull(scanPeriod, "scanPeriod must not be null");
        this.maxConcurrency = maxConcurrency;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Start the scanner thread. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        if (dispatchExecutor == null && workerPool == null) {
            AtomicInteger seq = new AtomicInteger();
            workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
                Thread t = new Thread(r);
                t.setName("recur4j.worker-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        scannerThread = new Thread(this::scanLoop);
        scannerThread.setName("recur4j.scanner");
        scannerThread.setDaemon(true);
        scannerThread.start();
    }

    /**
     * Stop scanning and wait up to the shutdown timeout for in-flight actions. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        if (scannerThread != null) {
            scannerThread.interrupt();
            scannerThread = null;
        }

        ExecutorService pool = workerPool;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("recur4j workers did not finish within {}; interrupting inFlight={}",
                            shutdownTimeout, inFlight.size());
                    releaseDropped(pool.shutdownNow());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                releaseDropped(pool.shutdownNow());
            } finally {
                workerPool = null;
            }
        }
    }

    // queued runs that never started are dropped by shutdownNow; release their jobs
    private void releaseDropped(List<Runnable> dropped) {
        for (Runnable r : dropped) {
            if (r instanceof DispatchedRun run) {
                inFlight.remove(run.job().id());
                log.debug("recur4j dropped queued run on stop name={} id={}", run.job().name(), run.job().id());
            }
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Dispatched and not yet recorded, or an earlier timed-out action of the job is still running.
     */
    public boolean isInFlight(String jobId) {
        return inFlight.contains(jobId) || jobExecutor.isActionRunning(jobId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Dispatch every due job that is not already in flight.
     *
     * @return number of dispatched jobs
     */
    public int scanOnce() {
        Executor executor = dispatchTarget();
        Instant now = clock.instant();
        List<Job> due = store.findDue(now);

        int dispatched = 0;
        for (Job job : due) {
            try {
                if (dispatch(job.id(), now, executor)) {
                    dispatched++;
                }
            } catch (Exception e) {
                log.error("recur4j dispatch failed name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }
        }

        log.debug("recur4j scan at={} due={} dispatched={} inFlight={}", now, due.size(), dispatched, inFlight.size());
        return dispatched;
    }

    private Executor dispatchTarget() {
        if (dispatchExecutor != null) {
            return dispatchExecutor;
        }
        ExecutorService pool = workerPool;
        if (pool == null) {
            throw new IllegalStateException("Scheduler loop is not running");
        }
        return pool;
    }

    private boolean dispatch(String jobId, Instant now, Executor executor) {
        if (jobExecutor.isActionRunning(jobId)) {
            log.debug("recur4j previous action still running, skipping id={}", jobId);
            return false;
        }
        if (!inFlight.add(jobId)) {
            log.debug("recur4j job still in flight, skipping id={}", jobId);
            return false;
        }

        boolean submitted = false;
        try {
            // re-read under the store lock: the snapshot may predate a just-recorded execution
            Optional<Job> current = store.find(jobId);
            if (current.isEmpty() || !current.get().isDueAt(now)) {
                return false;
            }
            Job job = current.get();
            executor.execute(new DispatchedRun(job));
            submitted = true;
            return true;
        } finally {
            if (!submitted) {
                inFlight.remove(jobId);
            }
        }
    }

    private final class DispatchedRun implements Runnable {
        private final Job job;

        private DispatchedRun(Job job) {
            this.job = job;
        }

        Job job() {
            return job;
        }

        @Override
        public void run() {
            runDispatched(job);
        }
    }

    private void runDispatched(Job job) {
        try {
            Instant startedAt = clock.instant();
            log.debug("recur4j job started name={} id={} at={}", job.name(), job.id(), startedAt);

            ExecutionOutcome outcome = jobExecutor.execute(job);
            Instant finishedAt = clock.instant();

            if (outcome.success()) {
                log.debug("recur4j job succeeded name={} id={} at={}", job.name(), job.id(), finishedAt);
            } else {
                log.warn("recur4j job failed name={} id={} msg={}", job.name(), job.id(), outcome.message());
            }

            // failures advance the schedule too; the same occurrence is never retried
            try {
                Job updated = store.recordExecution(job.id(), finishedAt);
                log.debug("recur4j job rescheduled name={} id={} nextRun={}", job.name(), job.id(), updated.nextRun());
            } catch (JobNotFoundException e) {
                log.debug("recur4j job deleted while running name={} id={}", job.name(), job.id());
            } catch (Exception e) {
                log.error("recur4j recordExecution failed name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }

            ExecutionRecord record = new ExecutionRecord(
                    job.id(),
                    job.name(),
                    finishedAt,
                    Duration.between(startedAt, finishedAt),
                    outcome
            );
            executionLog.append(record);
            try {
                repository.appendExecution(record);
            } catch (Exception e) {
                log.error("recur4j appendExecution failed name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            log.error("recur4j worker failed name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
        } finally {
            inFlight.remove(job.id());
        }
    }

    private void scanLoop() {
        while (started.get()) {
            long scanStarted = System.nanoTime();
            try {
                scanOnce();
                scanErrorCount = 0;
            } catch (Exception e) {
                scanErrorCount++;
                log.error("recur4j scan failed attempt={} msg={}", scanErrorCount, e.getMessage(), e);
                if (!sleep(backoff(scanErrorCount))) {
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - scanStarted);
            if (!sleep(Duration.ofMillis(Math.max(0, scanPeriod.toMillis() - elapsedMs)))) {
                break;
            }
        }
    }

    // Exponential backoff for repeated scan failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(Math.max(scanPeriod.toMillis(), 1000L * (1L << exp)), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
