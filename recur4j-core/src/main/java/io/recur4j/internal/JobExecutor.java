package io.recur4j.internal;

import io.recur4j.JobAction;
import io.recur4j.core.ExecutionOutcome;
import io.recur4j.core.Job;
import io.recur4j.core.JobActionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the action of a job and turns whatever happens into an {@link ExecutionOutcome}.
 * Never throws.
 *
 * <p>Without a timeout the action runs on the calling thread. With a timeout it runs on a
 * bounded pool and is interrupted once the timeout elapses. An action that ignores the
 * interrupt keeps its job marked as running until its thread actually returns, see
 * {@link #isActionRunning(String)}.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    public static final int DEFAULT_MAX_ACTION_THREADS = 40;

    private final JobActionProvider actions;
    private final Duration timeout;
    private final ExecutorService timeoutPool;

    // job ids whose timed action thread has not returned yet
    private final Set<String> runningActions = ConcurrentHashMap.newKeySet();

    public JobExecutor(JobActionProvider actions, Duration timeout) {
        this(actions, timeout, DEFAULT_MAX_ACTION_THREADS);
    }

    /**
     * @param maxActionThreads upper bound of the timeout pool; ignored without a timeout
     */
    public JobExecutor(JobActionProvider actions, Duration timeout, int maxActionThreads) {
        this.actions = Objects.requireNonNull(actions, "actions must not be null");
        this.timeout = timeout;
        if (timeout != null) {
            if (maxActionThreads <= 0) {
                throw new IllegalArgumentException("maxActionThreads must be a positive number");
            }
            AtomicInteger seq = new AtomicInteger();
            this.timeoutPool = new ThreadPoolExecutor(
                    0, maxActionThreads,
                    60L, TimeUnit.SECONDS,
                    new SynchronousQueue<>(),
                    r -> {
                        Thread t = new Thread(r);
                        t.setName("recur4j.action-" + seq.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    });
        } else {
            this.timeoutPool = null;
        }
    }

    /**
     * Whether an earlier timed-out action of this job is still running.
     */
    public boolean isActionRunning(String jobId) {
        return runningActions.contains(jobId);
    }

    public ExecutionOutcome execute(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            JobAction action = actions.actionFor(job);
            if (action == null) {
                return ExecutionOutcome.failed("No action available for job: " + job.name());
            }
            String message = timeoutPool == null ? action.run() : runWithTimeout(job, action);
            return ExecutionOutcome.succeeded(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failed("Interrupted");
        } catch (Exception e) {
            log.debug("recur4j action failed name={} id={}", job.name(), job.id(), e);
            return ExecutionOutcome.failed(describe(e));
        }
    }

    public void shutdown() {
        if (timeoutPool != null) {
            timeoutPool.shutdownNow();
        }
    }

    private String runWithTimeout(Job job, JobAction action) throws Exception {
        String jobId = job.id();
        if (!runningActions.add(jobId)) {
            throw new IllegalStateException("Previous action of job \"" + job.name() + "\" is still running");
        }

        // claimed by whichever side gets there first: the action thread or a cancel before it started
        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<String> future;
        try {
            future = timeoutPool.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return action.run();
                } finally {
                    runningActions.remove(jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            runningActions.remove(jobId);
            throw e;
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(job, future, claimed);
            throw new TimeoutException("Job \"" + job.name() + "\" timed out after " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (InterruptedException e) {
            abandon(job, future, claimed);
            throw e;
        }
    }

    private void abandon(Job job, Future<String> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            runningActions.remove(job.id());
        } else if (runningActions.contains(job.id())) {
            log.warn("recur4j action of job name={} id={} still running after interrupt; its next runs wait until it returns",
                    job.name(), job.id());
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }
}
