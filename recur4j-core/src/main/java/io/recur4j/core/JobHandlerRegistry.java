package io.recur4j.core;

import io.recur4j.JobAction;
import io.recur4j.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves job actions by job name.
 *
 * <p>Jobs without a registered handler run the fallback handler when one is configured,
 * otherwise their execution fails.
 */
public class JobHandlerRegistry implements JobActionProvider {

    private final Map<String, JobHandler> handlersByName;
    private final JobHandler fallback;

    public JobHandlerRegistry(List<JobHandler> handlers) {
        this(handlers, null);
    }

    public JobHandlerRegistry(List<JobHandler> handlers, JobHandler fallback) {
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler name: " + a.name());
                        }
                ));
        this.fallback = fallback;
    }

    /**
     * Registry whose fallback only logs the execution.
     */
    public static JobHandlerRegistry withLoggingFallback(List<JobHandler> handlers) {
        return new JobHandlerRegistry(handlers, new LoggingJobHandler());
    }

    public JobHandler getRequired(String name) {
        JobHandler handler = handlersByName.get(name);
        if (handler != null) {
            return handler;
        }
        if (fallback != null) {
            return fallback;
        }
        throw new IllegalStateException("No JobHandler registered for name: " + name);
    }

    public boolean contains(String name) {
        return handlersByName.containsKey(name);
    }

    @Override
    public JobAction actionFor(Job job) {
        // resolved lazily so a missing handler surfaces as a failed execution
        return () -> getRequired(job.name()).execute(job);
    }
}
