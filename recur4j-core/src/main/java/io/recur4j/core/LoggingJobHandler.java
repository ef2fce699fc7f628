package io.recur4j.core;

import io.recur4j.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback handler that only reports the execution.
 */
public class LoggingJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(LoggingJobHandler.class);

    @Override
    public String name() {
        return "*";
    }

    @Override
    public String execute(Job job) {
        log.info("Job \"{}\" executed id={}", job.name(), job.id());
        return "Job \"" + job.name() + "\" executed";
    }
}
