package io.recur4j.core;

import io.recur4j.JobAction;

/**
 * Supplies the action to run for a dispatched job.
 */
@FunctionalInterface
public interface JobActionProvider {
    JobAction actionFor(Job job);
}
