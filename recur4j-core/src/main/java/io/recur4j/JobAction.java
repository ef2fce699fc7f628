package io.recur4j;

/**
 * Zero-argument unit of work bound to one job.
 * Returning normally is a success; throwing is a failure.
 */
@FunctionalInterface
public interface JobAction {
    String run() throws Exception;
}
