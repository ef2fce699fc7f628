package io.recur4j;

import io.recur4j.core.Job;

/**
 * Work performed for jobs with a given name.
 */
public interface JobHandler {
    String name();

    /**
     * @return optional message recorded with a successful execution
     */
    String execute(Job job) throws Exception;
}
