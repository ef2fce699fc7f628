package io.recur4j.core;

import java.util.List;

/**
 * Durable store behind the in-memory job store.
 *
 * <p>Jobs are loaded once when the scheduler starts; afterwards every mutation is written
 * through. Execution history is append-only.
 */
public interface JobRepository {

    List<Job> loadAll();

    /**
     * Insert or replace a job by id.
     */
    void save(Job job);

    void deleteById(String id);

    void appendExecution(ExecutionRecord record);

    /**
     * Most recent executions across all jobs, newest first. Used to refill the execution
     * log on start; repositories without history return an empty list.
     */
    default List<ExecutionRecord> recentExecutions(int limit) {
        return List.of();
    }

    /**
     * Repository that keeps nothing. Jobs live only as long as the scheduler.
     */
    static JobRepository none() {
        return NoopJobRepository.INSTANCE;
    }
}
