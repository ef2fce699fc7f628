package io.recur4j.internal;

import io.recur4j.core.ExecutionRecord;
import io.recur4j.core.Job;
import io.recur4j.core.JobRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory repository that remembers every write.
 */
class RecordingJobRepository implements JobRepository {
    final Map<String, Job> jobs = Collections.synchronizedMap(new LinkedHashMap<>());
    final List<ExecutionRecord> executions = Collections.synchronizedList(new ArrayList<>());
    volatile boolean failSaves = false;

    @Override
    public List<Job> loadAll() {
        synchronized (jobs) {
            return new ArrayList<>(jobs.values());
        }
    }

    @Override
    public void save(Job job) {
        if (failSaves) {
            throw new IllegalStateException("store unavailable");
        }
        jobs.put(job.id(), job);
    }

    @Override
    public void deleteById(String id) {
        jobs.remove(id);
    }

    @Override
    public void appendExecution(ExecutionRecord record) {
        executions.add(record);
    }

    @Override
    public List<ExecutionRecord> recentExecutions(int limit) {
        List<ExecutionRecord> newestFirst;
        synchronized (executions) {
            newestFirst = new ArrayList<>(executions);
        }
        Collections.reverse(newestFirst);
        return newestFirst.subList(0, Math.min(limit, newestFirst.size()));
    }
}
