package io.recur4j.core;

import java.util.List;

final class NoopJobRepository implements JobRepository {
    static final NoopJobRepository INSTANCE = new NoopJobRepository();

    private NoopJobRepository() {
    }

    @Override
    public List<Job> loadAll() {
        return List.of();
    }

    @Override
    public void save(Job job) {
    }

    @Override
    public void deleteById(String id) {
    }

    @Override
    public void appendExecution(ExecutionRecord record) {
    }
}
