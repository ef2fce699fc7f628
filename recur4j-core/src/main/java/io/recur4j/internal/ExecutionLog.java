package io.recur4j.internal;

import io.recur4j.core.ExecutionRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded most-recent-first log of executions. The oldest records are evicted first.
 */
public class ExecutionLog {
    private final int retention;
    private final Deque<ExecutionRecord> records = new ArrayDeque<>();

    public ExecutionLog(int retention) {
        if (retention < 0) {
            throw new IllegalArgumentException("retention must not be negative");
        }
        this.retention = retention;
    }

    public synchronized void append(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        records.addFirst(record);
        while (records.size() > retention) {
            records.removeLast();
        }
    }

    /**
     * Fill an empty log from persisted history given newest first, up to the retention.
     * A log that already holds records is left as is.
     *
     * @return number of restored records
     */
    public synchronized int restore(List<ExecutionRecord> newestFirst) {
        Objects.requireNonNull(newestFirst, "newestFirst must not be null");
        if (!records.isEmpty()) {
            return 0;
        }
        for (ExecutionRecord record : newestFirst) {
            if (records.size() >= retention) {
                break;
            }
            records.addLast(Objects.requireNonNull(record, "record must not be null"));
        }
        return records.size();
    }

    /**
     * Newest first.
     */
    public synchronized List<ExecutionRecord> list() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    public int retention() {
        return retention;
    }
}
