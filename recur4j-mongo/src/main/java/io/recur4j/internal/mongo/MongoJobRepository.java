package io.recur4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.core.ExecutionOutcome;
import io.recur4j.core.ExecutionRecord;
import io.recur4j.core.Job;
import io.recur4j.core.JobRepository;
import io.recur4j.core.Recurrence;
import io.recur4j.core.RecurrenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence for jobs and their execution history.
 *
 * <p>Jobs are stored one document per job, keyed by job id; the recurrence rule is stored as
 * its type plus a field map. Executions go to a separate append-only collection.
 */
public class MongoJobRepository implements JobRepository {
    private static final Logger log = LoggerFactory.getLogger(MongoJobRepository.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobRepository(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * All jobs, oldest first.
     */
    @Override
    public List<Job> loadAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt")));
        List<ScheduledJobDocument> docs = mongoTemplate.find(q, ScheduledJobDocument.class);

        List<Job> jobs = new ArrayList<>(docs.size());
        for (ScheduledJobDocument doc : docs) {
            try {
                jobs.add(toJob(doc));
            } catch (RuntimeException e) {
                // one unreadable document must not keep every other job from loading
                log.error("recur4j skipping unreadable job document id={} msg={}", doc.getId(), e.getMessage(), e);
            }
        }
        return jobs;
    }

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        mongoTemplate.save(toDocument(job));
    }

    @Override
    public void deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        mongoTemplate.remove(q, ScheduledJobDocument.class);
    }

    @Override
    public void appendExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        mongoTemplate.insert(toDocument(record));
    }

    /**
     * Most recent executions across all jobs, newest first.
     */
    @Override
    public List<ExecutionRecord> recentExecutions(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query()
                .with(Sort.by(Sort.Order.desc("executedAt")))
                .limit(limit);

        List<ExecutionRecordDocument> docs = mongoTemplate.find(q, ExecutionRecordDocument.class);
        List<ExecutionRecord> records = new ArrayList<>(docs.size());
        for (ExecutionRecordDocument doc : docs) {
            records.add(toRecord(doc));
        }
        return records;
    }

    /* ================= mapping ================= */

    ScheduledJobDocument toDocument(Job job) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setRecurrenceType(job.recurrence().type());
        doc.setRecurrence(objectMapper.convertValue(job.recurrence(), new TypeReference<Map<String, Object>>() {
        }));
        doc.setActive(job.active());
        doc.setNextRunAt(job.nextRun());
        doc.setLastRunAt(job.lastRun());
        doc.setCreatedAt(job.createdAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}.
     */
    Job toJob(ScheduledJobDocument doc) {
        RecurrenceType type = Objects.requireNonNull(doc.getRecurrenceType(), "recurrenceType is missing");
        Map<String, Object> raw = doc.getRecurrence() == null ? Map.of() : doc.getRecurrence();
        Recurrence recurrence = objectMapper.convertValue(raw, type.ruleClass());

        return new Job(
                doc.getId(),
                doc.getName(),
                recurrence,
                doc.isActive(),
                doc.getNextRunAt(),
                doc.getLastRunAt(),
                doc.getCreatedAt()
        );
    }

    private static ExecutionRecordDocument toDocument(ExecutionRecord record) {
        ExecutionRecordDocument doc = new ExecutionRecordDocument();
        doc.setJobId(record.jobId());
        doc.setJobName(record.jobName());
        doc.setExecutedAt(record.executedAt());
        doc.setDurationMillis(record.duration() == null ? 0 : record.duration().toMillis());
        doc.setSuccess(record.succeeded());
        doc.setMessage(record.outcome() == null ? null : record.outcome().message());
        return doc;
    }

    private static ExecutionRecord toRecord(ExecutionRecordDocument doc) {
        ExecutionOutcome outcome = doc.isSuccess()
                ? ExecutionOutcome.succeeded(doc.getMessage())
                : ExecutionOutcome.failed(doc.getMessage());
        return new ExecutionRecord(
                doc.getJobId(),
                doc.getJobName(),
                doc.getExecutedAt(),
                Duration.ofMillis(doc.getDurationMillis()),
                outcome
        );
    }
}
