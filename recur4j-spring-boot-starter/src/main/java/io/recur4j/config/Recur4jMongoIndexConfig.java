package io.recur4j.config;

import io.recur4j.internal.mongo.ExecutionRecordDocument;
import io.recur4j.internal.mongo.ScheduledJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for recur4j.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code recur4j.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_created_at</b> on {@code recurring_jobs}: { createdAt: 1 }
 *       <br/>Used when loading jobs in creation order.</li>
 *   <li><b>idx_job_executed_at</b> on {@code job_executions}: { jobId: 1, executedAt: -1 }
 *       <br/>Per-job history, newest first.</li>
 *   <li><b>idx_executed_at</b> on {@code job_executions}: { executedAt: -1 }
 *       <br/>Recent executions across all jobs.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.recurring_jobs.createIndex({ createdAt: 1 }, { name: "idx_created_at" });
 * db.job_executions.createIndex({ jobId: 1, executedAt: -1 }, { name: "idx_job_executed_at" });
 * db.job_executions.createIndex({ executedAt: -1 }, { name: "idx_executed_at" });
 * </pre>
 */
public class Recur4jMongoIndexConfig {

    public static final String IDX_CREATED_AT = "idx_created_at";
    public static final String IDX_JOB_EXECUTED_AT = "idx_job_executed_at";
    public static final String IDX_EXECUTED_AT = "idx_executed_at";

    private final MongoTemplate mongoTemplate;

    public Recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(createdAtIndex());
        mongoTemplate.indexOps(ExecutionRecordDocument.class).ensureIndex(jobExecutedAtIndex());
        mongoTemplate.indexOps(ExecutionRecordDocument.class).ensureIndex(executedAtIndex());
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED_AT);
    }

    public static Index jobExecutedAtIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("executedAt", Sort.Direction.DESC)
                .named(IDX_JOB_EXECUTED_AT);
    }

    public static Index executedAtIndex() {
        return new Index()
                .on("executedAt", Sort.Direction.DESC)
                .named(IDX_EXECUTED_AT);
    }
}
