package io.recur4j.config;

import io.recur4j.internal.mongo.JobSeriesDocument;
import io.recur4j.internal.mongo.RecurringJobInstanceDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for recurring series.
 *
 * <p>The unique {@code ux_series_date} index is part of correctness: without it two concurrent
 * generators can both insert the same date. The starter therefore always ensures it at startup
 * (see {@link #ensureRequiredIndexes()}). The remaining indexes only serve performance and are
 * <b>NOT</b> created unless {@code recur4j.ensure-indexes-on-startup=true}; in production they are
 * usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code recurring_job_instances})</h3>
 * <ul>
 *   <li><b>ux_series_date</b> (unique): { seriesId: 1, scheduledDate: 1 }
 *       <br/>Guarantees at most one instance per series and date; generation depends on it.</li>
 *   <li><b>idx_status</b>: { seriesId: 1, status: 1 }
 *       <br/>Used by archive cancellation.</li>
 *   <li><b>idx_job</b> (sparse): { jobId: 1 }
 *       <br/>Lookup from a job back to the instance it came from.</li>
 * </ul>
 *
 * <h3>Recommended indexes (collection: {@code job_series})</h3>
 * <ul>
 *   <li><b>idx_created</b>: { createdAt: -1 }
 *       <br/>Newest-first listing.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.recurring_job_instances.createIndex({ seriesId: 1, scheduledDate: 1 }, { name: "ux_series_date", unique: true });
 * db.recurring_job_instances.createIndex({ seriesId: 1, status: 1 }, { name: "idx_status" });
 * db.recurring_job_instances.createIndex({ jobId: 1 }, { name: "idx_job", sparse: true });
 * db.job_series.createIndex({ createdAt: -1 }, { name: "idx_created" });
 * </pre>
 */
public class Recur4jMongoIndexConfig {

    public static final String UX_SERIES_DATE = "ux_series_date";
    public static final String IDX_STATUS = "idx_status";
    public static final String IDX_JOB = "idx_job";
    public static final String IDX_CREATED = "idx_created";

    private final MongoTemplate mongoTemplate;

    public Recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the indexes correctness depends on. Safe to call on every startup.
     */
    public void ensureRequiredIndexes() {
        mongoTemplate.indexOps(RecurringJobInstanceDocument.class).ensureIndex(seriesDateUniqueIndex());
    }

    /**
     * Create all indexes above. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        ensureRequiredIndexes();
        mongoTemplate.indexOps(RecurringJobInstanceDocument.class).ensureIndex(statusIndex());
        mongoTemplate.indexOps(RecurringJobInstanceDocument.class).ensureIndex(jobIndex());
        mongoTemplate.indexOps(JobSeriesDocument.class).ensureIndex(createdIndex());
    }

    public static Index seriesDateUniqueIndex() {
        return new Index()
                .on("seriesId", Sort.Direction.ASC)
                .on("scheduledDate", Sort.Direction.ASC)
                .unique()
                .named(UX_SERIES_DATE);
    }

    public static Index statusIndex() {
        return new Index()
                .on("seriesId", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_STATUS);
    }

    public static Index jobIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .sparse()
                .named(IDX_JOB);
    }

    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_CREATED);
    }
}
