package io.recur4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.recur4j.core.InstanceStatus;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.store.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for series instances.
 *
 * <p>Uniqueness of {@code (seriesId, scheduledDate)} relies on the {@code ux_series_date} unique
 * index. Every state change is a single conditional {@code findAndModify}/{@code update}, so
 * concurrent callers on different nodes see each transition exactly once.
 */
public class MongoInstanceStore implements InstanceStore {
    private static final Logger log = LoggerFactory.getLogger(MongoInstanceStore.class);

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    public MongoInstanceStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public boolean insertIfAbsent(String seriesId, LocalDate scheduledDate, Instant createdAt) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(scheduledDate, "scheduledDate must not be null");

        Query q = new Query(
                Criteria.where("seriesId").is(seriesId)
                        .and("scheduledDate").is(scheduledDate.toString())
        );
        Update u = new Update()
                .setOnInsert("seriesId", seriesId)
                .setOnInsert("scheduledDate", scheduledDate.toString())
                .setOnInsert("status", InstanceStatus.SCHEDULED)
                .setOnInsert("createdAt", createdAt);

        try {
            return mongoTemplate.upsert(q, u, RecurringJobInstanceDocument.class).getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            // lost the upsert race to another generator
            log.debug("Instance already exists seriesId={} date={}", seriesId, scheduledDate);
            return false;
        }
    }

    @Override
    public List<RecurringJobInstance> findBySeries(String seriesId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");

        Query q = new Query(Criteria.where("seriesId").is(seriesId))
                .with(Sort.by(Sort.Order.asc("scheduledDate")));

        List<RecurringJobInstanceDocument> docs = mongoTemplate.find(q, RecurringJobInstanceDocument.class);
        List<RecurringJobInstance> instances = new ArrayList<>(docs.size());
        for (RecurringJobInstanceDocument d : docs) {
            instances.add(toInstance(d));
        }
        return instances;
    }

    @Override
    public Optional<RecurringJobInstance> findById(String seriesId, String instanceId) {
        return Optional.ofNullable(mongoTemplate.findOne(new Query(byId(seriesId, instanceId)), RecurringJobInstanceDocument.class))
                .map(MongoInstanceStore::toInstance);
    }

    @Override
    public Optional<RecurringJobInstance> transition(String seriesId, String instanceId,
                                                     InstanceStatus expected, InstanceStatus target,
                                                     Instant now) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(target, "target must not be null");

        Query q = new Query(
                byId(seriesId, instanceId)
                        .and("status").is(expected)
                        .andOperator(claimFree(now))
        );
        Update u = new Update().set("status", target);

        return modify(q, u);
    }

    /**
     * Atomically claims a scheduled instance.
     *
     * <p>Claimable when {@code status == SCHEDULED} and there is no live claim:
     * {@code claimUntil == null || claimUntil <= now}.
     */
    @Override
    public Optional<RecurringJobInstance> claimForConversion(String seriesId, String instanceId,
                                                             String claimToken, Instant now,
                                                             Instant claimUntil) {
        Objects.requireNonNull(claimToken, "claimToken must not be null");
        Objects.requireNonNull(claimUntil, "claimUntil must not be null");

        Query q = new Query(
                byId(seriesId, instanceId)
                        .and("status").is(InstanceStatus.SCHEDULED)
                        .andOperator(claimFree(now))
        );
        Update u = new Update()
                .set("claimToken", claimToken)
                .set("claimUntil", claimUntil);

        return modify(q, u);
    }

    @Override
    public Optional<RecurringJobInstance> completeConversion(String seriesId, String instanceId,
                                                             String claimToken, String jobId) {
        Objects.requireNonNull(claimToken, "claimToken must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");

        Query q = new Query(
                byId(seriesId, instanceId)
                        // a caller whose claim was taken over must not write back
                        .and("claimToken").is(claimToken)
        );
        Update u = new Update()
                .set("status", InstanceStatus.CREATED)
                .set("jobId", jobId)
                .unset("claimToken")
                .unset("claimUntil");

        return modify(q, u);
    }

    @Override
    public boolean releaseConversion(String seriesId, String instanceId, String claimToken) {
        Objects.requireNonNull(claimToken, "claimToken must not be null");

        Query q = new Query(byId(seriesId, instanceId).and("claimToken").is(claimToken));
        Update u = new Update()
                .unset("claimToken")
                .unset("claimUntil");

        return mongoTemplate.updateFirst(q, u, RecurringJobInstanceDocument.class).getModifiedCount() > 0;
    }

    @Override
    public long cancelScheduled(String seriesId, LocalDate fromDate, Instant now) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(fromDate, "fromDate must not be null");

        // ISO dates compare correctly as strings
        Query q = new Query(
                Criteria.where("seriesId").is(seriesId)
                        .and("status").is(InstanceStatus.SCHEDULED)
                        .and("scheduledDate").gte(fromDate.toString())
                        .andOperator(claimFree(now))
        );
        Update u = new Update().set("status", InstanceStatus.CANCELLED);

        UpdateResult r = mongoTemplate.updateMulti(q, u, RecurringJobInstanceDocument.class);
        return r.getModifiedCount();
    }

    private Optional<RecurringJobInstance> modify(Query q, Update u) {
        RecurringJobInstanceDocument doc = mongoTemplate.findAndModify(q, u, RETURN_NEW, RecurringJobInstanceDocument.class);
        return Optional.ofNullable(doc).map(MongoInstanceStore::toInstance);
    }

    private static Criteria byId(String seriesId, String instanceId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(instanceId, "instanceId must not be null");
        return Criteria.where("_id").is(instanceId).and("seriesId").is(seriesId);
    }

    private static Criteria claimFree(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return new Criteria().orOperator(
                Criteria.where("claimUntil").is(null),
                Criteria.where("claimUntil").lte(now)
        );
    }

    static RecurringJobInstance toInstance(RecurringJobInstanceDocument doc) {
        return new RecurringJobInstance(
                doc.getId(),
                doc.getSeriesId(),
                LocalDate.parse(doc.getScheduledDate()),
                doc.getStatus(),
                doc.getJobId(),
                doc.getCreatedAt()
        );
    }
}
