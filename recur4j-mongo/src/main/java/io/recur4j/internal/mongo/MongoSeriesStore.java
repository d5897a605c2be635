package io.recur4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.recur4j.core.JobSeries;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.RecurrenceSpec;
import io.recur4j.store.SeriesStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for series definitions.
 */
public class MongoSeriesStore implements SeriesStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoSeriesStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public JobSeries insert(JobSeries series) {
        Objects.requireNonNull(series, "series must not be null");

        JobSeriesDocument doc = toDocument(series);
        doc.setId(null);
        return toSeries(mongoTemplate.insert(doc));
    }

    @Override
    public Optional<JobSeries> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobSeriesDocument.class))
                .map(this::toSeries);
    }

    @Override
    public List<JobSeries> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.desc("createdAt")));

        List<JobSeriesDocument> docs = mongoTemplate.find(q, JobSeriesDocument.class);
        List<JobSeries> all = new ArrayList<>(docs.size());
        for (JobSeriesDocument d : docs) {
            all.add(toSeries(d));
        }
        return all;
    }

    /**
     * Overwrites every mutable field; {@code clientId} and {@code createdAt} are kept as stored.
     */
    @Override
    public Optional<JobSeries> replace(JobSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(series.id(), "series.id must not be null");

        Update u = new Update()
                .set("seriesName", series.seriesName())
                .set("recurrence", recurrenceMap(series.recurrence()))
                .set("startDate", series.startDate().toString())
                .set("active", series.active())
                .set("updatedAt", series.updatedAt());
        setOrUnset(u, "propertyId", series.propertyId());
        setOrUnset(u, "endDate", series.endDate() == null ? null : series.endDate().toString());
        setOrUnset(u, "defaultCrewId", series.defaultCrewId());
        setOrUnset(u, "jobTemplateId", series.jobTemplateId());
        setOrUnset(u, "estimatedDurationHours", series.estimatedDurationHours());
        setOrUnset(u, "serviceType", series.serviceType());
        setOrUnset(u, "notes", series.notes());
        setOrUnset(u, "description", series.description());

        UpdateResult r = mongoTemplate.updateFirst(byId(series.id()), u, JobSeriesDocument.class);
        if (r.getMatchedCount() == 0) {
            return Optional.empty();
        }
        return findById(series.id());
    }

    @Override
    public boolean setActive(String id, boolean active, Instant updatedAt) {
        Objects.requireNonNull(id, "id must not be null");

        Update u = new Update()
                .set("active", active)
                .set("updatedAt", updatedAt);
        return mongoTemplate.updateFirst(byId(id), u, JobSeriesDocument.class).getMatchedCount() > 0;
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static void setOrUnset(Update u, String key, Object value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }

    private Map<String, Object> recurrenceMap(RecurrenceRule rule) {
        return objectMapper.convertValue(rule.toSpec(), new TypeReference<>() {
        });
    }

    private JobSeriesDocument toDocument(JobSeries series) {
        JobSeriesDocument doc = new JobSeriesDocument();
        doc.setId(series.id());
        doc.setSeriesName(series.seriesName());
        doc.setClientId(series.clientId());
        doc.setPropertyId(series.propertyId());
        doc.setRecurrence(recurrenceMap(series.recurrence()));
        doc.setStartDate(series.startDate().toString());
        doc.setEndDate(series.endDate() == null ? null : series.endDate().toString());
        doc.setDefaultCrewId(series.defaultCrewId());
        doc.setJobTemplateId(series.jobTemplateId());
        doc.setEstimatedDurationHours(series.estimatedDurationHours());
        doc.setServiceType(series.serviceType());
        doc.setNotes(series.notes());
        doc.setDescription(series.description());
        doc.setActive(series.active());
        doc.setCreatedAt(series.createdAt());
        doc.setUpdatedAt(series.updatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobSeries)}.
     */
    JobSeries toSeries(JobSeriesDocument doc) {
        RecurrenceSpec spec = objectMapper.convertValue(doc.getRecurrence(), RecurrenceSpec.class);
        return new JobSeries(
                doc.getId(),
                doc.getSeriesName(),
                doc.getClientId(),
                doc.getPropertyId(),
                RecurrenceRule.of(spec),
                LocalDate.parse(doc.getStartDate()),
                doc.getEndDate() == null ? null : LocalDate.parse(doc.getEndDate()),
                doc.getDefaultCrewId(),
                doc.getJobTemplateId(),
                doc.getEstimatedDurationHours(),
                doc.getServiceType(),
                doc.getNotes(),
                doc.getDescription(),
                doc.isActive(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
