package io.recur4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.recur4j.JobCreator;
import io.recur4j.RecurringJobs;
import io.recur4j.config.Recur4jMongoIndexConfig;
import io.recur4j.config.Recur4jProperties;
import io.recur4j.core.ConversionResult;
import io.recur4j.core.CreatedJob;
import io.recur4j.core.GenerationOptions;
import io.recur4j.core.InstanceStatus;
import io.recur4j.core.JobSeries;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.core.SeriesConfig;
import io.recur4j.core.SeriesUpdate;
import io.recur4j.exception.InvalidStateException;
import io.recur4j.exception.JobCreationException;
import io.recur4j.internal.DefaultRecurringJobs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Testcontainers(disabledWithoutDocker = true)
class MongoRecurringJobsIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC);

    private MongoTemplate mongoTemplate;
    private Recur4jProperties props;
    private MongoSeriesStore seriesStore;
    private MongoInstanceStore instanceStore;
    private final AtomicInteger createdJobs = new AtomicInteger();
    private volatile boolean failJobCreation;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "recur4j_test");
        mongoTemplate.dropCollection(JobSeriesDocument.class);
        mongoTemplate.dropCollection(RecurringJobInstanceDocument.class);
        new Recur4jMongoIndexConfig(mongoTemplate).ensureIndexes();

        props = new Recur4jProperties();
        seriesStore = new MongoSeriesStore(mongoTemplate, new ObjectMapper());
        instanceStore = new MongoInstanceStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobSeriesDocument.class);
        mongoTemplate.dropCollection(RecurringJobInstanceDocument.class);
    }

    private RecurringJobs jobs() {
        JobCreator creator = draft -> {
            if (failJobCreation) {
                throw new IllegalStateException("jobs service unavailable");
            }
            return new CreatedJob("job-" + createdJobs.incrementAndGet(), "scheduled");
        };
        return new DefaultRecurringJobs(props, seriesStore, instanceStore, creator, null, null, CLOCK);
    }

    @Test
    void seriesShouldRoundTripThroughMongo() {
        RecurringJobs jobs = jobs();

        JobSeries created = jobs.createSeries(SeriesConfig.builder()
                .seriesName("Biweekly pool")
                .clientId("client-1")
                .propertyId("prop-1")
                .recurrence(RecurrenceRule.weekly(2, DayOfWeek.MONDAY))
                .startDate(LocalDate.parse("2024-01-01"))
                .endDate(LocalDate.parse("2024-12-31"))
                .estimatedDurationHours(1.5)
                .notes("Back gate")
                .build());

        JobSeries loaded = seriesStore.findById(created.id()).orElseThrow();
        assertEquals(created.recurrence(), loaded.recurrence());
        assertEquals(LocalDate.parse("2024-12-31"), loaded.endDate());
        assertEquals(1.5, loaded.estimatedDurationHours());
        assertEquals("Back gate", loaded.notes());
    }

    @Test
    void generateConvertSkipFlowShouldPersist() {
        RecurringJobs jobs = jobs();
        JobSeries series = jobs.createSeries(SeriesConfig.builder()
                .seriesName("Biweekly pool")
                .clientId("client-1")
                .recurrence(RecurrenceRule.weekly(2, DayOfWeek.MONDAY))
                .startDate(LocalDate.parse("2024-01-01"))
                .build());

        List<RecurringJobInstance> instances = jobs.generateInstances(series.id(), GenerationOptions.horizon(35));
        assertEquals(List.of(LocalDate.parse("2024-01-01"), LocalDate.parse("2024-01-15"), LocalDate.parse("2024-01-29")),
                instances.stream().map(RecurringJobInstance::scheduledDate).toList());

        ConversionResult converted = jobs.convertInstance(series.id(), instances.get(0).id());
        assertEquals(InstanceStatus.CREATED, converted.instance().status());
        assertThrows(InvalidStateException.class, () -> jobs.convertInstance(series.id(), instances.get(0).id()));
        assertEquals(1, createdJobs.get());

        jobs.updateInstanceStatus(series.id(), instances.get(1).id(), InstanceStatus.SKIPPED);

        List<RecurringJobInstance> regenerated = jobs.generateInstances(series.id(), GenerationOptions.horizon(35));
        assertEquals(InstanceStatus.CREATED, regenerated.get(0).status());
        assertEquals(converted.job().id(), regenerated.get(0).jobId());
        assertEquals(InstanceStatus.SKIPPED, regenerated.get(1).status());
        assertEquals(InstanceStatus.SCHEDULED, regenerated.get(2).status());
    }

    @Test
    void failedConversionShouldReleaseClaim() {
        RecurringJobs jobs = jobs();
        JobSeries series = jobs.createSeries(SeriesConfig.builder()
                .seriesName("Daily check")
                .clientId("client-1")
                .recurrence(RecurrenceRule.daily(1))
                .startDate(LocalDate.parse("2024-01-01"))
                .build());
        RecurringJobInstance first = jobs.generateInstances(series.id(), GenerationOptions.horizon(1)).get(0);

        failJobCreation = true;
        assertThrows(JobCreationException.class, () -> jobs.convertInstance(series.id(), first.id()));

        RecurringJobInstanceDocument raw = mongoTemplate.findById(first.id(), RecurringJobInstanceDocument.class);
        assertEquals(InstanceStatus.SCHEDULED, raw.getStatus());
        assertNull(raw.getClaimToken());

        failJobCreation = false;
        assertEquals(InstanceStatus.CREATED, jobs.convertInstance(series.id(), first.id()).instance().status());
    }

    @Test
    void archiveWithCascadeShouldCancelScheduled() {
        props.setCancelScheduledOnArchive(true);
        RecurringJobs jobs = jobs();
        JobSeries series = jobs.createSeries(SeriesConfig.builder()
                .seriesName("Daily check")
                .clientId("client-1")
                .recurrence(RecurrenceRule.daily(1))
                .startDate(LocalDate.parse("2024-01-01"))
                .build());
        List<RecurringJobInstance> instances = jobs.generateInstances(series.id(), GenerationOptions.horizon(3));
        jobs.convertInstance(series.id(), instances.get(0).id());

        jobs.archiveSeries(series.id());

        assertFalse(seriesStore.findById(series.id()).orElseThrow().active());
        List<InstanceStatus> statuses = jobs.getInstances(series.id()).stream().map(RecurringJobInstance::status).toList();
        assertEquals(List.of(InstanceStatus.CREATED, InstanceStatus.CANCELLED, InstanceStatus.CANCELLED), statuses);
    }

    @Test
    void updateShouldClearEndDate() {
        RecurringJobs jobs = jobs();
        JobSeries series = jobs.createSeries(SeriesConfig.builder()
                .seriesName("Monthly filter")
                .clientId("client-1")
                .recurrence(RecurrenceRule.monthly(1, 31))
                .startDate(LocalDate.parse("2024-01-01"))
                .endDate(LocalDate.parse("2024-06-30"))
                .build());

        jobs.updateSeries(series.id(), SeriesUpdate.builder().clearEndDate().notes("new notes").build());

        JobSeries loaded = seriesStore.findById(series.id()).orElseThrow();
        assertNull(loaded.endDate());
        assertEquals("new notes", loaded.notes());
        assertEquals(series.createdAt(), loaded.createdAt());
    }
}
