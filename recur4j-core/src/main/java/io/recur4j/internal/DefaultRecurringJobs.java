package io.recur4j.internal;

import io.recur4j.ClientDirectory;
import io.recur4j.CrewDirectory;
import io.recur4j.JobCreator;
import io.recur4j.RecurringJobs;
import io.recur4j.config.Recur4jProperties;
import io.recur4j.core.ConversionResult;
import io.recur4j.core.GenerationOptions;
import io.recur4j.core.InstanceStatus;
import io.recur4j.core.JobSeries;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.core.SeriesConfig;
import io.recur4j.core.SeriesSummary;
import io.recur4j.core.SeriesUpdate;
import io.recur4j.exception.NotFoundException;
import io.recur4j.exception.ValidationException;
import io.recur4j.store.InstanceStore;
import io.recur4j.store.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link RecurringJobs} implementation over a {@link SeriesStore} and an {@link InstanceStore}.
 *
 * <p>Holds no state between calls; everything is addressed by id through the stores.
 */
public class DefaultRecurringJobs implements RecurringJobs {
    private static final Logger log = LoggerFactory.getLogger(DefaultRecurringJobs.class);

    private final Recur4jProperties props;
    private final SeriesStore seriesStore;
    private final InstanceStore instanceStore;
    private final Clock clock;

    private final SeriesScheduler scheduler;
    private final InstanceLifecycle lifecycle;
    private final JobConversionService conversionService;

    public DefaultRecurringJobs(Recur4jProperties props,
                                SeriesStore seriesStore,
                                InstanceStore instanceStore,
                                JobCreator jobCreator,
                                ClientDirectory clientDirectory,
                                CrewDirectory crewDirectory) {
        this(props, seriesStore, instanceStore, jobCreator, clientDirectory, crewDirectory, props.clock());
    }

    public DefaultRecurringJobs(Recur4jProperties props,
                                SeriesStore seriesStore,
                                InstanceStore instanceStore,
                                JobCreator jobCreator,
                                ClientDirectory clientDirectory,
                                CrewDirectory crewDirectory,
                                Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.seriesStore = Objects.requireNonNull(seriesStore, "seriesStore must not be null");
        this.instanceStore = Objects.requireNonNull(instanceStore, "instanceStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.scheduler = new SeriesScheduler(seriesStore, instanceStore, props, clock);
        this.lifecycle = new InstanceLifecycle(instanceStore, clock);
        this.conversionService = new JobConversionService(
                seriesStore,
                instanceStore,
                jobCreator,
                new JobDraftFactory(
                        clientDirectory != null ? clientDirectory : ClientDirectory.none(),
                        crewDirectory != null ? crewDirectory : CrewDirectory.none()
                ),
                props.getConversionLockLifetime(),
                clock
        );
    }

    @Override
    public JobSeries createSeries(SeriesConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        JobSeries created = seriesStore.insert(config.toSeries(clock.instant()));
        log.info("Recurring series created id={} name={} pattern={} startDate={} endDate={}",
                created.id(), created.seriesName(), created.recurrence().pattern(),
                created.startDate(), created.endDate());
        return created;
    }

    @Override
    public List<JobSeries> listSeries() {
        return seriesStore.findAll();
    }

    @Override
    public List<SeriesSummary> listSeriesSummaries() {
        List<JobSeries> all = seriesStore.findAll();
        List<SeriesSummary> summaries = new ArrayList<>(all.size());
        for (JobSeries series : all) {
            summaries.add(summarize(series));
        }
        return summaries;
    }

    @Override
    public SeriesSummary getSeries(String seriesId) {
        return summarize(requireSeries(seriesId));
    }

    @Override
    public JobSeries updateSeries(String seriesId, SeriesUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        JobSeries current = requireSeries(seriesId);
        if (update.isEmpty()) {
            return current;
        }

        JobSeries merged = update.applyTo(current, clock.instant());
        JobSeries stored = seriesStore.replace(merged)
                .orElseThrow(() -> NotFoundException.series(seriesId));
        log.info("Recurring series updated id={} active={} pattern={}",
                stored.id(), stored.active(), stored.recurrence().pattern());
        return stored;
    }

    @Override
    public void archiveSeries(String seriesId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        if (!seriesStore.setActive(seriesId, false, clock.instant())) {
            throw NotFoundException.series(seriesId);
        }
        log.info("Recurring series archived id={}", seriesId);

        if (props.isCancelScheduledOnArchive()) {
            lifecycle.cancelRemaining(seriesId);
        }
    }

    @Override
    public List<RecurringJobInstance> generateInstances(String seriesId) {
        return scheduler.generateInstances(seriesId, GenerationOptions.defaults());
    }

    @Override
    public List<RecurringJobInstance> generateInstances(String seriesId, GenerationOptions options) {
        return scheduler.generateInstances(seriesId, options);
    }

    @Override
    public List<RecurringJobInstance> getInstances(String seriesId) {
        requireSeries(seriesId);
        return instanceStore.findBySeries(seriesId);
    }

    @Override
    public ConversionResult convertInstance(String seriesId, String instanceId) {
        return conversionService.convert(seriesId, instanceId);
    }

    @Override
    public RecurringJobInstance updateInstanceStatus(String seriesId, String instanceId, InstanceStatus status) {
        if (status == null) {
            throw new ValidationException("status must not be null");
        }
        return lifecycle.requestStatus(seriesId, instanceId, status);
    }

    private JobSeries requireSeries(String seriesId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        return seriesStore.findById(seriesId)
                .orElseThrow(() -> NotFoundException.series(seriesId));
    }

    private SeriesSummary summarize(JobSeries series) {
        LocalDate today = LocalDate.now(clock);
        LocalDate next = null;
        int upcoming = 0;
        for (RecurringJobInstance instance : instanceStore.findBySeries(series.id())) {
            if (instance.status() == InstanceStatus.CANCELLED || instance.scheduledDate().isBefore(today)) {
                continue;
            }
            if (next == null || instance.scheduledDate().isBefore(next)) {
                next = instance.scheduledDate();
            }
            upcoming++;
        }
        return new SeriesSummary(series, next, upcoming);
    }
}
