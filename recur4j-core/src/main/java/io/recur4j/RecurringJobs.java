package io.recur4j;

import io.recur4j.core.ConversionResult;
import io.recur4j.core.GenerationOptions;
import io.recur4j.core.InstanceStatus;
import io.recur4j.core.JobSeries;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.core.SeriesConfig;
import io.recur4j.core.SeriesSummary;
import io.recur4j.core.SeriesUpdate;

import java.util.List;

/**
 * Main recurring job series API.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobSeries series = recurringJobs.createSeries(SeriesConfig.builder()
 *         .seriesName("Monthly Oak Pruning")
 *         .clientId(clientId)
 *         .recurrence(RecurrenceRule.monthly(1, 15))
 *         .startDate(LocalDate.parse("2026-01-15"))
 *         .build());
 *
 * List<RecurringJobInstance> upcoming = recurringJobs.generateInstances(series.id());
 * recurringJobs.convertInstance(series.id(), upcoming.get(0).id());
 * }</pre>
 *
 * <p>All operations are synchronous. Periodic regeneration is left to the caller (cron, timer).
 */
public interface RecurringJobs {

    JobSeries createSeries(SeriesConfig config);

    /**
     * All series, newest first.
     */
    List<JobSeries> listSeries();

    List<SeriesSummary> listSeriesSummaries();

    SeriesSummary getSeries(String seriesId);

    JobSeries updateSeries(String seriesId, SeriesUpdate update);

    /**
     * Soft delete: the series stops generating, its instances are kept.
     */
    void archiveSeries(String seriesId);

    /**
     * Materialize instances for the default horizon. Idempotent.
     */
    List<RecurringJobInstance> generateInstances(String seriesId);

    /**
     * Materialize instances for the given window. Existing instances are never modified.
     *
     * @return every instance of the series, ascending by scheduled date
     */
    List<RecurringJobInstance> generateInstances(String seriesId, GenerationOptions options);

    /**
     * Every instance of the series, ascending by scheduled date.
     */
    List<RecurringJobInstance> getInstances(String seriesId);

    /**
     * Convert a scheduled instance into a job, exactly once.
     */
    ConversionResult convertInstance(String seriesId, String instanceId);

    /**
     * Skip ({@code SKIPPED}) or re-activate ({@code SCHEDULED}) an instance.
     */
    RecurringJobInstance updateInstanceStatus(String seriesId, String instanceId, InstanceStatus status);
}
