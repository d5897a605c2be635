package io.recur4j.internal;

import io.recur4j.config.Recur4jProperties;
import io.recur4j.core.GenerationOptions;
import io.recur4j.core.JobSeries;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.exception.NotFoundException;
import io.recur4j.exception.ValidationException;
import io.recur4j.store.InstanceStore;
import io.recur4j.store.SeriesStore;
import io.recur4j.utils.DateSequenceGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Materializes series instances for a forward window.
 *
 * <p>Generation only ever inserts missing dates. Instances that already exist keep their status
 * and job id, so repeated or overlapping runs converge on the same instance set.
 */
public class SeriesScheduler {
    private static final Logger log = LoggerFactory.getLogger(SeriesScheduler.class);

    private final SeriesStore seriesStore;
    private final InstanceStore instanceStore;
    private final Recur4jProperties props;
    private final Clock clock;

    public SeriesScheduler(SeriesStore seriesStore, InstanceStore instanceStore, Recur4jProperties props, Clock clock) {
        this.seriesStore = Objects.requireNonNull(seriesStore, "seriesStore must not be null");
        this.instanceStore = Objects.requireNonNull(instanceStore, "instanceStore must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<RecurringJobInstance> generateInstances(String seriesId, GenerationOptions options) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        if (options == null) {
            options = GenerationOptions.defaults();
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate windowEnd = resolveWindowEnd(today, options);

        JobSeries series = seriesStore.findById(seriesId)
                .orElseThrow(() -> NotFoundException.series(seriesId));
        if (!series.active()) {
            throw new ValidationException("Recurring series is archived: " + seriesId);
        }

        List<LocalDate> dates = DateSequenceGenerator.generate(
                series.recurrence(),
                series.startDate(),
                series.endDate(),
                today,
                windowEnd,
                Math.max(1, props.getMaxOccurrencesPerRun())
        );

        Instant now = clock.instant();
        int inserted = 0;
        for (LocalDate date : dates) {
            if (instanceStore.insertIfAbsent(seriesId, date, now)) {
                inserted++;
            }
        }

        log.debug("Series generation seriesId={} pattern={} window={}..{} candidates={} inserted={}",
                seriesId, series.recurrence().pattern(), today, windowEnd, dates.size(), inserted);

        return instanceStore.findBySeries(seriesId);
    }

    // Window is [today, today + horizonDays), or [today, untilDate] when untilDate is given.
    private LocalDate resolveWindowEnd(LocalDate today, GenerationOptions options) {
        if (options.untilDate() != null) {
            if (options.untilDate().isBefore(today)) {
                throw new ValidationException("untilDate " + options.untilDate() + " must not be before today " + today);
            }
            return options.untilDate();
        }

        int horizonDays = options.horizonDays() != null ? options.horizonDays() : props.getDefaultHorizonDays();
        if (horizonDays <= 0) {
            throw new ValidationException("horizonDays must be a positive number: " + horizonDays);
        }
        return today.plusDays(horizonDays - 1L);
    }
}
