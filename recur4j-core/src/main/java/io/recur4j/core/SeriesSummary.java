package io.recur4j.core;

import java.time.LocalDate;

/**
 * A series together with its upcoming (today or later, not cancelled) instances.
 */
public record SeriesSummary(
        JobSeries series,
        LocalDate nextOccurrence,
        int upcomingInstanceCount
) {
}
