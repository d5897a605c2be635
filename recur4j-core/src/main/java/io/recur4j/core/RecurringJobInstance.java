package io.recur4j.core;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One concrete occurrence of a series. {@code jobId} is present iff {@code status == CREATED}.
 */
public record RecurringJobInstance(
        String id,
        String seriesId,
        LocalDate scheduledDate,
        InstanceStatus status,
        String jobId,
        Instant createdAt
) {
}
