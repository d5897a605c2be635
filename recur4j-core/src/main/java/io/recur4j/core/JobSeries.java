package io.recur4j.core;

import io.recur4j.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persistent recurrence definition. {@code id} is null until the series has been stored.
 */
public record JobSeries(

        // identity
        String id,
        String seriesName,
        String clientId,
        String propertyId,

        // recurrence
        RecurrenceRule recurrence,
        LocalDate startDate,
        LocalDate endDate,

        // job seed
        String defaultCrewId,
        String jobTemplateId,
        Double estimatedDurationHours,
        String serviceType,
        String notes,
        String description,

        // archival flag
        boolean active,

        Instant createdAt,
        Instant updatedAt
) {
    public JobSeries {
        if (seriesName == null || seriesName.isBlank()) {
            throw new ValidationException("seriesName must not be blank");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("clientId must not be blank");
        }
        if (recurrence == null) {
            throw new ValidationException("recurrence must not be null");
        }
        if (startDate == null) {
            throw new ValidationException("startDate must not be null");
        }
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("endDate " + endDate + " must not be before startDate " + startDate);
        }
        if (estimatedDurationHours != null && estimatedDurationHours < 0) {
            throw new ValidationException("estimatedDurationHours must not be negative");
        }
    }

    public JobSeries withId(String id) {
        return new JobSeries(id, seriesName, clientId, propertyId, recurrence, startDate, endDate,
                defaultCrewId, jobTemplateId, estimatedDurationHours, serviceType, notes, description,
                active, createdAt, updatedAt);
    }

    public JobSeries withActive(boolean active, Instant updatedAt) {
        return new JobSeries(id, seriesName, clientId, propertyId, recurrence, startDate, endDate,
                defaultCrewId, jobTemplateId, estimatedDurationHours, serviceType, notes, description,
                active, createdAt, updatedAt);
    }
}
