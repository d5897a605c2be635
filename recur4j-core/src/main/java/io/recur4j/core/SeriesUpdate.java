package io.recur4j.core;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Partial update of a series. Null fields are left unchanged; {@link Builder#clearEndDate()}
 * turns a bounded series into an open-ended one.
 *
 * <p>Existing instances are never rewritten by an update; a changed recurrence only affects
 * dates generated afterwards.
 */
public final class SeriesUpdate {

    private final String seriesName;
    private final String propertyId;
    private final RecurrenceRule recurrence;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final boolean clearEndDate;
    private final Boolean active;
    private final String defaultCrewId;
    private final String jobTemplateId;
    private final Double estimatedDurationHours;
    private final String serviceType;
    private final String notes;
    private final String description;

    private SeriesUpdate(Builder b) {
        this.seriesName = b.seriesName;
        this.propertyId = b.propertyId;
        this.recurrence = b.recurrence;
        this.startDate = b.startDate;
        this.endDate = b.endDate;
        this.clearEndDate = b.clearEndDate;
        this.active = b.active;
        this.defaultCrewId = b.defaultCrewId;
        this.jobTemplateId = b.jobTemplateId;
        this.estimatedDurationHours = b.estimatedDurationHours;
        this.serviceType = b.serviceType;
        this.notes = b.notes;
        this.description = b.description;
    }

    public boolean isEmpty() {
        return seriesName == null
                && propertyId == null
                && recurrence == null
                && startDate == null
                && endDate == null
                && !clearEndDate
                && active == null
                && defaultCrewId == null
                && jobTemplateId == null
                && estimatedDurationHours == null
                && serviceType == null
                && notes == null
                && description == null;
    }

    /**
     * Merged copy of {@code current}; the result is validated like a new series.
     */
    public JobSeries applyTo(JobSeries current, Instant now) {
        return new JobSeries(
                current.id(),
                pick(seriesName, current.seriesName()),
                current.clientId(),
                pick(propertyId, current.propertyId()),
                pick(recurrence, current.recurrence()),
                pick(startDate, current.startDate()),
                clearEndDate ? null : pick(endDate, current.endDate()),
                pick(defaultCrewId, current.defaultCrewId()),
                pick(jobTemplateId, current.jobTemplateId()),
                pick(estimatedDurationHours, current.estimatedDurationHours()),
                pick(serviceType, current.serviceType()),
                pick(notes, current.notes()),
                pick(description, current.description()),
                active != null ? active : current.active(),
                current.createdAt(),
                now
        );
    }

    public Boolean active() {
        return active;
    }

    private static <T> T pick(T candidate, T fallback) {
        return candidate != null ? candidate : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String seriesName;
        private String propertyId;
        private RecurrenceRule recurrence;
        private LocalDate startDate;
        private LocalDate endDate;
        private boolean clearEndDate;
        private Boolean active;
        private String defaultCrewId;
        private String jobTemplateId;
        private Double estimatedDurationHours;
        private String serviceType;
        private String notes;
        private String description;

        public Builder seriesName(String seriesName) {
            this.seriesName = seriesName;
            return this;
        }

        public Builder propertyId(String propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder recurrence(RecurrenceRule recurrence) {
            this.recurrence = recurrence;
            return this;
        }

        public Builder recurrence(RecurrenceSpec spec) {
            this.recurrence = RecurrenceRule.of(spec);
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            this.clearEndDate = false;
            return this;
        }

        public Builder clearEndDate() {
            this.endDate = null;
            this.clearEndDate = true;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder defaultCrewId(String defaultCrewId) {
            this.defaultCrewId = defaultCrewId;
            return this;
        }

        public Builder jobTemplateId(String jobTemplateId) {
            this.jobTemplateId = jobTemplateId;
            return this;
        }

        public Builder estimatedDurationHours(Double estimatedDurationHours) {
            this.estimatedDurationHours = estimatedDurationHours;
            return this;
        }

        public Builder serviceType(String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public SeriesUpdate build() {
            return new SeriesUpdate(this);
        }
    }
}
