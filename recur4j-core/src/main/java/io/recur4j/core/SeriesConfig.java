package io.recur4j.core;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Input for creating a new series.
 *
 * <p>This is an API-layer object; validation of field combinations happens when it is turned
 * into a {@link JobSeries}.
 */
public final class SeriesConfig {

    private final String seriesName;
    private final String clientId;
    private final String propertyId;
    private final RecurrenceRule recurrence;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final String defaultCrewId;
    private final String jobTemplateId;
    private final Double estimatedDurationHours;
    private final String serviceType;
    private final String notes;
    private final String description;

    private SeriesConfig(Builder b) {
        this.seriesName = b.seriesName;
        this.clientId = b.clientId;
        this.propertyId = blankToNull(b.propertyId);
        this.recurrence = b.recurrence;
        this.startDate = b.startDate;
        this.endDate = b.endDate;
        this.defaultCrewId = blankToNull(b.defaultCrewId);
        this.jobTemplateId = blankToNull(b.jobTemplateId);
        this.estimatedDurationHours = b.estimatedDurationHours;
        this.serviceType = blankToNull(b.serviceType);
        this.notes = blankToNull(b.notes);
        this.description = blankToNull(b.description);
    }

    public String seriesName() {
        return seriesName;
    }

    public String clientId() {
        return clientId;
    }

    public String propertyId() {
        return propertyId;
    }

    public RecurrenceRule recurrence() {
        return recurrence;
    }

    public LocalDate startDate() {
        return startDate;
    }

    public LocalDate endDate() {
        return endDate;
    }

    /**
     * New, active and not yet persisted series.
     *
     * @throws io.recur4j.exception.ValidationException if the configuration is inconsistent
     */
    public JobSeries toSeries(Instant now) {
        return new JobSeries(
                null,
                seriesName,
                clientId,
                propertyId,
                recurrence,
                startDate,
                endDate,
                defaultCrewId,
                jobTemplateId,
                estimatedDurationHours,
                serviceType,
                notes,
                description,
                true,
                now,
                now
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static final class Builder {
        private String seriesName;
        private String clientId;
        private String propertyId;
        private RecurrenceRule recurrence;
        private LocalDate startDate;
        private LocalDate endDate;
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

        public Builder clientId(String clientId) {
            this.clientId = clientId;
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

        /**
         * Flat form, e.g. as received from a form post.
         */
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

        public SeriesConfig build() {
            return new SeriesConfig(this);
        }
    }
}
