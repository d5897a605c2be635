package io.recur4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for series definitions.
 *
 * <p>Calendar dates are stored as ISO {@code yyyy-MM-dd} strings so they never shift with the
 * server timezone. {@code recurrence} holds the flat recurrence form.
 */
@Document(collection = "job_series")
public class JobSeriesDocument {

    @Id
    private String id;

    private String seriesName;
    private String clientId;
    private String propertyId;

    private Map<String, Object> recurrence;
    private String startDate;
    private String endDate;

    private String defaultCrewId;
    private String jobTemplateId;
    private Double estimatedDurationHours;
    private String serviceType;
    private String notes;
    private String description;

    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public JobSeriesDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSeriesName() {
        return seriesName;
    }

    public void setSeriesName(String seriesName) {
        this.seriesName = seriesName;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public void setPropertyId(String propertyId) {
        this.propertyId = propertyId;
    }

    public Map<String, Object> getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Map<String, Object> recurrence) {
        this.recurrence = recurrence;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public String getDefaultCrewId() {
        return defaultCrewId;
    }

    public void setDefaultCrewId(String defaultCrewId) {
        this.defaultCrewId = defaultCrewId;
    }

    public String getJobTemplateId() {
        return jobTemplateId;
    }

    public void setJobTemplateId(String jobTemplateId) {
        this.jobTemplateId = jobTemplateId;
    }

    public Double getEstimatedDurationHours() {
        return estimatedDurationHours;
    }

    public void setEstimatedDurationHours(Double estimatedDurationHours) {
        this.estimatedDurationHours = estimatedDurationHours;
    }

    public String getServiceType() {
        return serviceType;
    }

    public void setServiceType(String serviceType) {
        this.serviceType = serviceType;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
