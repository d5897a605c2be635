package io.recur4j.internal.mongo;

import io.recur4j.core.InstanceStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for series instances.
 *
 * <p>{@code claimToken}/{@code claimUntil} are only present while a conversion is in flight.
 */
@Document(collection = "recurring_job_instances")
public class RecurringJobInstanceDocument {

    @Id
    private String id;

    private String seriesId;
    private String scheduledDate;
    private InstanceStatus status;
    private String jobId;
    private Instant createdAt;

    private String claimToken;
    private Instant claimUntil;

    public RecurringJobInstanceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public String getScheduledDate() {
        return scheduledDate;
    }

    public void setScheduledDate(String scheduledDate) {
        this.scheduledDate = scheduledDate;
    }

    public InstanceStatus getStatus() {
        return status;
    }

    public void setStatus(InstanceStatus status) {
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getClaimToken() {
        return claimToken;
    }

    public void setClaimToken(String claimToken) {
        this.claimToken = claimToken;
    }

    public Instant getClaimUntil() {
        return claimUntil;
    }

    public void setClaimUntil(Instant claimUntil) {
        this.claimUntil = claimUntil;
    }
}
