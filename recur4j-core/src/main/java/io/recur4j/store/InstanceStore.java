package io.recur4j.store;

import io.recur4j.core.InstanceStatus;
import io.recur4j.core.RecurringJobInstance;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for series instances.
 *
 * <p>Implementations must guarantee:
 * <ul>
 *   <li>at most one instance per {@code (seriesId, scheduledDate)}</li>
 *   <li>every conditional method below is atomic with respect to concurrent callers</li>
 *   <li>an instance holding a live conversion claim ({@code claimUntil > now}) is not
 *       transitioned by {@link #transition} or {@link #cancelScheduled}</li>
 * </ul>
 */
public interface InstanceStore {

    /**
     * Insert a {@code SCHEDULED} instance unless one already exists for that date.
     * A concurrent duplicate is not an error.
     *
     * @return true if a new instance was inserted
     */
    boolean insertIfAbsent(String seriesId, LocalDate scheduledDate, Instant createdAt);

    /**
     * All instances of a series, ascending by scheduled date.
     */
    List<RecurringJobInstance> findBySeries(String seriesId);

    Optional<RecurringJobInstance> findById(String seriesId, String instanceId);

    /**
     * Compare-and-set status change.
     *
     * @return the updated instance, or empty if the instance is missing, not in {@code expected},
     * or claimed for conversion
     */
    Optional<RecurringJobInstance> transition(String seriesId,
                                              String instanceId,
                                              InstanceStatus expected,
                                              InstanceStatus target,
                                              Instant now);

    /**
     * Claim a {@code SCHEDULED} instance for conversion. A claim whose {@code claimUntil} has
     * passed may be taken over.
     *
     * @return the claimed instance, or empty when it is missing, not scheduled, or claimed by someone else
     */
    Optional<RecurringJobInstance> claimForConversion(String seriesId,
                                                      String instanceId,
                                                      String claimToken,
                                                      Instant now,
                                                      Instant claimUntil);

    /**
     * Mark a claimed instance {@code CREATED} with its job id and drop the claim.
     *
     * @return the updated instance, or empty if the claim is no longer held by {@code claimToken}
     */
    Optional<RecurringJobInstance> completeConversion(String seriesId,
                                                      String instanceId,
                                                      String claimToken,
                                                      String jobId);

    /**
     * Drop a claim without changing status.
     *
     * @return true if the claim was still held by {@code claimToken}
     */
    boolean releaseConversion(String seriesId, String instanceId, String claimToken);

    /**
     * Move every unclaimed {@code SCHEDULED} instance dated {@code fromDate} or later to {@code CANCELLED}.
     *
     * @return number of cancelled instances
     */
    long cancelScheduled(String seriesId, LocalDate fromDate, Instant now);
}
