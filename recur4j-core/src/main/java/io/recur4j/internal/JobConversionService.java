package io.recur4j.internal;

import io.recur4j.JobCreator;
import io.recur4j.core.ConversionResult;
import io.recur4j.core.CreatedJob;
import io.recur4j.core.InstanceTransition;
import io.recur4j.core.JobDraft;
import io.recur4j.core.JobSeries;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.exception.InvalidStateException;
import io.recur4j.exception.JobCreationException;
import io.recur4j.exception.NotFoundException;
import io.recur4j.store.InstanceStore;
import io.recur4j.store.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Converts a scheduled instance into a job, exactly once.
 *
 * <p>Conversion runs as claim / create / complete:
 * <ol>
 *   <li>the instance is atomically claimed (status must be SCHEDULED, no live claim)</li>
 *   <li>the external {@link JobCreator} is called with a draft seeded from the series</li>
 *   <li>the instance becomes CREATED with the job id, guarded by the claim token</li>
 * </ol>
 * If drafting or job creation fails the claim is released and the instance is left as it was, so the call
 * can be retried. A claim left behind by a crashed caller expires after the configured lock lifetime.
 */
public class JobConversionService {
    private static final Logger log = LoggerFactory.getLogger(JobConversionService.class);

    private final SeriesStore seriesStore;
    private final InstanceStore instanceStore;
    private final JobCreator jobCreator;
    private final JobDraftFactory draftFactory;
    private final Duration lockLifetime;
    private final Clock clock;

    public JobConversionService(SeriesStore seriesStore,
                                InstanceStore instanceStore,
                                JobCreator jobCreator,
                                JobDraftFactory draftFactory,
                                Duration lockLifetime,
                                Clock clock) {
        this.seriesStore = Objects.requireNonNull(seriesStore, "seriesStore must not be null");
        this.instanceStore = Objects.requireNonNull(instanceStore, "instanceStore must not be null");
        this.jobCreator = Objects.requireNonNull(jobCreator, "jobCreator must not be null");
        this.draftFactory = Objects.requireNonNull(draftFactory, "draftFactory must not be null");
        this.lockLifetime = Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ConversionResult convert(String seriesId, String instanceId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(instanceId, "instanceId must not be null");

        JobSeries series = seriesStore.findById(seriesId)
                .orElseThrow(() -> NotFoundException.series(seriesId));

        String claimToken = UUID.randomUUID().toString();
        Instant now = clock.instant();
        RecurringJobInstance claimed = instanceStore
                .claimForConversion(seriesId, instanceId, claimToken, now, now.plus(lockLifetime))
                .orElseThrow(() -> rejectedClaim(seriesId, instanceId));

        CreatedJob job;
        try {
            // directory lookups may fail too; the claim is released either way
            JobDraft draft = draftFactory.draftFor(series, claimed);
            job = jobCreator.createJob(draft);
            if (job == null || job.id() == null || job.id().isBlank()) {
                throw new IllegalStateException("JobCreator returned no job id");
            }
        } catch (Exception e) {
            log.warn("Recurring conversion failed seriesId={} instanceId={} date={} msg={}",
                    seriesId, instanceId, claimed.scheduledDate(), e.getMessage(), e);
            JobCreationException failure = new JobCreationException(
                    "Job creation failed for recurring visit " + instanceId + " on " + claimed.scheduledDate(), e);
            release(seriesId, instanceId, claimToken, failure);
            throw failure;
        }

        String jobId = job.id();
        RecurringJobInstance created = instanceStore.completeConversion(seriesId, instanceId, claimToken, jobId)
                .orElseThrow(() -> {
                    // The job exists in the external system; it is not rolled back here.
                    log.error("Recurring conversion lost its claim after job creation seriesId={} instanceId={} jobId={}",
                            seriesId, instanceId, jobId);
                    return new InvalidStateException(
                            "Conversion claim on instance " + instanceId + " expired before job " + jobId + " was recorded");
                });

        log.info("Recurring instance converted seriesId={} instanceId={} date={} jobId={}",
                seriesId, instanceId, created.scheduledDate(), jobId);
        return new ConversionResult(created, job);
    }

    private RuntimeException rejectedClaim(String seriesId, String instanceId) {
        RecurringJobInstance current = instanceStore.findById(seriesId, instanceId)
                .orElse(null);
        if (current == null) {
            return NotFoundException.instance(seriesId, instanceId);
        }
        if (!InstanceTransition.CONVERT.appliesTo(current.status())) {
            return new InvalidStateException(
                    "Only scheduled visits can be converted into jobs; instance " + instanceId
                            + " is " + current.status());
        }
        return new InvalidStateException("Conversion of instance " + instanceId + " is already in progress");
    }

    private void release(String seriesId, String instanceId, String claimToken, JobCreationException failure) {
        try {
            if (!instanceStore.releaseConversion(seriesId, instanceId, claimToken)) {
                log.warn("Recurring conversion claim already gone seriesId={} instanceId={}", seriesId, instanceId);
            }
        } catch (RuntimeException releaseEx) {
            log.error("Recurring conversion claim release failed seriesId={} instanceId={} msg={}",
                    seriesId, instanceId, releaseEx.getMessage(), releaseEx);
            failure.addSuppressed(releaseEx);
        }
    }
}
