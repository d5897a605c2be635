package io.recur4j.internal;

import io.recur4j.core.InstanceStatus;
import io.recur4j.core.InstanceTransition;
import io.recur4j.core.RecurringJobInstance;
import io.recur4j.exception.InvalidStateException;
import io.recur4j.exception.NotFoundException;
import io.recur4j.store.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Applies user and archival transitions to instances. Conversion has its own path through
 * {@link JobConversionService}.
 */
public class InstanceLifecycle {
    private static final Logger log = LoggerFactory.getLogger(InstanceLifecycle.class);

    private final InstanceStore instanceStore;
    private final Clock clock;

    public InstanceLifecycle(InstanceStore instanceStore, Clock clock) {
        this.instanceStore = Objects.requireNonNull(instanceStore, "instanceStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Move an instance to a user-requested status ({@code SKIPPED} or {@code SCHEDULED}).
     */
    public RecurringJobInstance requestStatus(String seriesId, String instanceId, InstanceStatus target) {
        return apply(seriesId, instanceId, InstanceTransition.requestedTarget(target));
    }

    public RecurringJobInstance apply(String seriesId, String instanceId, InstanceTransition transition) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(instanceId, "instanceId must not be null");
        Objects.requireNonNull(transition, "transition must not be null");
        if (transition == InstanceTransition.CONVERT) {
            throw new IllegalArgumentException("CONVERT is only applied by job conversion");
        }

        RecurringJobInstance current = instanceStore.findById(seriesId, instanceId)
                .orElseThrow(() -> NotFoundException.instance(seriesId, instanceId));
        transition.requireApplicable(current.status());

        RecurringJobInstance updated = instanceStore.transition(
                        seriesId, instanceId, transition.from(), transition.to(), clock.instant())
                .orElseThrow(() -> new InvalidStateException(
                        "Instance " + instanceId + " changed concurrently or is being converted; "
                                + transition.name().toLowerCase(Locale.ROOT) + " not applied"));

        log.info("Recurring instance {} seriesId={} instanceId={} date={} status={}",
                transition.name().toLowerCase(Locale.ROOT), seriesId, instanceId, updated.scheduledDate(), updated.status());
        return updated;
    }

    /**
     * Cancel every unclaimed scheduled instance of the series dated today or later.
     */
    public long cancelRemaining(String seriesId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        long cancelled = instanceStore.cancelScheduled(seriesId, LocalDate.now(clock), clock.instant());
        log.info("Recurring series cancelled remaining instances seriesId={} cancelled={}", seriesId, cancelled);
        return cancelled;
    }
}
