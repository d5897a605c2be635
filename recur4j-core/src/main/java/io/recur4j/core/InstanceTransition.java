package io.recur4j.core;

import io.recur4j.exception.InvalidStateException;
import io.recur4j.exception.ValidationException;

import java.util.Locale;
import java.util.Objects;

/**
 * The transitions an instance may take. Anything not listed here is rejected.
 */
public enum InstanceTransition {

    /** Only reachable through job conversion. */
    CONVERT(InstanceStatus.SCHEDULED, InstanceStatus.CREATED),
    SKIP(InstanceStatus.SCHEDULED, InstanceStatus.SKIPPED),
    REACTIVATE(InstanceStatus.SKIPPED, InstanceStatus.SCHEDULED),
    /** Only reachable through series archival. */
    CANCEL(InstanceStatus.SCHEDULED, InstanceStatus.CANCELLED);

    private final InstanceStatus from;
    private final InstanceStatus to;

    InstanceTransition(InstanceStatus from, InstanceStatus to) {
        this.from = from;
        this.to = to;
    }

    public InstanceStatus from() {
        return from;
    }

    public InstanceStatus to() {
        return to;
    }

    public boolean appliesTo(InstanceStatus current) {
        return current == from;
    }

    /**
     * @throws InvalidStateException if this transition cannot start from {@code current}
     */
    public void requireApplicable(InstanceStatus current) {
        if (!appliesTo(current)) {
            throw new InvalidStateException(
                    "Cannot " + name().toLowerCase(Locale.ROOT) + " an instance in status " + current
                            + "; expected " + from);
        }
    }

    /**
     * Maps a status requested by a user to the transition that reaches it.
     * Only {@code SKIPPED} and {@code SCHEDULED} can be requested directly.
     */
    public static InstanceTransition requestedTarget(InstanceStatus target) {
        Objects.requireNonNull(target, "target must not be null");
        return switch (target) {
            case SKIPPED -> SKIP;
            case SCHEDULED -> REACTIVATE;
            case CREATED, CANCELLED -> throw new ValidationException("Unsupported recurring status update: " + target);
        };
    }
}
