package io.recur4j.core;

/**
 * Status of a single recurring job instance.
 *
 * <pre>
 * SCHEDULED --convert--> CREATED (terminal)
 * SCHEDULED --skip-----> SKIPPED --reactivate--> SCHEDULED
 * SCHEDULED --cancel---> CANCELLED
 * </pre>
 */
public enum InstanceStatus {
    SCHEDULED,
    CREATED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this == CREATED;
    }
}
