package io.recur4j.core;

/**
 * Job returned by the external job creator.
 */
public record CreatedJob(
        String id,
        String status
) {
}
