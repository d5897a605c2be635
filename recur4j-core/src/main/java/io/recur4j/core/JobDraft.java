package io.recur4j.core;

import java.time.LocalDate;
import java.util.List;

/**
 * Fields handed to the job creator when an instance is converted, seeded from the series.
 */
public record JobDraft(

        // origin
        String seriesId,
        String instanceId,

        // customer
        String clientId,
        String propertyId,
        String customerName,
        String jobLocation,

        // schedule
        LocalDate scheduledDate,
        Double estimatedHours,

        // crew & template
        String crewId,
        List<String> assignedCrew,
        String jobTemplateId,

        // description
        String title,
        String serviceType,
        String specialInstructions
) {
    public JobDraft {
        assignedCrew = assignedCrew == null ? List.of() : List.copyOf(assignedCrew);
    }
}
