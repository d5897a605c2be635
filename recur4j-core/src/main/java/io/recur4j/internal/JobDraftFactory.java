package io.recur4j.internal;

import io.recur4j.ClientDirectory;
import io.recur4j.CrewDirectory;
import io.recur4j.core.ClientInfo;
import io.recur4j.core.JobDraft;
import io.recur4j.core.JobSeries;
import io.recur4j.core.PropertyInfo;
import io.recur4j.core.RecurringJobInstance;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Seeds a {@link JobDraft} from a series and one of its instances.
 */
public class JobDraftFactory {

    static final String FALLBACK_CUSTOMER_NAME = "Recurring Client";

    private final ClientDirectory clients;
    private final CrewDirectory crews;

    public JobDraftFactory(ClientDirectory clients, CrewDirectory crews) {
        this.clients = Objects.requireNonNull(clients, "clients must not be null");
        this.crews = Objects.requireNonNull(crews, "crews must not be null");
    }

    public JobDraft draftFor(JobSeries series, RecurringJobInstance instance) {
        Optional<ClientInfo> client = clients.findClient(series.clientId());

        String customerName = client.map(ClientInfo::displayName).orElse(null);
        if (customerName == null) {
            customerName = FALLBACK_CUSTOMER_NAME;
        }

        // property address first, then the client's billing address
        String location = null;
        if (series.propertyId() != null) {
            location = clients.findProperty(series.propertyId())
                    .map(PropertyInfo::formattedAddress)
                    .orElse(null);
        }
        if (location == null) {
            location = client.map(ClientInfo::billingAddressLine1).orElse(null);
        }

        List<String> assignedCrew = series.defaultCrewId() == null
                ? List.of()
                : crews.activeMemberIds(series.defaultCrewId());

        return new JobDraft(
                series.id(),
                instance.id(),
                series.clientId(),
                series.propertyId(),
                customerName,
                location,
                instance.scheduledDate(),
                series.estimatedDurationHours(),
                series.defaultCrewId(),
                assignedCrew,
                series.jobTemplateId(),
                series.seriesName(),
                series.serviceType(),
                series.notes()
        );
    }
}
