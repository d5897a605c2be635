package io.recur4j.store;

import io.recur4j.core.InstanceStatus;
import io.recur4j.core.RecurringJobInstance;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Single-lock stand-in for a database with a unique (seriesId, scheduledDate) index.
 */
public class InMemoryInstanceStore implements InstanceStore {

    private static final class Row {
        RecurringJobInstance instance;
        String claimToken;
        Instant claimUntil;

        Row(RecurringJobInstance instance) {
            this.instance = instance;
        }

        boolean claimFree(Instant now) {
            return claimUntil == null || !claimUntil.isAfter(now);
        }

        void setStatus(InstanceStatus status, String jobId) {
            instance = new RecurringJobInstance(instance.id(), instance.seriesId(), instance.scheduledDate(),
                    status, jobId, instance.createdAt());
        }
    }

    private final Map<String, Row> rows = new LinkedHashMap<>();

    @Override
    public synchronized boolean insertIfAbsent(String seriesId, LocalDate scheduledDate, Instant createdAt) {
        boolean exists = rows.values().stream()
                .anyMatch(r -> r.instance.seriesId().equals(seriesId) && r.instance.scheduledDate().equals(scheduledDate));
        if (exists) {
            return false;
        }
        String id = UUID.randomUUID().toString();
        rows.put(id, new Row(new RecurringJobInstance(id, seriesId, scheduledDate, InstanceStatus.SCHEDULED, null, createdAt)));
        return true;
    }

    @Override
    public synchronized List<RecurringJobInstance> findBySeries(String seriesId) {
        return rows.values().stream()
                .map(r -> r.instance)
                .filter(i -> i.seriesId().equals(seriesId))
                .sorted(Comparator.comparing(RecurringJobInstance::scheduledDate))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<RecurringJobInstance> findById(String seriesId, String instanceId) {
        return row(seriesId, instanceId).map(r -> r.instance);
    }

    @Override
    public synchronized Optional<RecurringJobInstance> transition(String seriesId, String instanceId,
                                                                  InstanceStatus expected, InstanceStatus target,
                                                                  Instant now) {
        return row(seriesId, instanceId)
                .filter(r -> r.instance.status() == expected && r.claimFree(now))
                .map(r -> {
                    r.setStatus(target, r.instance.jobId());
                    return r.instance;
                });
    }

    @Override
    public synchronized Optional<RecurringJobInstance> claimForConversion(String seriesId, String instanceId,
                                                                          String claimToken, Instant now,
                                                                          Instant claimUntil) {
        return row(seriesId, instanceId)
                .filter(r -> r.instance.status() == InstanceStatus.SCHEDULED && r.claimFree(now))
                .map(r -> {
                    r.claimToken = claimToken;
                    r.claimUntil = claimUntil;
                    return r.instance;
                });
    }

    @Override
    public synchronized Optional<RecurringJobInstance> completeConversion(String seriesId, String instanceId,
                                                                          String claimToken, String jobId) {
        return row(seriesId, instanceId)
                .filter(r -> claimToken.equals(r.claimToken))
                .map(r -> {
                    r.setStatus(InstanceStatus.CREATED, jobId);
                    r.claimToken = null;
                    r.claimUntil = null;
                    return r.instance;
                });
    }

    @Override
    public synchronized boolean releaseConversion(String seriesId, String instanceId, String claimToken) {
        Optional<Row> row = row(seriesId, instanceId).filter(r -> claimToken.equals(r.claimToken));
        row.ifPresent(r -> {
            r.claimToken = null;
            r.claimUntil = null;
        });
        return row.isPresent();
    }

    @Override
    public synchronized long cancelScheduled(String seriesId, LocalDate fromDate, Instant now) {
        long cancelled = 0;
        for (Row r : rows.values()) {
            if (r.instance.seriesId().equals(seriesId)
                    && r.instance.status() == InstanceStatus.SCHEDULED
                    && !r.instance.scheduledDate().isBefore(fromDate)
                    && r.claimFree(now)) {
                r.setStatus(InstanceStatus.CANCELLED, null);
                cancelled++;
            }
        }
        return cancelled;
    }

    private Optional<Row> row(String seriesId, String instanceId) {
        return Optional.ofNullable(rows.get(instanceId))
                .filter(r -> r.instance.seriesId().equals(seriesId));
    }
}
