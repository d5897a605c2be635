package io.recur4j.store;

import io.recur4j.core.JobSeries;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for series definitions.
 */
public interface SeriesStore {

    /**
     * Persist a new series and return it with its assigned id.
     */
    JobSeries insert(JobSeries series);

    Optional<JobSeries> findById(String id);

    /**
     * All series, newest first.
     */
    List<JobSeries> findAll();

    /**
     * Replace an existing series by id.
     *
     * @return the stored series, or empty when no series has that id
     */
    Optional<JobSeries> replace(JobSeries series);

    /**
     * @return true if a series with that id exists
     */
    boolean setActive(String id, boolean active, Instant updatedAt);
}
