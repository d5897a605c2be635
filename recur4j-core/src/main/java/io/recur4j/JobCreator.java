package io.recur4j;

import io.recur4j.core.CreatedJob;
import io.recur4j.core.JobDraft;

/**
 * External collaborator that turns a draft into a real, billable job.
 */
public interface JobCreator {

    CreatedJob createJob(JobDraft draft) throws Exception;
}
