package com.ivamare.ogcapi.lifecycle;

import com.ivamare.ogcapi.model.JobStatus;

/**
 * Result of dismissing a job. The job record is gone in either case.
 *
 * @param jobId Dismissed job
 * @param cancelled True if the job was still accepted or running and has been
 *                  cancelled; false if it had already finished
 * @param finalStatus Status the job ended in: DISMISSED when cancelled, otherwise
 *                    the terminal status it had reached
 */
public record DismissOutcome(String jobId, boolean cancelled, JobStatus finalStatus) {
}
