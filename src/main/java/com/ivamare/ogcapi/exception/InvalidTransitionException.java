package com.ivamare.ogcapi.exception;

import com.ivamare.ogcapi.model.JobStatus;

/**
 * Thrown when a conditional status update does not apply: the job is not in one of
 * the expected statuses (another caller won the race, or the job is terminal).
 */
public class InvalidTransitionException extends OgcApiException {

    private final String jobId;
    private final JobStatus currentStatus;
    private final JobStatus targetStatus;

    public InvalidTransitionException(String jobId, JobStatus currentStatus, JobStatus targetStatus) {
        super("Job " + jobId + " cannot move from " + currentStatus + " to " + targetStatus);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * @return status observed when the update was rejected, or null if not known
     */
    public JobStatus getCurrentStatus() {
        return currentStatus;
    }

    public JobStatus getTargetStatus() {
        return targetStatus;
    }
}
