package com.ivamare.ogcapi.exception;

import com.ivamare.ogcapi.model.JobStatus;

/**
 * Thrown when results are requested for a job that is not successful.
 */
public class ResultsNotReadyException extends OgcApiException {

    private final String jobId;
    private final JobStatus status;

    public ResultsNotReadyException(String jobId, JobStatus status, String jobMessage) {
        super(buildMessage(jobId, status, jobMessage));
        this.jobId = jobId;
        this.status = status;
    }

    private static String buildMessage(String jobId, JobStatus status, String jobMessage) {
        String message = "Results of job " + jobId + " are not available, job is " + status;
        if (status == JobStatus.FAILED && jobMessage != null) {
            message += ": " + jobMessage;
        }
        return message;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
