package com.ivamare.ogcapi.exception;

/**
 * Thrown when creating a job whose identifier already exists.
 */
public class DuplicateJobException extends OgcApiException {

    private final String jobId;

    public DuplicateJobException(String jobId) {
        super("Duplicate job id " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
