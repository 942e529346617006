package com.ivamare.ogcapi.exception;

/**
 * Thrown when a job cannot be found.
 */
public class JobNotFoundException extends OgcApiException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
