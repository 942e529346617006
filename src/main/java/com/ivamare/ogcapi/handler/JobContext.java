package com.ivamare.ogcapi.handler;

/**
 * Context handed to a {@link ProcessHandler} for one job.
 */
public interface JobContext {

    String jobId();

    String processId();

    /**
     * True once the job has been dismissed or the engine is shutting down.
     */
    boolean isCancelled();

    /**
     * Record progress of the running job.
     *
     * @param percent completion percentage, clamped to 0-100
     * @param message optional progress message
     */
    void reportProgress(int percent, String message);
}
