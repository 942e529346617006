package com.ivamare.ogcapi.execution;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the state changes of a dispatched job. Implementations write them to the
 * job store; a change that is no longer allowed (because the job was dismissed in
 * the meantime) is discarded, never reported back to the worker as an error.
 */
public interface JobCompletionCallback {

    /**
     * The work unit is about to start (accepted to running).
     *
     * @return false if the job can no longer run, in which case the work is skipped
     */
    boolean onStart(String jobId);

    /**
     * The work unit returned a result (running to successful).
     */
    void onSuccess(String jobId, JsonNode results);

    /**
     * The work unit failed (running to failed).
     */
    void onFailure(String jobId, String message);

    /**
     * The running work unit reported progress.
     */
    void onProgress(String jobId, int percent, String message);

    /**
     * The job will never be worked on, e.g. the queue was full or the engine stopped
     * before the job ran (accepted or running to failed).
     */
    void onAbandoned(String jobId, String message);
}
