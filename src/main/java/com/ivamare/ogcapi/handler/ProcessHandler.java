package com.ivamare.ogcapi.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.ProcessDescription;

/**
 * Executable implementation of a process.
 *
 * <p>Handlers run on a job worker thread. A handler that returns normally completes
 * the job successfully with the returned document as its results. Any thrown
 * exception fails the job, with the exception message as the job message.
 *
 * <p>Long running handlers should check {@link JobContext#isCancelled()} and return
 * early when the job has been dismissed.
 */
public interface ProcessHandler {

    /**
     * Description of the process this handler implements. Its id is the key under
     * which the handler is registered.
     */
    ProcessDescription description();

    /**
     * Execute one job.
     *
     * @param request the validated execution request
     * @param context job metadata and progress reporting
     * @return the result document (null is stored as an empty object)
     * @throws Exception on processing failure
     */
    JsonNode execute(ExecuteRequest request, JobContext context) throws Exception;

    default String processId() {
        return description().id();
    }
}
