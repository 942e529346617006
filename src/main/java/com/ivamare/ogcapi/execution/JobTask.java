package com.ivamare.ogcapi.execution;

import com.ivamare.ogcapi.model.ExecuteRequest;

/**
 * Unit of work handed to the dispatcher: run the process for an accepted job.
 *
 * @param jobId Job to run
 * @param processId Process to execute
 * @param request Validated execution request
 */
public record JobTask(String jobId, String processId, ExecuteRequest request) {
}
