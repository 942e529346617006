package com.ivamare.ogcapi.exception;

/**
 * Thrown when a process identifier is not in the catalog.
 */
public class ProcessNotFoundException extends OgcApiException {

    private final String processId;

    public ProcessNotFoundException(String processId) {
        super("Process " + processId + " not found");
        this.processId = processId;
    }

    public String getProcessId() {
        return processId;
    }
}
