package com.ivamare.ogcapi.exception;

/**
 * Thrown when a catalogued process has no work unit installed.
 */
public class HandlerNotFoundException extends OgcApiException {

    private final String processId;

    public HandlerNotFoundException(String processId) {
        super("No handler registered for process " + processId);
        this.processId = processId;
    }

    public String getProcessId() {
        return processId;
    }
}
