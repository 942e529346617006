package com.ivamare.ogcapi.exception;

/**
 * Thrown when registering a second handler for the same process.
 */
public class HandlerAlreadyRegisteredException extends OgcApiException {

    private final String processId;

    public HandlerAlreadyRegisteredException(String processId) {
        super("Handler already registered for process " + processId);
        this.processId = processId;
    }

    public String getProcessId() {
        return processId;
    }
}
