package com.ivamare.ogcapi.exception;

import java.util.List;

/**
 * Thrown when an execution request does not match the shape the process declares.
 */
public class InvalidExecuteRequestException extends OgcApiException {

    private final String processId;
    private final List<String> violations;

    public InvalidExecuteRequestException(String processId, List<String> violations) {
        super("Invalid execute request for process " + processId + ": " + String.join("; ", violations));
        this.processId = processId;
        this.violations = List.copyOf(violations);
    }

    public String getProcessId() {
        return processId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
