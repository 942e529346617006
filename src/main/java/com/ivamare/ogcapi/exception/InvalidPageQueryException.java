package com.ivamare.ogcapi.exception;

/**
 * Thrown when a listing query parameter is malformed.
 */
public class InvalidPageQueryException extends OgcApiException {

    private final String parameter;

    public InvalidPageQueryException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
