package com.ivamare.ogcapi.exception;

/**
 * Base exception for all job engine and API errors.
 */
public class OgcApiException extends RuntimeException {

    public OgcApiException(String message) {
        super(message);
    }

    public OgcApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
