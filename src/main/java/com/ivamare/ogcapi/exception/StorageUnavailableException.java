package com.ivamare.ogcapi.exception;

/**
 * Thrown when the backing store fails. The caller may retry.
 */
public class StorageUnavailableException extends OgcApiException {

    private final boolean transientFailure;

    public StorageUnavailableException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * @return true if the failure looks temporary (connection loss, pool exhaustion, ...)
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
