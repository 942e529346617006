package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution modes a process supports.
 */
public enum JobControlOption {
    SYNC_EXECUTE("sync-execute"),
    ASYNC_EXECUTE("async-execute"),
    DISMISS("dismiss");

    private final String value;

    JobControlOption(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static JobControlOption fromValue(String value) {
        for (JobControlOption option : values()) {
            if (option.value.equals(value)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown job control option: " + value);
    }
}
