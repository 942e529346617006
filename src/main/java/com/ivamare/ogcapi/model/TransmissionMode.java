package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a process output is delivered.
 */
public enum TransmissionMode {
    VALUE("value"),
    REFERENCE("reference");

    private final String value;

    TransmissionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TransmissionMode fromValue(String value) {
        for (TransmissionMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown transmission mode: " + value);
    }
}
