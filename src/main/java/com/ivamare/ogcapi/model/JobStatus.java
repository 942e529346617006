package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a job.
 *
 * <p>Transitions are one-directional:
 * <pre>
 * accepted -> running -> successful | failed
 * accepted | running -> dismissed
 * accepted -> failed   (work could not be handed off, or the job was abandoned)
 * </pre>
 */
public enum JobStatus {

    /** Job created, waiting for a worker */
    ACCEPTED("accepted"),

    /** Work unit is executing */
    RUNNING("running"),

    /** Work unit finished and results are stored */
    SUCCESSFUL("successful"),

    /** Work unit failed; message describes why */
    FAILED("failed"),

    /** Client dismissed the job */
    DISMISSED("dismissed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    /**
     * Wire and storage representation (lower case).
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a wire value.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    /**
     * Check if this is a terminal status (job will not change status again).
     */
    public boolean isTerminal() {
        return this == SUCCESSFUL || this == FAILED || this == DISMISSED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case ACCEPTED -> target == RUNNING || target == FAILED || target == DISMISSED;
            case RUNNING -> target == SUCCESSFUL || target == FAILED || target == DISMISSED;
            case SUCCESSFUL, FAILED, DISMISSED -> false;
        };
    }

    public static Set<JobStatus> nonTerminal() {
        return EnumSet.of(ACCEPTED, RUNNING);
    }

    @Override
    public String toString() {
        return value;
    }
}
