package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.EnumSet;
import java.util.Set;

/**
 * A conditional status change: applied only when the job's current status is
 * one of {@code allowedFrom}. Applied by the job store as a single atomic
 * compare-and-set.
 *
 * @param allowedFrom Statuses the job must currently be in
 * @param target Status to move to
 * @param message Message to store (nullable, replaces the current one)
 * @param results Result document; required for, and only allowed with, SUCCESSFUL
 */
public record JobTransition(
    Set<JobStatus> allowedFrom,
    JobStatus target,
    String message,
    JsonNode results
) {
    public JobTransition {
        if (allowedFrom == null || allowedFrom.isEmpty()) {
            throw new IllegalArgumentException("allowedFrom must not be empty");
        }
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        if (target == JobStatus.SUCCESSFUL && results == null) {
            throw new IllegalArgumentException("A successful transition requires results");
        }
        if (target != JobStatus.SUCCESSFUL && results != null) {
            throw new IllegalArgumentException("Results may only be attached to a successful job");
        }
        allowedFrom = Set.copyOf(allowedFrom);
    }

    /** accepted -> running */
    public static JobTransition start() {
        return new JobTransition(EnumSet.of(JobStatus.ACCEPTED), JobStatus.RUNNING, null, null);
    }

    /** running -> successful */
    public static JobTransition succeed(JsonNode results) {
        return new JobTransition(EnumSet.of(JobStatus.RUNNING), JobStatus.SUCCESSFUL, null, results);
    }

    /** running -> failed */
    public static JobTransition fail(String message) {
        return new JobTransition(EnumSet.of(JobStatus.RUNNING), JobStatus.FAILED, message, null);
    }

    /** accepted -> failed, for work that never reached a worker */
    public static JobTransition reject(String message) {
        return new JobTransition(EnumSet.of(JobStatus.ACCEPTED), JobStatus.FAILED, message, null);
    }

    /** accepted | running -> failed, for jobs nobody is working on any more */
    public static JobTransition abandon(String message) {
        return new JobTransition(JobStatus.nonTerminal(), JobStatus.FAILED, message, null);
    }

    /** accepted | running -> dismissed */
    public static JobTransition dismiss() {
        return new JobTransition(JobStatus.nonTerminal(), JobStatus.DISMISSED, "Job dismissed", null);
    }

    /**
     * Statuses from which this transition can legally apply, i.e. {@code allowedFrom}
     * restricted to statuses that may move to {@code target}. Terminal statuses never
     * appear here.
     */
    public Set<JobStatus> effectiveFrom() {
        EnumSet<JobStatus> effective = EnumSet.noneOf(JobStatus.class);
        for (JobStatus from : allowedFrom) {
            if (from.canTransitionTo(target)) {
                effective.add(from);
            }
        }
        return effective;
    }
}
