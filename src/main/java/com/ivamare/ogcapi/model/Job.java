package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Persisted state of a job.
 *
 * @param jobId Unique job identifier
 * @param processId Identifier of the process this job executes
 * @param status Current status
 * @param message Human readable message (nullable)
 * @param progress Completion percentage 0-100 (nullable)
 * @param results Result document, only present when status is successful and
 *                the job was loaded with its results
 * @param created Creation timestamp
 * @param started Time the work unit started (nullable)
 * @param finished Time the job reached a terminal status (nullable)
 * @param updated Time of the last mutation
 */
public record Job(
    String jobId,
    String processId,
    JobStatus status,
    String message,
    Integer progress,
    JsonNode results,
    Instant created,
    Instant started,
    Instant finished,
    Instant updated
) {
    /**
     * Create a new job in ACCEPTED status.
     */
    public static Job accepted(String jobId, String processId, Instant now) {
        return new Job(
            jobId,
            processId,
            JobStatus.ACCEPTED,
            null,           // message
            null,           // progress
            null,           // results
            now,            // created
            null,           // started
            null,           // finished
            now             // updated
        );
    }

    /**
     * Copy of this job without the result document (for status and list views).
     */
    public Job withoutResults() {
        if (results == null) {
            return this;
        }
        return new Job(jobId, processId, status, message, progress, null,
            created, started, finished, updated);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
