package com.ivamare.ogcapi.repository;

import com.ivamare.ogcapi.exception.DuplicateJobException;
import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.exception.StorageUnavailableException;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobFilter;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.model.Page;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store of job records, and the only writer of job state.
 *
 * <p>Every mutation of an existing job is either a conditional
 * {@link #transition(String, JobTransition)} or an unconditional {@link #delete(String)}.
 * Implementations must make {@code transition} atomic with respect to concurrent
 * callers: of two racing transitions out of the same status, exactly one succeeds.
 *
 * <p>All methods may throw {@link StorageUnavailableException} when the backing
 * store fails.
 */
public interface JobRepository {

    /**
     * Insert a new job in ACCEPTED status.
     *
     * @throws DuplicateJobException if the job id already exists
     * @throws IllegalArgumentException if the job is not in ACCEPTED status
     */
    void create(Job job);

    /**
     * Get a job including its result document.
     */
    Optional<Job> findById(String jobId);

    /**
     * Get a job including its result document.
     *
     * @throws JobNotFoundException if no such job
     */
    default Job get(String jobId) {
        return findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * List jobs ordered by creation time then job id, ascending. Result documents are
     * not loaded.
     *
     * @param filter restriction on the listed jobs
     * @param limit maximum number of jobs returned
     * @param offset number of matching jobs to skip
     * @return the page and the total number of jobs matching the filter
     */
    Page<Job> list(JobFilter filter, int limit, int offset);

    /**
     * Atomically apply a status change if the job's current status is one the
     * transition allows.
     *
     * @return the job after the change (without its result document)
     * @throws JobNotFoundException if no such job
     * @throws InvalidTransitionException if the job is in a status the transition
     *         does not allow, including any terminal status
     */
    Job transition(String jobId, JobTransition transition);

    /**
     * Record progress of a RUNNING job. Does nothing for jobs in any other status.
     *
     * @param progress percentage 0-100
     * @param message progress message (nullable, keeps the current one)
     * @return true if the job was RUNNING and has been updated
     */
    boolean updateProgress(String jobId, int progress, String message);

    /**
     * Remove a job regardless of its status.
     *
     * @throws JobNotFoundException if no such job
     */
    void delete(String jobId);

    /**
     * Find non-terminal jobs whose last update is older than the given instant.
     */
    List<Job> findStale(Instant updatedBefore);

    /**
     * Number of jobs per status. Statuses without jobs may be absent.
     */
    Map<JobStatus, Long> countByStatus();
}
