package com.ivamare.ogcapi.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.exception.ResultsNotReadyException;
import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.execution.JobExecutionController;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobFilter;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.PageQuery;
import com.ivamare.ogcapi.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Operations clients perform on jobs: submit, list, status, results and dismiss.
 *
 * <p>Clients never change job status directly. The only state change they may
 * request is a dismissal.
 */
public class JobLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycleService.class);

    private final JobRepository jobRepository;
    private final JobExecutionController executionController;
    private final JobDispatcher dispatcher;

    public JobLifecycleService(
            JobRepository jobRepository,
            JobExecutionController executionController,
            JobDispatcher dispatcher) {
        this.jobRepository = jobRepository;
        this.executionController = executionController;
        this.dispatcher = dispatcher;
    }

    public Job submit(String processId, ExecuteRequest request) {
        return executionController.submit(processId, request);
    }

    public Job submitAndWait(String processId, ExecuteRequest request, Duration wait) {
        return executionController.submitAndWait(processId, request, wait);
    }

    /**
     * One page of jobs, without result documents.
     */
    public Page<Job> listJobs(JobFilter filter, PageQuery query) {
        return jobRepository.list(filter, query.limit(), query.offset());
    }

    /**
     * @throws JobNotFoundException if no such job
     */
    public Job getStatus(String jobId) {
        return jobRepository.get(jobId).withoutResults();
    }

    /**
     * @throws JobNotFoundException if no such job
     * @throws ResultsNotReadyException unless the job is successful
     */
    public JsonNode getResults(String jobId) {
        Job job = jobRepository.get(jobId);
        if (job.status() != JobStatus.SUCCESSFUL || job.results() == null) {
            throw new ResultsNotReadyException(jobId, job.status(), job.message());
        }
        return job.results();
    }

    /**
     * Cancel the job if it is still accepted or running, then delete it. Dismissing
     * a finished job only deletes it.
     *
     * @throws JobNotFoundException if no such job
     */
    public DismissOutcome dismiss(String jobId) {
        boolean cancelled;
        JobStatus finalStatus;
        try {
            finalStatus = jobRepository.transition(jobId, JobTransition.dismiss()).status();
            cancelled = true;
        } catch (InvalidTransitionException e) {
            finalStatus = e.getCurrentStatus();
            cancelled = false;
        }

        if (cancelled && dispatcher.cancel(jobId)) {
            log.debug("Signalled work unit of job {}", jobId);
        }

        try {
            jobRepository.delete(jobId);
        } catch (JobNotFoundException e) {
            log.debug("Job {} already deleted by a concurrent dismissal", jobId);
        }

        log.info("Dismissed job {} (cancelled={}, status={})", jobId, cancelled, finalStatus);
        return new DismissOutcome(jobId, cancelled, finalStatus);
    }
}
