package com.ivamare.ogcapi.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.ogcapi.exception.HandlerNotFoundException;
import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.process.ProcessRegistry;
import com.ivamare.ogcapi.handler.HandlerRegistry;
import com.ivamare.ogcapi.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Accepts execution requests: creates the job, hands its work unit to the
 * dispatcher and returns without waiting for it.
 *
 * <p>It is also the completion callback of every job it dispatches, and so the only
 * component that moves a job from accepted to running and from running to
 * successful or failed. A state change that loses against a concurrent dismissal is
 * logged and discarded.
 */
public class JobExecutionController implements JobCompletionCallback {

    private static final Logger log = LoggerFactory.getLogger(JobExecutionController.class);

    static final String QUEUE_FULL_MESSAGE = "Job could not be scheduled, the execution queue is full";
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final ProcessRegistry processRegistry;
    private final HandlerRegistry handlerRegistry;
    private final JobRepository jobRepository;
    private final JobDispatcher dispatcher;
    private final ExecuteRequestValidator validator;
    private final Clock clock;
    private final Supplier<String> jobIdGenerator;
    private final Duration pollInterval;

    public JobExecutionController(
            ProcessRegistry processRegistry,
            HandlerRegistry handlerRegistry,
            JobRepository jobRepository,
            JobDispatcher dispatcher,
            Clock clock) {
        this(processRegistry, handlerRegistry, jobRepository, dispatcher, new ExecuteRequestValidator(),
            clock, () -> UUID.randomUUID().toString(), DEFAULT_POLL_INTERVAL);
    }

    public JobExecutionController(
            ProcessRegistry processRegistry,
            HandlerRegistry handlerRegistry,
            JobRepository jobRepository,
            JobDispatcher dispatcher,
            ExecuteRequestValidator validator,
            Clock clock,
            Supplier<String> jobIdGenerator,
            Duration pollInterval) {
        this.processRegistry = processRegistry;
        this.handlerRegistry = handlerRegistry;
        this.jobRepository = jobRepository;
        this.dispatcher = dispatcher;
        this.validator = validator;
        this.clock = clock;
        this.jobIdGenerator = jobIdGenerator;
        this.pollInterval = pollInterval;
    }

    /**
     * Create a job for the process and queue its work unit.
     *
     * @return the job as created (accepted), or failed if it could not be queued
     * @throws com.ivamare.ogcapi.exception.ProcessNotFoundException if the process is unknown
     * @throws HandlerNotFoundException if no handler executes the process
     * @throws com.ivamare.ogcapi.exception.InvalidExecuteRequestException if the request
     *         does not match the process inputs
     */
    public Job submit(String processId, ExecuteRequest request) {
        ProcessDescription process = processRegistry.get(processId);
        if (!handlerRegistry.hasHandler(processId)) {
            throw new HandlerNotFoundException(processId);
        }
        validator.validate(process, request);

        Job job = Job.accepted(jobIdGenerator.get(), processId, clock.instant());
        jobRepository.create(job);
        log.info("Accepted job {} for process {}", job.jobId(), processId);

        if (!dispatcher.dispatch(new JobTask(job.jobId(), processId, request), this)) {
            log.warn("Job {} was not dispatched, marking it failed", job.jobId());
            try {
                return jobRepository.transition(job.jobId(), JobTransition.reject(QUEUE_FULL_MESSAGE));
            } catch (InvalidTransitionException | JobNotFoundException e) {
                log.debug("Job {} changed before it could be rejected: {}", job.jobId(), e.getMessage());
            }
        }
        return job;
    }

    /**
     * Submit, then poll the job store until the job is terminal or the wait expires.
     *
     * @return the latest known state of the job, with results if it succeeded
     */
    public Job submitAndWait(String processId, ExecuteRequest request, Duration wait) {
        Job job = submit(processId, request);
        Instant deadline = clock.instant().plus(wait);

        try {
            while (!job.isTerminal()) {
                if (!clock.instant().isBefore(deadline)) {
                    log.debug("Job {} still {} after waiting {}", job.jobId(), job.status(), wait);
                    break;
                }
                Thread.sleep(pollInterval.toMillis());
                job = jobRepository.findById(job.jobId()).orElse(job);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return job;
    }

    @Override
    public boolean onStart(String jobId) {
        try {
            jobRepository.transition(jobId, JobTransition.start());
            log.debug("Job {} running", jobId);
            return true;
        } catch (InvalidTransitionException | JobNotFoundException e) {
            log.info("Job {} not started: {}", jobId, e.getMessage());
            return false;
        }
    }

    @Override
    public void onSuccess(String jobId, JsonNode results) {
        try {
            jobRepository.transition(jobId, JobTransition.succeed(results));
            log.info("Job {} successful", jobId);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            log.warn("Discarding result of job {}: {}", jobId, e.getMessage());
        }
    }

    @Override
    public void onFailure(String jobId, String message) {
        try {
            jobRepository.transition(jobId, JobTransition.fail(message));
            log.info("Job {} failed: {}", jobId, message);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            log.warn("Discarding failure of job {}: {}", jobId, e.getMessage());
        }
    }

    @Override
    public void onProgress(String jobId, int percent, String message) {
        if (!jobRepository.updateProgress(jobId, percent, message)) {
            log.debug("Ignoring progress of job {}, it is no longer running", jobId);
        }
    }

    @Override
    public void onAbandoned(String jobId, String message) {
        try {
            jobRepository.transition(jobId, JobTransition.abandon(message));
            log.warn("Job {} abandoned: {}", jobId, message);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            log.debug("Job {} already settled: {}", jobId, e.getMessage());
        }
    }
}
