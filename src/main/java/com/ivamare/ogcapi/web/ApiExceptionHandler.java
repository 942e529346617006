package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.exception.DuplicateJobException;
import com.ivamare.ogcapi.exception.HandlerNotFoundException;
import com.ivamare.ogcapi.exception.InvalidExecuteRequestException;
import com.ivamare.ogcapi.exception.InvalidPageQueryException;
import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.exception.ProcessNotFoundException;
import com.ivamare.ogcapi.exception.ResultsNotReadyException;
import com.ivamare.ogcapi.exception.StorageUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;

/**
 * Turns failures of the API endpoints into OGC exception documents
 * ({@code type}, {@code title}, {@code status}, {@code detail}, {@code instance}).
 */
@RestControllerAdvice(assignableTypes = {ProcessesController.class, JobsController.class, LandingController.class})
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String EXCEPTIONS = "http://www.opengis.net/def/exceptions/ogcapi-processes-1/1.0/";
    static final URI NO_SUCH_PROCESS = URI.create(EXCEPTIONS + "no-such-process");
    static final URI NO_SUCH_JOB = URI.create(EXCEPTIONS + "no-such-job");
    static final URI RESULT_NOT_READY = URI.create(EXCEPTIONS + "result-not-ready");

    static final long RETRY_AFTER_TRANSIENT_SECONDS = 5;
    static final long RETRY_AFTER_SECONDS = 30;

    @ExceptionHandler(ProcessNotFoundException.class)
    public ResponseEntity<ProblemDetail> processNotFound(ProcessNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "No such process", ex.getMessage(), request);
        problem.setType(NO_SUCH_PROCESS);
        return respond(problem);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ProblemDetail> jobNotFound(JobNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "No such job", ex.getMessage(), request);
        problem.setType(NO_SUCH_JOB);
        return respond(problem);
    }

    @ExceptionHandler(ResultsNotReadyException.class)
    public ResponseEntity<ProblemDetail> resultsNotReady(ResultsNotReadyException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Results not ready", ex.getMessage(), request);
        problem.setType(RESULT_NOT_READY);
        problem.setProperty("jobStatus", ex.getStatus().value());
        return respond(problem);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ProblemDetail> invalidTransition(InvalidTransitionException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Invalid job state", ex.getMessage(), request);
        problem.setProperty("jobStatus", ex.getCurrentStatus().value());
        return respond(problem);
    }

    @ExceptionHandler(DuplicateJobException.class)
    public ResponseEntity<ProblemDetail> duplicateJob(DuplicateJobException ex, HttpServletRequest request) {
        log.error("Job id collision for {}", ex.getJobId());
        return respond(problem(HttpStatus.CONFLICT, "Job already exists", ex.getMessage(), request));
    }

    @ExceptionHandler(InvalidExecuteRequestException.class)
    public ResponseEntity<ProblemDetail> invalidExecuteRequest(InvalidExecuteRequestException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid execute request", ex.getMessage(), request);
        problem.setProperty("violations", ex.getViolations());
        return respond(problem);
    }

    @ExceptionHandler(InvalidPageQueryException.class)
    public ResponseEntity<ProblemDetail> invalidPageQuery(InvalidPageQueryException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid query parameter", ex.getMessage(), request);
        problem.setProperty("parameter", ex.getParameter());
        return respond(problem);
    }

    @ExceptionHandler(HandlerNotFoundException.class)
    public ResponseEntity<ProblemDetail> handlerNotFound(HandlerNotFoundException ex, HttpServletRequest request) {
        log.warn("Process {} is catalogued but cannot be executed", ex.getProcessId());
        return respond(problem(HttpStatus.NOT_IMPLEMENTED, "Process not executable", ex.getMessage(), request));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ProblemDetail> storageUnavailable(StorageUnavailableException ex, HttpServletRequest request) {
        log.error("Storage failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        ProblemDetail problem = problem(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable",
            "The job store is temporarily unavailable, retry later", request);
        long retryAfter = ex.isTransientFailure() ? RETRY_AFTER_TRANSIENT_SECONDS : RETRY_AFTER_SECONDS;
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter))
            .contentType(MediaType.APPLICATION_PROBLEM_JSON)
            .body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> unexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
            "An unexpected error occurred", request));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setInstance(URI.create(request.getRequestURI()));
        return problem;
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        return ResponseEntity.status(problem.getStatus())
            .contentType(MediaType.APPLICATION_PROBLEM_JSON)
            .body(problem);
    }
}
