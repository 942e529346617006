package com.ivamare.ogcapi.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.ivamare.ogcapi.handler.HandlerRegistry;
import com.ivamare.ogcapi.handler.ProcessHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job on the calling thread: marks it running, invokes the process handler
 * and reports the outcome to the completion callback.
 *
 * <p>Every outcome of the handler, including errors, ends in exactly one callback
 * so no job is left running without a record of why.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final HandlerRegistry handlerRegistry;

    public JobRunner(HandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
    }

    public void run(JobTask task, CancellationSignal signal, JobCompletionCallback callback) {
        String jobId = task.jobId();

        if (signal.isCancelled()) {
            log.debug("Job {} cancelled before start", jobId);
            return;
        }
        if (!callback.onStart(jobId)) {
            log.debug("Job {} can no longer start, skipping work", jobId);
            return;
        }

        log.debug("Running job {} (process {})", jobId, task.processId());
        long startNanos = System.nanoTime();

        JsonNode results;
        try {
            ProcessHandler handler = handlerRegistry.getOrThrow(task.processId());
            results = handler.execute(task.request(), new DefaultJobContext(task, signal, callback));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Job {} interrupted", jobId);
            callback.onFailure(jobId, "Job interrupted before completion");
            return;
        } catch (Exception e) {
            log.warn("Job {} failed: {}", jobId, e.getMessage());
            log.debug("Failure of job {}", jobId, e);
            callback.onFailure(jobId, failureMessage(e));
            return;
        } catch (Error e) {
            log.error("Job {} crashed", jobId, e);
            callback.onFailure(jobId, "Job crashed: " + e);
            throw e;
        }

        if (results == null || results.isMissingNode()) {
            results = JsonNodeFactory.instance.objectNode();
        }

        callback.onSuccess(jobId, results);
        log.debug("Job {} finished in {}ms", jobId, (System.nanoTime() - startNanos) / 1_000_000);
    }

    private static String failureMessage(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
