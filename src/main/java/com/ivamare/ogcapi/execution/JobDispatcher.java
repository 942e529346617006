package com.ivamare.ogcapi.execution;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Runs job work units off the request thread.
 *
 * <p>Example:
 * <pre>
 * JobDispatcher dispatcher = new ExecutorJobDispatcher(runner, 4, 1000);
 * dispatcher.start();
 * dispatcher.dispatch(new JobTask(jobId, "echo", request), callback);
 * // ... later
 * dispatcher.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface JobDispatcher {

    /**
     * Start accepting work.
     */
    void start();

    /**
     * Stop accepting work and wait for queued and in-flight jobs to finish.
     * Jobs still unfinished when the timeout expires are cancelled and reported
     * through {@link JobCompletionCallback#onAbandoned}.
     *
     * @param timeout Maximum time to wait
     * @return Future that completes when the dispatcher has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop immediately, cancelling every queued and running job.
     */
    void stopNow();

    /**
     * @return true if the dispatcher accepts new work
     */
    boolean isRunning();

    /**
     * @return number of jobs whose work unit is currently executing
     */
    int inFlightCount();

    /**
     * @return number of jobs waiting for a worker thread
     */
    int queuedCount();

    /**
     * Queue a job for execution.
     *
     * @return false if the job was not queued (dispatcher stopped or queue full)
     */
    boolean dispatch(JobTask task, JobCompletionCallback callback);

    /**
     * Request cancellation of a queued or running job. Cancellation is best effort:
     * a running work unit is signalled and interrupted but may still complete.
     *
     * @return true if the job was known to this dispatcher
     */
    boolean cancel(String jobId);

    /**
     * @return true if the job is queued or running in this dispatcher
     */
    boolean isTracked(String jobId);
}
