package com.ivamare.ogcapi.execution.impl;

import com.ivamare.ogcapi.execution.CancellationSignal;
import com.ivamare.ogcapi.execution.JobCompletionCallback;
import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.execution.JobRunner;
import com.ivamare.ogcapi.execution.JobTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JobDispatcher backed by a fixed-size thread pool with a bounded queue.
 *
 * <p>Each dispatched job is tracked from the moment it is queued until its work
 * unit returns, so dismissal can signal it and the abandoned-job monitor can tell
 * live jobs from lost ones.
 */
public class ExecutorJobDispatcher implements JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutorJobDispatcher.class);

    static final String SHUTDOWN_MESSAGE = "Server stopped before the job completed";

    private final JobRunner runner;
    private final int concurrency;
    private final int queueCapacity;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final Map<String, TrackedJob> tracked = new ConcurrentHashMap<>();

    private volatile ThreadPoolExecutor executor;

    public ExecutorJobDispatcher(JobRunner runner, int concurrency, int queueCapacity) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.runner = runner;
        this.concurrency = concurrency;
        this.queueCapacity = queueCapacity;
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Job dispatcher already running");
            return;
        }

        stopping.set(false);
        executor = new ThreadPoolExecutor(
            concurrency, concurrency,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new JobThreadFactory(),
            new ThreadPoolExecutor.AbortPolicy()
        );

        log.info("Started job dispatcher, concurrency={}, queueCapacity={}", concurrency, queueCapacity);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping job dispatcher, waiting for {} in-flight and {} queued jobs",
            inFlightCount.get(), queuedCount());

        return CompletableFuture.runAsync(() -> {
            ThreadPoolExecutor pool = executor;
            try {
                pool.shutdown();
                if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Timeout waiting for {} jobs, cancelling them", tracked.size());
                    abandonAll(pool);
                    pool.awaitTermination(5, TimeUnit.SECONDS);
                }
                log.info("Job dispatcher stopped");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandonAll(pool);
            } finally {
                running.set(false);
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        ThreadPoolExecutor pool = executor;
        if (pool != null) {
            abandonAll(pool);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public int queuedCount() {
        ThreadPoolExecutor pool = executor;
        return pool != null ? pool.getQueue().size() : 0;
    }

    @Override
    public boolean dispatch(JobTask task, JobCompletionCallback callback) {
        if (!isRunning()) {
            log.warn("Job dispatcher not running, cannot dispatch job {}", task.jobId());
            return false;
        }

        CancellationSignal signal = new CancellationSignal();
        FutureTask<Void> future = new FutureTask<>(() -> execute(task, signal, callback), null);
        tracked.put(task.jobId(), new TrackedJob(callback, signal, future));

        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            tracked.remove(task.jobId());
            log.warn("Job queue full ({} queued), rejecting job {}", queuedCount(), task.jobId());
            return false;
        }

        log.debug("Dispatched job {} (process {})", task.jobId(), task.processId());
        return true;
    }

    @Override
    public boolean cancel(String jobId) {
        TrackedJob job = tracked.remove(jobId);
        if (job == null) {
            return false;
        }
        job.signal().cancel();
        job.future().cancel(true);
        log.debug("Cancellation requested for job {}", jobId);
        return true;
    }

    @Override
    public boolean isTracked(String jobId) {
        return tracked.containsKey(jobId);
    }

    private void execute(JobTask task, CancellationSignal signal, JobCompletionCallback callback) {
        inFlightCount.incrementAndGet();
        try {
            runner.run(task, signal, callback);
        } catch (RuntimeException e) {
            log.error("Error recording outcome of job {}", task.jobId(), e);
        } finally {
            inFlightCount.decrementAndGet();
            tracked.remove(task.jobId());
        }
    }

    private void abandonAll(ThreadPoolExecutor pool) {
        List<Runnable> neverStarted = pool.shutdownNow();
        if (!neverStarted.isEmpty()) {
            log.info("Dropped {} queued jobs", neverStarted.size());
        }

        for (String jobId : List.copyOf(tracked.keySet())) {
            TrackedJob job = tracked.remove(jobId);
            if (job == null) {
                continue;
            }
            job.signal().cancel();
            job.future().cancel(true);
            try {
                job.callback().onAbandoned(jobId, SHUTDOWN_MESSAGE);
            } catch (RuntimeException e) {
                log.error("Could not record abandonment of job {}", jobId, e);
            }
        }
    }

    private record TrackedJob(
        JobCompletionCallback callback,
        CancellationSignal signal,
        FutureTask<Void> future
    ) {}

    private static final class JobThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "ogcapi-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
