package com.ivamare.ogcapi.execution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatcher for tests: queues work units and runs them on the test thread when
 * asked to.
 */
public class ManualJobDispatcher implements JobDispatcher {

    private final JobRunner runner;
    private final Map<String, Queued> queued = new LinkedHashMap<>();
    private final List<String> cancelled = new ArrayList<>();
    private boolean running = true;
    private boolean runImmediately;

    public ManualJobDispatcher(JobRunner runner) {
        this.runner = runner;
    }

    /**
     * Run every work unit as soon as it is dispatched.
     */
    public ManualJobDispatcher immediate() {
        this.runImmediately = true;
        return this;
    }

    public void refuseWork() {
        this.running = false;
    }

    public synchronized void runAll() {
        List<Map.Entry<String, Queued>> pending = new ArrayList<>(queued.entrySet());
        queued.clear();
        pending.forEach(entry -> runner.run(entry.getValue().task(), entry.getValue().signal(), entry.getValue().callback()));
    }

    public List<String> cancelledJobs() {
        return cancelled;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        running = false;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void stopNow() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int inFlightCount() {
        return 0;
    }

    @Override
    public synchronized int queuedCount() {
        return queued.size();
    }

    @Override
    public synchronized boolean dispatch(JobTask task, JobCompletionCallback callback) {
        if (!running) {
            return false;
        }
        CancellationSignal signal = new CancellationSignal();
        if (runImmediately) {
            runner.run(task, signal, callback);
        } else {
            queued.put(task.jobId(), new Queued(task, signal, callback));
        }
        return true;
    }

    @Override
    public synchronized boolean cancel(String jobId) {
        Queued job = queued.remove(jobId);
        if (job == null) {
            return false;
        }
        job.signal().cancel();
        cancelled.add(jobId);
        return true;
    }

    @Override
    public synchronized boolean isTracked(String jobId) {
        return queued.containsKey(jobId);
    }

    private record Queued(JobTask task, CancellationSignal signal, JobCompletionCallback callback) {}
}
