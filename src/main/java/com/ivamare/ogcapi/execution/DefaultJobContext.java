package com.ivamare.ogcapi.execution;

import com.ivamare.ogcapi.handler.JobContext;

/**
 * JobContext backed by the dispatcher's cancellation signal and the completion
 * callback.
 */
public class DefaultJobContext implements JobContext {

    private final JobTask task;
    private final CancellationSignal signal;
    private final JobCompletionCallback callback;

    public DefaultJobContext(JobTask task, CancellationSignal signal, JobCompletionCallback callback) {
        this.task = task;
        this.signal = signal;
        this.callback = callback;
    }

    @Override
    public String jobId() {
        return task.jobId();
    }

    @Override
    public String processId() {
        return task.processId();
    }

    @Override
    public boolean isCancelled() {
        return signal.isCancelled() || Thread.currentThread().isInterrupted();
    }

    @Override
    public void reportProgress(int percent, String message) {
        callback.onProgress(task.jobId(), Math.max(0, Math.min(100, percent)), message);
    }
}
