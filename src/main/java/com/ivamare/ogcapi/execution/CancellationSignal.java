package com.ivamare.ogcapi.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation flag shared between the dispatcher and a running job.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call cancelled the job, false if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
