package com.ivamare.ogcapi.health;

import com.ivamare.ogcapi.execution.JobDispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports whether the job dispatcher accepts work, with its in-flight and queued
 * job counts.
 */
public class JobDispatcherHealthIndicator implements HealthIndicator {

    private final JobDispatcher dispatcher;

    public JobDispatcherHealthIndicator(JobDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        Health.Builder builder = dispatcher.isRunning() ? Health.up() : Health.down();
        return builder
            .withDetail("running", dispatcher.isRunning())
            .withDetail("inFlight", dispatcher.inFlightCount())
            .withDetail("queued", dispatcher.queuedCount())
            .build();
    }
}
