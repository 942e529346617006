package com.ivamare.ogcapi;

import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.handler.HandlerRegistry;
import com.ivamare.ogcapi.lease.AbandonedJobMonitor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;

/**
 * Starts the job dispatcher and the abandoned job monitor once the application is
 * ready, and stops them on shutdown.
 */
public class JobEngineLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobEngineLifecycle.class);

    private final JobDispatcher dispatcher;
    private final AbandonedJobMonitor abandonedJobMonitor;
    private final HandlerRegistry handlerRegistry;
    private final Duration shutdownTimeout;

    public JobEngineLifecycle(
            JobDispatcher dispatcher,
            AbandonedJobMonitor abandonedJobMonitor,
            HandlerRegistry handlerRegistry,
            Duration shutdownTimeout) {
        this.dispatcher = dispatcher;
        this.abandonedJobMonitor = abandonedJobMonitor;
        this.handlerRegistry = handlerRegistry;
        this.shutdownTimeout = shutdownTimeout;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (handlerRegistry.descriptions().isEmpty()) {
            log.warn("No process handlers registered, every execution request will be refused");
        }

        dispatcher.start();
        if (abandonedJobMonitor != null) {
            abandonedJobMonitor.start();
        }
    }

    @PreDestroy
    public void stop() {
        if (abandonedJobMonitor != null) {
            abandonedJobMonitor.stop();
        }

        log.info("Stopping job engine...");
        dispatcher.stop(shutdownTimeout).join();
        log.info("Job engine stopped");
    }
}
