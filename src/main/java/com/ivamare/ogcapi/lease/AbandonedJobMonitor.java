package com.ivamare.ogcapi.lease;

import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fails jobs that nobody is working on any more.
 *
 * <p>A job is abandoned when it is accepted or running, has not been updated for
 * longer than the lease timeout, and is not queued or running in the local
 * dispatcher. This covers jobs left behind by a crashed or restarted server.
 */
public class AbandonedJobMonitor {

    private static final Logger log = LoggerFactory.getLogger(AbandonedJobMonitor.class);

    private final JobRepository jobRepository;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private final Duration leaseTimeout;
    private final Duration checkInterval;

    private ScheduledExecutorService scheduler;

    public AbandonedJobMonitor(
            JobRepository jobRepository,
            JobDispatcher dispatcher,
            Clock clock,
            Duration leaseTimeout,
            Duration checkInterval) {
        this.jobRepository = jobRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.leaseTimeout = leaseTimeout;
        this.checkInterval = checkInterval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "ogcapi-lease-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::reapSafely,
            checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Started abandoned job monitor, leaseTimeout={}, checkInterval={}", leaseTimeout, checkInterval);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Stopped abandoned job monitor");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * Fail every abandoned job found now.
     *
     * @return number of jobs failed
     */
    public int reap() {
        Instant cutoff = clock.instant().minus(leaseTimeout);
        List<Job> stale = jobRepository.findStale(cutoff);

        int reaped = 0;
        for (Job job : stale) {
            if (dispatcher.isTracked(job.jobId())) {
                continue;
            }
            try {
                jobRepository.transition(job.jobId(), JobTransition.abandon(
                    "Job abandoned: no update since " + job.updated()));
                log.warn("Job {} ({}) abandoned while {}, marked failed",
                    job.jobId(), job.processId(), job.status());
                reaped++;
            } catch (InvalidTransitionException | JobNotFoundException e) {
                log.debug("Stale job {} settled concurrently: {}", job.jobId(), e.getMessage());
            }
        }

        if (reaped > 0) {
            log.info("Reaped {} abandoned jobs", reaped);
        }
        return reaped;
    }

    private void reapSafely() {
        try {
            reap();
        } catch (RuntimeException e) {
            log.error("Abandoned job check failed", e);
        }
    }
}
