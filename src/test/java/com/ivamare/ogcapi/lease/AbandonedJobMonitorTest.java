package com.ivamare.ogcapi.lease;

import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.repository.JobRepository;
import com.ivamare.ogcapi.repository.impl.InMemoryJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("AbandonedJobMonitor")
class AbandonedJobMonitorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryJobRepository jobRepository;
    private JobDispatcher dispatcher;
    private AbandonedJobMonitor monitor;

    @BeforeEach
    void setUp() {
        jobRepository = new InMemoryJobRepository(CLOCK);
        dispatcher = mock(JobDispatcher.class);
        monitor = new AbandonedJobMonitor(jobRepository, dispatcher, CLOCK,
            Duration.ofMinutes(5), Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    @Test
    @DisplayName("should fail stale jobs nobody is working on")
    void shouldFailStaleJobs() {
        jobRepository.create(Job.accepted("lost", "echo", NOW.minus(Duration.ofMinutes(10))));
        jobRepository.create(Job.accepted("fresh", "echo", NOW.minus(Duration.ofMinutes(1))));

        int reaped = monitor.reap();

        assertEquals(1, reaped);
        Job lost = jobRepository.get("lost");
        assertEquals(JobStatus.FAILED, lost.status());
        assertTrue(lost.message().startsWith("Job abandoned: no update since"));
        assertEquals(JobStatus.ACCEPTED, jobRepository.get("fresh").status());
    }

    @Test
    @DisplayName("should leave jobs that the local dispatcher still tracks")
    void shouldLeaveTrackedJobs() {
        jobRepository.create(Job.accepted("queued", "echo", NOW.minus(Duration.ofMinutes(10))));
        when(dispatcher.isTracked("queued")).thenReturn(true);

        assertEquals(0, monitor.reap());
        assertEquals(JobStatus.ACCEPTED, jobRepository.get("queued").status());
    }

    @Test
    @DisplayName("should skip jobs that settle while being reaped")
    void shouldSkipJobsSettledConcurrently() {
        JobRepository repository = mock(JobRepository.class);
        Job stale = Job.accepted("racy", "echo", NOW.minus(Duration.ofMinutes(10)));
        when(repository.findStale(NOW.minus(Duration.ofMinutes(5)))).thenReturn(List.of(stale));
        when(repository.transition(eq("racy"), any(JobTransition.class)))
            .thenThrow(new InvalidTransitionException("racy", JobStatus.SUCCESSFUL, JobStatus.FAILED));

        AbandonedJobMonitor racing = new AbandonedJobMonitor(repository, dispatcher, CLOCK,
            Duration.ofMinutes(5), Duration.ofMinutes(1));

        assertEquals(0, racing.reap());
    }

    @Test
    @DisplayName("should reap periodically once started")
    void shouldReapPeriodically() {
        jobRepository.create(Job.accepted("lost", "echo", NOW.minus(Duration.ofMinutes(10))));

        monitor.start();
        monitor.start();
        assertTrue(monitor.isRunning());

        long deadline = System.currentTimeMillis() + 5000;
        while (jobRepository.get("lost").status() != JobStatus.FAILED && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        assertEquals(JobStatus.FAILED, jobRepository.get("lost").status());

        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
