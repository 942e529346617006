package com.ivamare.ogcapi.repository.impl;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ivamare.ogcapi.exception.DuplicateJobException;
import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobFilter;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.model.Page;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryJobRepository")
class InMemoryJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryJobRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ObjectNode result(int value) {
        return JsonNodeFactory.instance.objectNode().put("value", value);
    }

    @Test
    @DisplayName("should reject duplicate job ids")
    void shouldRejectDuplicates() {
        repository.create(Job.accepted("job-1", "echo", NOW));

        assertThrows(DuplicateJobException.class, () -> repository.create(Job.accepted("job-1", "echo", NOW)));
    }

    @Test
    @DisplayName("should walk a job through its lifecycle")
    void shouldWalkThroughLifecycle() {
        repository.create(Job.accepted("job-1", "echo", NOW));

        Job running = repository.transition("job-1", JobTransition.start());
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals(NOW, running.started());
        assertNull(running.finished());

        assertTrue(repository.updateProgress("job-1", 60, "more than half"));

        Job done = repository.transition("job-1", JobTransition.succeed(result(42)));
        assertEquals(JobStatus.SUCCESSFUL, done.status());
        assertEquals(100, done.progress());
        assertEquals(NOW, done.finished());
        assertNull(done.results());

        assertEquals(42, repository.get("job-1").results().get("value").asInt());
    }

    @Test
    @DisplayName("terminal jobs should refuse every transition")
    void terminalJobsShouldRefuseTransitions() {
        repository.create(Job.accepted("job-1", "echo", NOW));
        repository.transition("job-1", JobTransition.dismiss());

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
            () -> repository.transition("job-1", JobTransition.start()));
        assertEquals(JobStatus.DISMISSED, ex.getCurrentStatus());
        assertThrows(InvalidTransitionException.class, () -> repository.transition("job-1", JobTransition.abandon("x")));
        assertEquals(JobStatus.DISMISSED, repository.get("job-1").status());
    }

    @Test
    @DisplayName("should ignore progress for jobs that are not running")
    void shouldIgnoreProgressWhenNotRunning() {
        repository.create(Job.accepted("job-1", "echo", NOW));

        assertFalse(repository.updateProgress("job-1", 10, null));
        assertFalse(repository.updateProgress("missing", 10, null));
        assertNull(repository.get("job-1").progress());
    }

    @Test
    @DisplayName("should throw JobNotFoundException for unknown jobs")
    void shouldThrowForUnknownJobs() {
        assertThrows(JobNotFoundException.class, () -> repository.transition("missing", JobTransition.start()));
        assertThrows(JobNotFoundException.class, () -> repository.delete("missing"));
    }

    @Test
    @DisplayName("should list in creation order with the total, without results")
    void shouldListInCreationOrder() {
        for (int i = 0; i < 25; i++) {
            repository.create(Job.accepted(String.format("job-%02d", i), i % 2 == 0 ? "echo" : "buffer",
                NOW.plusSeconds(i)));
        }
        repository.transition("job-00", JobTransition.start());
        repository.transition("job-00", JobTransition.succeed(result(1)));

        Page<Job> page = repository.list(JobFilter.all(), 10, 0);
        assertEquals(25, page.total());
        assertEquals("job-00", page.items().get(0).jobId());
        assertNull(page.items().get(0).results());

        Page<Job> filtered = repository.list(new JobFilter(List.of("echo"), Set.of()), 5, 10);
        assertEquals(13, filtered.total());
        assertEquals(3, filtered.items().size());
        assertEquals("job-20", filtered.items().get(0).jobId());
    }

    @Test
    @DisplayName("should find stale non-terminal jobs and count by status")
    void shouldFindStaleJobs() {
        repository.create(Job.accepted("old", "echo", NOW.minusSeconds(600)));
        repository.create(Job.accepted("fresh", "echo", NOW));

        List<Job> stale = repository.findStale(NOW.minusSeconds(300));

        assertEquals(List.of("old"), stale.stream().map(Job::jobId).toList());
        assertEquals(Map.of(JobStatus.ACCEPTED, 2L), repository.countByStatus());
    }

    @RepeatedTest(20)
    @DisplayName("exactly one of a racing dismissal and completion should win")
    void racingDismissAndCompleteShouldHaveOneWinner() throws Exception {
        repository.create(Job.accepted("job-1", "echo", NOW));
        repository.transition("job-1", JobTransition.start());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<Boolean> dismiss = pool.submit(() -> attempt(go, JobTransition.dismiss()));
            Future<Boolean> complete = pool.submit(() -> attempt(go, JobTransition.succeed(result(7))));
            go.countDown();

            boolean dismissed = dismiss.get(5, TimeUnit.SECONDS);
            boolean completed = complete.get(5, TimeUnit.SECONDS);

            assertTrue(dismissed ^ completed);
            Job job = repository.get("job-1");
            assertEquals(dismissed ? JobStatus.DISMISSED : JobStatus.SUCCESSFUL, job.status());
            assertEquals(completed, job.results() != null);
        } finally {
            pool.shutdownNow();
        }
    }

    private boolean attempt(CountDownLatch go, JobTransition transition) throws InterruptedException {
        go.await();
        try {
            repository.transition("job-1", transition);
            return true;
        } catch (InvalidTransitionException e) {
            return false;
        }
    }
}
