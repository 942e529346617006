package com.ivamare.ogcapi.repository.impl;

import com.ivamare.ogcapi.exception.DuplicateJobException;
import com.ivamare.ogcapi.exception.InvalidTransitionException;
import com.ivamare.ogcapi.exception.JobNotFoundException;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobFilter;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.JobTransition;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job store kept in process memory. Jobs are lost on restart.
 *
 * <p>Each mutation runs inside {@link ConcurrentHashMap#compute}, which holds the
 * entry's lock for the duration of the status check and the write.
 */
public class InMemoryJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRepository.class);

    private static final Comparator<Job> LISTING_ORDER =
        Comparator.comparing(Job::created).thenComparing(Job::jobId);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void create(Job job) {
        if (job.status() != JobStatus.ACCEPTED) {
            throw new IllegalArgumentException("New jobs must be accepted, got " + job.status());
        }
        if (jobs.putIfAbsent(job.jobId(), job.withoutResults()) != null) {
            throw new DuplicateJobException(job.jobId());
        }
        log.debug("Created job {} for process {}", job.jobId(), job.processId());
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Page<Job> list(JobFilter filter, int limit, int offset) {
        List<Job> matching = jobs.values().stream()
            .filter(filter::matches)
            .sorted(LISTING_ORDER)
            .toList();

        List<Job> page = matching.stream()
            .skip(offset)
            .limit(limit)
            .map(Job::withoutResults)
            .toList();

        return new Page<>(page, matching.size());
    }

    @Override
    public Job transition(String jobId, JobTransition transition) {
        RuntimeException[] failure = new RuntimeException[1];

        Job updated = jobs.computeIfPresent(jobId, (id, current) -> {
            if (!transition.effectiveFrom().contains(current.status())) {
                failure[0] = new InvalidTransitionException(id, current.status(), transition.target());
                return current;
            }
            return apply(current, transition, clock.instant());
        });

        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        if (failure[0] != null) {
            throw failure[0];
        }

        log.debug("Job {} moved to {}", jobId, transition.target());
        return updated.withoutResults();
    }

    @Override
    public boolean updateProgress(String jobId, int progress, String message) {
        boolean[] applied = new boolean[1];
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.status() != JobStatus.RUNNING) {
                return current;
            }
            applied[0] = true;
            return new Job(id, current.processId(), current.status(),
                message != null ? message : current.message(),
                progress, current.results(),
                current.created(), current.started(), current.finished(), clock.instant());
        });
        return applied[0];
    }

    @Override
    public void delete(String jobId) {
        if (jobs.remove(jobId) == null) {
            throw new JobNotFoundException(jobId);
        }
        log.debug("Deleted job {}", jobId);
    }

    @Override
    public List<Job> findStale(Instant updatedBefore) {
        return jobs.values().stream()
            .filter(job -> !job.isTerminal())
            .filter(job -> job.updated().isBefore(updatedBefore))
            .sorted(Comparator.comparing(Job::updated))
            .map(Job::withoutResults)
            .toList();
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        jobs.values().forEach(job -> counts.merge(job.status(), 1L, Long::sum));
        return counts;
    }

    private static Job apply(Job current, JobTransition transition, Instant now) {
        JobStatus target = transition.target();
        return new Job(
            current.jobId(),
            current.processId(),
            target,
            transition.message(),
            target == JobStatus.SUCCESSFUL ? Integer.valueOf(100) : current.progress(),
            transition.results(),
            current.created(),
            current.started() == null && target == JobStatus.RUNNING ? now : current.started(),
            current.finished() == null && target.isTerminal() ? now : current.finished(),
            now
        );
    }
}
