package com.ivamare.ogcapi.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ogcapi.exception.DatabaseExceptionClassifier;
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
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * JDBC (PostgreSQL) implementation of JobRepository.
 *
 * <p>Status changes are a single {@code UPDATE ... WHERE status IN (...) RETURNING ...}
 * so concurrent transitions of the same job are serialized by the database row lock.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String STATUS_COLUMNS =
        "job_id, process_id, status, message, progress, created, started, finished, updated";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String table;
    private final RowMapper<Job> statusMapper;
    private final RowMapper<Job> fullMapper;

    public JdbcJobRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, String schema, Clock clock) {
        if (schema == null || !SCHEMA_NAME.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.table = schema + ".jobs";
        this.statusMapper = createMapper(false);
        this.fullMapper = createMapper(true);
    }

    private RowMapper<Job> createMapper(boolean withResults) {
        return (rs, rowNum) -> {
            Object progress = rs.getObject("progress");
            return new Job(
                rs.getString("job_id"),
                rs.getString("process_id"),
                JobStatus.fromValue(rs.getString("status")),
                rs.getString("message"),
                progress != null ? ((Number) progress).intValue() : null,
                withResults ? deserializeJson(rs.getString("results")) : null,
                toInstant(rs.getTimestamp("created")),
                toInstant(rs.getTimestamp("started")),
                toInstant(rs.getTimestamp("finished")),
                toInstant(rs.getTimestamp("updated"))
            );
        };
    }

    @Override
    public void create(Job job) {
        if (job.status() != JobStatus.ACCEPTED) {
            throw new IllegalArgumentException("New jobs must be accepted, got " + job.status());
        }

        String sql = """
            INSERT INTO %s (
                job_id, process_id, status, message, progress, results,
                created, started, finished, updated
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
            """.formatted(table);

        try {
            withStore("create job " + job.jobId(), () -> jdbcTemplate.update(sql,
                job.jobId(),
                job.processId(),
                job.status().value(),
                job.message(),
                job.progress(),
                null,
                toTimestamp(job.created()),
                toTimestamp(job.started()),
                toTimestamp(job.finished()),
                toTimestamp(job.updated())
            ));
        } catch (DuplicateKeyException e) {
            throw new DuplicateJobException(job.jobId());
        }

        log.debug("Created job {} for process {}", job.jobId(), job.processId());
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT " + STATUS_COLUMNS + ", results FROM " + table + " WHERE job_id = ?";

        List<Job> results = withStore("read job " + jobId,
            () -> jdbcTemplate.query(sql, fullMapper, jobId));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Page<Job> list(JobFilter filter, int limit, int offset) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(filter, params);

        String countSql = "SELECT COUNT(*) FROM " + table + where;
        Long total = withStore("count jobs",
            () -> jdbcTemplate.queryForObject(countSql, Long.class, params.toArray()));

        String sql = """
            SELECT %s
            FROM %s%s
            ORDER BY created ASC, job_id ASC
            LIMIT ? OFFSET ?
            """.formatted(STATUS_COLUMNS, table, where);

        params.add(limit);
        params.add(offset);
        List<Job> jobs = withStore("list jobs",
            () -> jdbcTemplate.query(sql, statusMapper, params.toArray()));

        return new Page<>(jobs, total != null ? total : 0L);
    }

    @Override
    public Job transition(String jobId, JobTransition transition) {
        Set<JobStatus> from = transition.effectiveFrom();
        JobStatus target = transition.target();

        if (from.isEmpty()) {
            throw rejected(jobId, target);
        }

        Instant now = clock.instant();
        String sql = """
            UPDATE %s SET
                status = ?,
                message = ?,
                progress = COALESCE(?, progress),
                results = ?::jsonb,
                started = COALESCE(started, ?),
                finished = COALESCE(finished, ?),
                updated = ?
            WHERE job_id = ? AND status IN (%s)
            RETURNING %s
            """.formatted(table, placeholders(from.size()), STATUS_COLUMNS);

        List<Object> params = new ArrayList<>();
        params.add(target.value());
        params.add(transition.message());
        params.add(target == JobStatus.SUCCESSFUL ? 100 : null);
        params.add(serializeJson(transition.results()));
        params.add(target == JobStatus.RUNNING ? Timestamp.from(now) : null);
        params.add(target.isTerminal() ? Timestamp.from(now) : null);
        params.add(Timestamp.from(now));
        params.add(jobId);
        from.forEach(status -> params.add(status.value()));

        List<Job> updated = withStore("update job " + jobId,
            () -> jdbcTemplate.query(sql, statusMapper, params.toArray()));

        if (updated.isEmpty()) {
            throw rejected(jobId, target);
        }

        log.debug("Job {} moved to {}", jobId, target);
        return updated.get(0);
    }

    @Override
    public boolean updateProgress(String jobId, int progress, String message) {
        String sql = """
            UPDATE %s SET
                progress = ?,
                message = COALESCE(?, message),
                updated = ?
            WHERE job_id = ? AND status = ?
            """.formatted(table);

        int rows = withStore("update progress of job " + jobId, () -> jdbcTemplate.update(sql,
            progress,
            message,
            Timestamp.from(clock.instant()),
            jobId,
            JobStatus.RUNNING.value()
        ));
        return rows > 0;
    }

    @Override
    public void delete(String jobId) {
        String sql = "DELETE FROM " + table + " WHERE job_id = ?";

        int rows = withStore("delete job " + jobId, () -> jdbcTemplate.update(sql, jobId));
        if (rows == 0) {
            throw new JobNotFoundException(jobId);
        }
        log.debug("Deleted job {}", jobId);
    }

    @Override
    public List<Job> findStale(Instant updatedBefore) {
        String sql = """
            SELECT %s
            FROM %s
            WHERE status IN (?, ?) AND updated < ?
            ORDER BY updated ASC
            """.formatted(STATUS_COLUMNS, table);

        return withStore("find stale jobs", () -> jdbcTemplate.query(sql, statusMapper,
            JobStatus.ACCEPTED.value(),
            JobStatus.RUNNING.value(),
            Timestamp.from(updatedBefore)
        ));
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS job_count FROM " + table + " GROUP BY status";

        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        withStore("count jobs by status", () -> {
            jdbcTemplate.query(sql, (RowCallbackHandler) rs ->
                counts.put(JobStatus.fromValue(rs.getString("status")), rs.getLong("job_count")));
            return null;
        });
        return counts;
    }

    /**
     * Tell apart "no such job" from "job in the wrong status" after a rejected update.
     */
    private RuntimeException rejected(String jobId, JobStatus target) {
        String sql = "SELECT status FROM " + table + " WHERE job_id = ?";
        List<String> current = withStore("read status of job " + jobId,
            () -> jdbcTemplate.queryForList(sql, String.class, jobId));

        if (current.isEmpty()) {
            return new JobNotFoundException(jobId);
        }
        return new InvalidTransitionException(jobId, JobStatus.fromValue(current.get(0)), target);
    }

    private String whereClause(JobFilter filter, List<Object> params) {
        List<String> conditions = new ArrayList<>();
        if (!filter.processIds().isEmpty()) {
            conditions.add("process_id IN (" + placeholders(filter.processIds().size()) + ")");
            params.addAll(filter.processIds());
        }
        if (!filter.statuses().isEmpty()) {
            conditions.add("status IN (" + placeholders(filter.statuses().size()) + ")");
            filter.statuses().stream()
                .sorted()
                .forEach(status -> params.add(status.value()));
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.toStorageException(operation, e);
        }
    }

    private String serializeJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize job results", e);
        }
    }

    private JsonNode deserializeJson(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize job results", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
