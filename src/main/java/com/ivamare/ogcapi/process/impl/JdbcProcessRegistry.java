package com.ivamare.ogcapi.process.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ogcapi.exception.DatabaseExceptionClassifier;
import com.ivamare.ogcapi.model.InputDescription;
import com.ivamare.ogcapi.model.OutputDescription;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;
import com.ivamare.ogcapi.process.ProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC implementation of ProcessRegistry over the {@code processes} table.
 *
 * <p>The {@code summary} column holds the summary fields (title, description,
 * version, jobControlOptions, outputTransmission); the row id always wins over any
 * id inside the document.
 */
public class JdbcProcessRegistry implements ProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(JdbcProcessRegistry.class);
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final TypeReference<Map<String, InputDescription>> INPUTS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, OutputDescription>> OUTPUTS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String table;

    private final RowMapper<ProcessSummary> summaryMapper;
    private final RowMapper<ProcessDescription> descriptionMapper;

    public JdbcProcessRegistry(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, String schema) {
        if (schema == null || !SCHEMA_NAME.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.table = schema + ".processes";

        this.summaryMapper = (rs, rowNum) ->
            readSummary(rs.getString("id"), rs.getString("summary"));
        this.descriptionMapper = (rs, rowNum) -> new ProcessDescription(
            readSummary(rs.getString("id"), rs.getString("summary")),
            readJson(rs.getString("inputs"), INPUTS_TYPE),
            readJson(rs.getString("outputs"), OUTPUTS_TYPE)
        );
    }

    @Override
    public Page<ProcessSummary> list(int limit, int offset) {
        String sql = """
            SELECT id, summary
            FROM %s
            ORDER BY id
            LIMIT ? OFFSET ?
            """.formatted(table);

        try {
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            List<ProcessSummary> summaries = jdbcTemplate.query(sql, summaryMapper, limit, offset);
            log.debug("Listed {} processes (limit={}, offset={})", summaries.size(), limit, offset);
            return new Page<>(summaries, total != null ? total : 0L);
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.toStorageException("list processes", e);
        }
    }

    @Override
    public Optional<ProcessDescription> find(String processId) {
        String sql = "SELECT id, summary, inputs, outputs FROM " + table + " WHERE id = ?";

        try {
            List<ProcessDescription> results = jdbcTemplate.query(sql, descriptionMapper, processId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.toStorageException("read process " + processId, e);
        }
    }

    @Override
    public boolean exists(String processId) {
        String sql = "SELECT COUNT(*) FROM " + table + " WHERE id = ?";

        try {
            Integer count = jdbcTemplate.queryForObject(sql, Integer.class, processId);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.toStorageException("read process " + processId, e);
        }
    }

    private ProcessSummary readSummary(String id, String json) {
        ProcessSummary stored = json != null
            ? readJson(json, new TypeReference<ProcessSummary>() {})
            : null;
        if (stored == null) {
            return new ProcessSummary(id, id, null, null, null, null, null);
        }
        return new ProcessSummary(id, stored.title(), stored.description(), stored.version(),
            stored.jobControlOptions(), stored.outputTransmission(), null);
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed process catalog entry in " + table, e);
        }
    }
}
