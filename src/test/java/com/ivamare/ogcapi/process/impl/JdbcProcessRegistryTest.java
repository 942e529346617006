package com.ivamare.ogcapi.process.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ogcapi.exception.ProcessNotFoundException;
import com.ivamare.ogcapi.exception.StorageUnavailableException;
import com.ivamare.ogcapi.model.JobControlOption;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("JdbcProcessRegistry")
class JdbcProcessRegistryTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcProcessRegistry registry;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        registry = new JdbcProcessRegistry(jdbcTemplate, new ObjectMapper(), "ogcapi");
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should list summaries ordered by id with the total")
    void shouldListSummaries() {
        ProcessSummary echo = new ProcessSummary("echo", "Echo", null, "1.0.0", null, null, null);
        when(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ogcapi.processes", Long.class)).thenReturn(3L);
        when(jdbcTemplate.query(contains("ORDER BY id"), any(RowMapper.class), eq(1), eq(2)))
            .thenReturn(List.of(echo));

        Page<ProcessSummary> page = registry.list(1, 2);

        assertEquals(3L, page.total());
        assertEquals(List.of(echo), page.items());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should read the summary document and let the row id win")
    void shouldReadSummaryDocument() throws SQLException {
        registry.find("echo");

        ArgumentCaptor<RowMapper<ProcessDescription>> mapperCaptor = ArgumentCaptor.forClass(RowMapper.class);
        verify(jdbcTemplate).query(contains("WHERE id = ?"), mapperCaptor.capture(), eq("echo"));

        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn("echo");
        when(rs.getString("summary")).thenReturn("""
            {"id":"other","title":"Echo","version":"1.0.0",
             "jobControlOptions":["sync-execute","async-execute"],"unknown":true}
            """);
        when(rs.getString("inputs")).thenReturn("""
            {"value":{"title":"Value","minOccurs":0,"schema":{"type":"integer"}}}
            """);
        when(rs.getString("outputs")).thenReturn(null);

        ProcessDescription description = mapperCaptor.getValue().mapRow(rs, 0);

        assertEquals("echo", description.id());
        assertEquals("Echo", description.summary().title());
        assertTrue(description.summary().supports(JobControlOption.SYNC_EXECUTE));
        assertFalse(description.inputs().get("value").isRequired());
        assertTrue(description.outputs().isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should throw ProcessNotFoundException for unknown processes")
    void shouldThrowForUnknownProcess() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("missing"))).thenReturn(List.of());

        assertTrue(registry.find("missing").isEmpty());
        ProcessNotFoundException ex = assertThrows(ProcessNotFoundException.class, () -> registry.get("missing"));
        assertEquals("missing", ex.getProcessId());
    }

    @Test
    @DisplayName("should check existence with a count")
    void shouldCheckExistence() {
        when(jdbcTemplate.queryForObject(contains("WHERE id = ?"), eq(Integer.class), eq("echo"))).thenReturn(1);
        when(jdbcTemplate.queryForObject(contains("WHERE id = ?"), eq(Integer.class), eq("nope"))).thenReturn(0);

        assertTrue(registry.exists("echo"));
        assertFalse(registry.exists("nope"));
    }

    @Test
    @DisplayName("should wrap database failures")
    void shouldWrapDatabaseFailures() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class)))
            .thenThrow(new QueryTimeoutException("statement timeout"));

        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class, () -> registry.list(10, 0));
        assertTrue(ex.isTransientFailure());
    }
}
