package com.ivamare.ogcapi.health;

import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.repository.JobRepository;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the job store.
 *
 * <p>Checks:
 * <ul>
 *   <li>The database connection is valid (JDBC store only)</li>
 *   <li>The jobs table can be read, reporting the job count per status</li>
 * </ul>
 */
public class JobStoreHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JobRepository jobRepository;
    private final DataSource dataSource;

    public JobStoreHealthIndicator(JobRepository jobRepository) {
        this(jobRepository, null);
    }

    public JobStoreHealthIndicator(JobRepository jobRepository, DataSource dataSource) {
        this.jobRepository = jobRepository;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Map<JobStatus, Long> counts = jobRepository.countByStatus();
            Map<String, Long> jobs = new LinkedHashMap<>();
            for (JobStatus status : JobStatus.values()) {
                jobs.put(status.value(), counts.getOrDefault(status, 0L));
            }

            Health.Builder builder = Health.up()
                .withDetail("store", jobRepository.getClass().getSimpleName())
                .withDetail("jobs", jobs);

            addPoolStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
