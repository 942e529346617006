package com.ivamare.ogcapi;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the OGC API - Processes service.
 *
 * <p>Example configuration:
 * <pre>
 * ogcapi:
 *   public-url: https://example.org/ogcapi
 *   title: Processing server
 *   store: jdbc
 *   schema: ogcapi
 *   paging:
 *     default-limit: 10
 *     max-limit: 1000
 *   execution:
 *     concurrency: 4
 *     queue-capacity: 1000
 *     sync-timeout: 30s
 *     shutdown-timeout: 30s
 *   lease:
 *     enabled: true
 *     timeout: 5m
 *     check-interval: 1m
 * </pre>
 */
@ConfigurationProperties(prefix = "ogcapi")
public class OgcApiProperties {

    /**
     * Enable/disable the OGC API auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Base URL used in every link and in the Location header.
     */
    private String publicUrl = "http://localhost:8080";

    /**
     * Landing page title.
     */
    private String title = "OGC API - Processes";

    /**
     * Landing page description.
     */
    private String description = "Asynchronous process execution";

    /**
     * Where jobs and the process catalog are kept.
     */
    private StoreType store = StoreType.JDBC;

    /**
     * Database schema holding the jobs and processes tables.
     */
    private String schema = "ogcapi";

    private PagingProperties paging = new PagingProperties();

    private ExecutionProperties execution = new ExecutionProperties();

    private LeaseProperties lease = new LeaseProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public void setPublicUrl(String publicUrl) {
        this.publicUrl = publicUrl;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public PagingProperties getPaging() {
        return paging;
    }

    public void setPaging(PagingProperties paging) {
        this.paging = paging;
    }

    public ExecutionProperties getExecution() {
        return execution;
    }

    public void setExecution(ExecutionProperties execution) {
        this.execution = execution;
    }

    public LeaseProperties getLease() {
        return lease;
    }

    public void setLease(LeaseProperties lease) {
        this.lease = lease;
    }

    public enum StoreType {
        /** PostgreSQL through JdbcTemplate */
        JDBC,
        /** Process memory, lost on restart */
        MEMORY
    }

    /**
     * Listing page sizes.
     */
    public static class PagingProperties {

        /**
         * Limit used when the request has none.
         */
        private int defaultLimit = 10;

        /**
         * Larger requested limits are clamped to this.
         */
        private int maxLimit = 1000;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    /**
     * Job execution.
     */
    public static class ExecutionProperties {

        /**
         * Worker threads running job work units.
         */
        private int concurrency = 4;

        /**
         * Jobs that may wait for a worker thread.
         */
        private int queueCapacity = 1000;

        /**
         * Longest wait honoured for a synchronous execution request.
         */
        private Duration syncTimeout = Duration.ofSeconds(30);

        /**
         * Time given to in-flight jobs on shutdown.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getSyncTimeout() {
            return syncTimeout;
        }

        public void setSyncTimeout(Duration syncTimeout) {
            this.syncTimeout = syncTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Abandoned job detection.
     */
    public static class LeaseProperties {

        private boolean enabled = true;

        /**
         * How long an accepted or running job may go without an update.
         */
        private Duration timeout = Duration.ofMinutes(5);

        private Duration checkInterval = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }
    }
}
