package com.ivamare.ogcapi.health;

import com.ivamare.ogcapi.OgcApiAutoConfiguration;
import com.ivamare.ogcapi.OgcApiProperties;
import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.repository.JobRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the job store and dispatcher health indicators.
 */
@AutoConfiguration(after = OgcApiAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "ogcapi", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(JobRepository.class)
    @ConditionalOnMissingBean(JobStoreHealthIndicator.class)
    public JobStoreHealthIndicator jobStoreHealthIndicator(
            JobRepository jobRepository,
            OgcApiProperties properties,
            ObjectProvider<DataSource> dataSource) {
        DataSource jdbcStore = properties.getStore() == OgcApiProperties.StoreType.JDBC
            ? dataSource.getIfAvailable()
            : null;
        return new JobStoreHealthIndicator(jobRepository, jdbcStore);
    }

    @Bean
    @ConditionalOnBean(JobDispatcher.class)
    @ConditionalOnMissingBean(JobDispatcherHealthIndicator.class)
    public JobDispatcherHealthIndicator jobDispatcherHealthIndicator(JobDispatcher dispatcher) {
        return new JobDispatcherHealthIndicator(dispatcher);
    }
}
