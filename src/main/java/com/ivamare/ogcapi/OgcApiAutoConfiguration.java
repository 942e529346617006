package com.ivamare.ogcapi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.ogcapi.execution.JobDispatcher;
import com.ivamare.ogcapi.execution.JobExecutionController;
import com.ivamare.ogcapi.execution.JobRunner;
import com.ivamare.ogcapi.execution.impl.ExecutorJobDispatcher;
import com.ivamare.ogcapi.handler.HandlerRegistry;
import com.ivamare.ogcapi.handler.ProcessHandler;
import com.ivamare.ogcapi.handler.builtin.EchoProcessHandler;
import com.ivamare.ogcapi.handler.impl.DefaultHandlerRegistry;
import com.ivamare.ogcapi.lease.AbandonedJobMonitor;
import com.ivamare.ogcapi.lifecycle.JobLifecycleService;
import com.ivamare.ogcapi.link.LinkBuilder;
import com.ivamare.ogcapi.process.ProcessRegistry;
import com.ivamare.ogcapi.process.impl.InMemoryProcessRegistry;
import com.ivamare.ogcapi.process.impl.JdbcProcessRegistry;
import com.ivamare.ogcapi.repository.JobRepository;
import com.ivamare.ogcapi.repository.impl.InMemoryJobRepository;
import com.ivamare.ogcapi.repository.impl.JdbcJobRepository;
import com.ivamare.ogcapi.web.ApiDocument;
import com.ivamare.ogcapi.web.ApiExceptionHandler;
import com.ivamare.ogcapi.web.ApiLinks;
import com.ivamare.ogcapi.web.ApiModule;
import com.ivamare.ogcapi.web.CoreApiModule;
import com.ivamare.ogcapi.web.JobsController;
import com.ivamare.ogcapi.web.LandingController;
import com.ivamare.ogcapi.web.ProcessesApiModule;
import com.ivamare.ogcapi.web.ProcessesController;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the OGC API - Processes job engine.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Job store and process catalog (JDBC or in-memory, per {@code ogcapi.store})</li>
 *   <li>Handler registry with every {@link ProcessHandler} bean, including {@code echo}</li>
 *   <li>Job dispatcher, execution controller and lifecycle service</li>
 *   <li>Abandoned job monitor</li>
 *   <li>HTTP endpoints, in a servlet web application</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * ogcapi.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    JacksonAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "ogcapi", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(OgcApiProperties.class)
public class OgcApiAutoConfiguration {

    // --- Infrastructure ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper ogcApiObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock ogcApiClock() {
        return Clock.systemUTC();
    }

    // --- Stores ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "ogcapi", name = "store", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public JobRepository jobRepository(
                JdbcTemplate jdbcTemplate,
                ObjectMapper objectMapper,
                OgcApiProperties properties,
                Clock clock) {
            return new JdbcJobRepository(jdbcTemplate, objectMapper, properties.getSchema(), clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public ProcessRegistry processRegistry(
                JdbcTemplate jdbcTemplate,
                ObjectMapper objectMapper,
                OgcApiProperties properties) {
            return new JdbcProcessRegistry(jdbcTemplate, objectMapper, properties.getSchema());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "ogcapi", name = "store", havingValue = "memory")
    static class MemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public JobRepository jobRepository(Clock clock) {
            return new InMemoryJobRepository(clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public ProcessRegistry processRegistry(HandlerRegistry handlerRegistry) {
            return new InMemoryProcessRegistry(handlerRegistry.descriptions());
        }
    }

    // --- Handlers ---

    @Bean
    @ConditionalOnMissingBean
    public EchoProcessHandler echoProcessHandler(ObjectMapper objectMapper) {
        return new EchoProcessHandler(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ObjectProvider<ProcessHandler> handlers) {
        return new DefaultHandlerRegistry(handlers.orderedStream().toList());
    }

    // --- Execution ---

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(HandlerRegistry handlerRegistry) {
        return new JobRunner(handlerRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDispatcher jobDispatcher(JobRunner jobRunner, OgcApiProperties properties) {
        OgcApiProperties.ExecutionProperties execution = properties.getExecution();
        return new ExecutorJobDispatcher(jobRunner, execution.getConcurrency(), execution.getQueueCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutionController jobExecutionController(
            ProcessRegistry processRegistry,
            HandlerRegistry handlerRegistry,
            JobRepository jobRepository,
            JobDispatcher jobDispatcher,
            Clock clock) {
        return new JobExecutionController(processRegistry, handlerRegistry, jobRepository, jobDispatcher, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobLifecycleService jobLifecycleService(
            JobRepository jobRepository,
            JobExecutionController jobExecutionController,
            JobDispatcher jobDispatcher) {
        return new JobLifecycleService(jobRepository, jobExecutionController, jobDispatcher);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ogcapi.lease", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AbandonedJobMonitor abandonedJobMonitor(
            JobRepository jobRepository,
            JobDispatcher jobDispatcher,
            Clock clock,
            OgcApiProperties properties) {
        OgcApiProperties.LeaseProperties lease = properties.getLease();
        return new AbandonedJobMonitor(jobRepository, jobDispatcher, clock, lease.getTimeout(), lease.getCheckInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobEngineLifecycle jobEngineLifecycle(
            JobDispatcher jobDispatcher,
            ObjectProvider<AbandonedJobMonitor> abandonedJobMonitor,
            HandlerRegistry handlerRegistry,
            OgcApiProperties properties) {
        return new JobEngineLifecycle(jobDispatcher, abandonedJobMonitor.getIfAvailable(), handlerRegistry,
            properties.getExecution().getShutdownTimeout());
    }

    // --- API document ---

    @Bean
    @ConditionalOnMissingBean
    public ApiLinks apiLinks(OgcApiProperties properties) {
        return new ApiLinks(properties.getPublicUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public LinkBuilder linkBuilder() {
        return new LinkBuilder();
    }

    @Bean
    public CoreApiModule coreApiModule() {
        return new CoreApiModule();
    }

    @Bean
    public ProcessesApiModule processesApiModule() {
        return new ProcessesApiModule();
    }

    @Bean
    @ConditionalOnMissingBean
    public ApiDocument apiDocument(OgcApiProperties properties, ApiLinks apiLinks, ObjectProvider<ApiModule> modules) {
        List<ApiModule> ordered = modules.orderedStream().toList();
        return ApiDocument.assemble(properties.getTitle(), properties.getDescription(), apiLinks, ordered);
    }

    // --- HTTP endpoints ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class WebConfiguration {

        @Bean
        public LandingController landingController(ApiDocument apiDocument) {
            return new LandingController(apiDocument);
        }

        @Bean
        public ProcessesController processesController(
                ProcessRegistry processRegistry,
                JobLifecycleService jobLifecycleService,
                LinkBuilder linkBuilder,
                ApiLinks apiLinks,
                OgcApiProperties properties) {
            return new ProcessesController(processRegistry, jobLifecycleService, linkBuilder, apiLinks,
                properties.getPaging(), properties.getExecution().getSyncTimeout());
        }

        @Bean
        public JobsController jobsController(
                JobLifecycleService jobLifecycleService,
                LinkBuilder linkBuilder,
                ApiLinks apiLinks,
                OgcApiProperties properties) {
            return new JobsController(jobLifecycleService, linkBuilder, apiLinks, properties.getPaging());
        }

        @Bean
        public ApiExceptionHandler apiExceptionHandler() {
            return new ApiExceptionHandler();
        }
    }
}
