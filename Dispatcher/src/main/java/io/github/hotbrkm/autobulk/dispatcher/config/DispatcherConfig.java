package io.github.hotbrkm.autobulk.dispatcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.autobulk.dispatcher.job.JobService;
import io.github.hotbrkm.autobulk.dispatcher.recipient.CacheRecipientResolver;
import io.github.hotbrkm.autobulk.dispatcher.recipient.RecipientCache;
import io.github.hotbrkm.autobulk.dispatcher.recipient.RecipientResolver;
import io.github.hotbrkm.autobulk.dispatcher.schedule.CronRunScheduler;
import io.github.hotbrkm.autobulk.dispatcher.schedule.RunScheduler;
import io.github.hotbrkm.autobulk.dispatcher.send.DispatchGateway;
import io.github.hotbrkm.autobulk.dispatcher.send.LoggingDispatchGateway;
import io.github.hotbrkm.autobulk.dispatcher.send.PassThroughTemplateRenderer;
import io.github.hotbrkm.autobulk.dispatcher.send.TemplateRenderer;
import io.github.hotbrkm.autobulk.dispatcher.store.ExecutionLog;
import io.github.hotbrkm.autobulk.dispatcher.store.JdbcExecutionLog;
import io.github.hotbrkm.autobulk.dispatcher.store.JdbcJobStore;
import io.github.hotbrkm.autobulk.dispatcher.store.JobStore;
import io.github.hotbrkm.autobulk.dispatcher.worker.DispatchWorker;
import io.github.hotbrkm.autobulk.dispatcher.worker.DispatchWorkerFactory;
import io.github.hotbrkm.autobulk.dispatcher.worker.WorkerRuntimeOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RunScheduler runScheduler() {
        return new CronRunScheduler();
    }

    @Bean
    public JobStore jobStore(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcJobStore(jdbcTemplate, objectMapper);
    }

    @Bean
    public ExecutionLog executionLog(NamedParameterJdbcTemplate jdbcTemplate) {
        return new JdbcExecutionLog(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecipientResolver recipientResolver(DispatcherProperties properties, ObjectMapper objectMapper) {
        Path cachePath = Path.of(properties.getRecipients().resolveCachePath());
        return new CacheRecipientResolver(new RecipientCache(cachePath, objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer() {
        return new PassThroughTemplateRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchGateway dispatchGateway() {
        return new LoggingDispatchGateway();
    }

    @Bean
    public JobService jobService(JobStore jobStore, ExecutionLog executionLog, RunScheduler runScheduler, Clock clock,
                                 DispatcherProperties properties) {
        DispatcherProperties.Retry retry = properties.getRetry();
        return new JobService(jobStore, executionLog, runScheduler, clock,
                retry.resolveDefaultMaxRetries(), retry.resolveDefaultBackoffBaseSeconds(),
                ZoneId.of(properties.getSchedule().resolveDefaultTimeZone()));
    }

    /**
     * DispatchWorker Bean.
     * Calls start() on application startup and shutdown() on termination.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "autobulk.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DispatchWorker dispatchWorker(JobStore jobStore, ExecutionLog executionLog, RunScheduler runScheduler,
                                         RecipientResolver recipientResolver, TemplateRenderer templateRenderer,
                                         DispatchGateway dispatchGateway, TransactionTemplate transactionTemplate,
                                         Clock clock, DispatcherProperties properties) {
        DispatchWorkerFactory.Components components = new DispatchWorkerFactory.Components(jobStore, executionLog,
                runScheduler, recipientResolver, templateRenderer, dispatchGateway, transactionTemplate, clock);
        return DispatchWorkerFactory.create(components, WorkerRuntimeOptions.fromProperties(properties));
    }
}
