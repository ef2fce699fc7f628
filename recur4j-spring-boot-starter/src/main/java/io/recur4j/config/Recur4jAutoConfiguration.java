package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobHandler;
import io.recur4j.Scheduler;
import io.recur4j.core.JobHandlerRegistry;
import io.recur4j.core.JobRepository;
import io.recur4j.internal.DefaultScheduler;
import io.recur4j.internal.mongo.MongoJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for recur4j components.
 *
 * <p>Jobs are persisted to MongoDB when a {@link MongoTemplate} bean exists; otherwise they
 * only live as long as the application.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "recur4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Recur4jAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(Recur4jAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "recur4j")
    @ConditionalOnMissingBean
    public SchedulerProperties schedulerProperties() {
        return new SchedulerProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler>> handlersProvider) {
        List<JobHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return JobHandlerRegistry.withLoggingFallback(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRepository jobRepository(ObjectProvider<MongoTemplate> mongoTemplate,
                                       ObjectProvider<ObjectMapper> objectMapper) {
        MongoTemplate template = mongoTemplate.getIfAvailable();
        if (template == null) {
            log.info("recur4j no MongoTemplate available; jobs are kept in memory only");
            return JobRepository.none();
        }
        return new MongoJobRepository(template, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedulerProperties props, JobHandlerRegistry registry, JobRepository repository) {
        return new DefaultScheduler(props, registry, repository);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(Scheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    public Recur4jMongoIndexConfig recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Recur4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnBean(Recur4jMongoIndexConfig.class)
    @ConditionalOnProperty(prefix = "recur4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton recur4jIndexesInitializer(Recur4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
