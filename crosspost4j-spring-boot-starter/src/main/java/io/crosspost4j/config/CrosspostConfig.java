package io.crosspost4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crosspost4j.ContentScheduler;
import io.crosspost4j.ContentStore;
import io.crosspost4j.MetricsCollector;
import io.crosspost4j.PlatformPublisher;
import io.crosspost4j.Publisher;
import io.crosspost4j.internal.DefaultContentScheduler;
import io.crosspost4j.internal.MultiPlatformPublisher;
import io.crosspost4j.internal.mongo.MongoContentStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the content scheduler.
 *
 * <p>The application provides a {@link MetricsCollector} and one {@link PlatformPublisher} per
 * platform (or a complete {@link Publisher}); everything else has a default.
 */
@AutoConfiguration
@ConditionalOnClass({ContentScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "crosspost", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CrosspostConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "crosspost")
    public EngineProperties crosspostEngineProperties() {
        return new EngineProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock crosspostClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ContentStore.class)
    public MongoContentStore mongoContentStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoContentStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected ContentMongoIndexConfig contentMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new ContentMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(Publisher.class)
    public Publisher multiPlatformPublisher(ObjectProvider<List<PlatformPublisher>> publishersProvider) {
        List<PlatformPublisher> publishers = publishersProvider.getIfAvailable(List::of);
        return new MultiPlatformPublisher(publishers);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentScheduler contentScheduler(EngineProperties props,
                                             ContentStore store,
                                             Publisher publisher,
                                             MetricsCollector collector,
                                             Clock clock) {
        return new DefaultContentScheduler(props, store, publisher, collector, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentSchedulerLifecycle contentSchedulerLifecycle(ContentScheduler scheduler) {
        return new ContentSchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "crosspost", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton crosspostIndexesInitializer(ContentMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
