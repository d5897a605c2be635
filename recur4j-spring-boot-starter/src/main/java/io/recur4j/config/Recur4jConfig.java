package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.ClientDirectory;
import io.recur4j.CrewDirectory;
import io.recur4j.JobCreator;
import io.recur4j.RecurringJobs;
import io.recur4j.internal.DefaultRecurringJobs;
import io.recur4j.internal.mongo.MongoInstanceStore;
import io.recur4j.internal.mongo.MongoSeriesStore;
import io.recur4j.store.InstanceStore;
import io.recur4j.store.SeriesStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for recurring series.
 *
 * <p>{@link RecurringJobs} is only created when the application provides a {@link JobCreator};
 * {@link ClientDirectory} and {@link CrewDirectory} beans are optional.
 */
@AutoConfiguration
@ConditionalOnClass({RecurringJobs.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "recur4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Recur4jConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "recur4j")
    public Recur4jProperties recur4jProperties() {
        return new Recur4jProperties();
    }

    @Bean
    @ConditionalOnMissingBean(SeriesStore.class)
    protected MongoSeriesStore mongoSeriesStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
        return new MongoSeriesStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean(InstanceStore.class)
    protected MongoInstanceStore mongoInstanceStore(MongoTemplate mongoTemplate) {
        return new MongoInstanceStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected Recur4jMongoIndexConfig recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Recur4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobCreator.class)
    public RecurringJobs recurringJobs(Recur4jProperties props,
                                       SeriesStore seriesStore,
                                       InstanceStore instanceStore,
                                       JobCreator jobCreator,
                                       ObjectProvider<ClientDirectory> clientDirectory,
                                       ObjectProvider<CrewDirectory> crewDirectory) {
        return new DefaultRecurringJobs(
                props,
                seriesStore,
                instanceStore,
                jobCreator,
                clientDirectory.getIfAvailable(ClientDirectory::none),
                crewDirectory.getIfAvailable(CrewDirectory::none)
        );
    }

    /**
     * The unique (seriesId, scheduledDate) index is always ensured; generation is only
     * duplicate-free with it in place.
     */
    @Bean
    public SmartInitializingSingleton recur4jRequiredIndexesInitializer(Recur4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureRequiredIndexes;
    }

    @Bean
    @ConditionalOnProperty(prefix = "recur4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton recur4jIndexesInitializer(Recur4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
