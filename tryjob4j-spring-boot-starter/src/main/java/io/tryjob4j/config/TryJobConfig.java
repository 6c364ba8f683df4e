package io.tryjob4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.BuildsetStore;
import io.tryjob4j.TryScheduler;
import io.tryjob4j.core.JobCodec;
import io.tryjob4j.internal.InMemoryBuildsetStore;
import io.tryjob4j.internal.JobdirScheduler;
import io.tryjob4j.internal.mailbox.MailboxTransport;
import io.tryjob4j.internal.mongo.MongoBuildStatusFeed;
import io.tryjob4j.internal.mongo.MongoBuildsetStore;
import io.tryjob4j.internal.netty.UserpassScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration entrypoint for the try schedulers.
 */
@AutoConfiguration
@ConditionalOnClass({TryScheduler.class, EventLoopGroup.class})
@EnableConfigurationProperties(TryJobProperties.class)
@ConditionalOnProperty(prefix = "tryjob", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TryJobConfig {

    @Bean(destroyMethod = "shutdownGracefully")
    @ConditionalOnMissingBean
    public EventLoopGroup tryJobEventLoopGroup(TryJobProperties props) {
        return new NioEventLoopGroup(props.getEventLoopThreads(), new DefaultThreadFactory("tryjob"));
    }

    @Bean
    @ConditionalOnProperty(prefix = "tryjob.jobdir", name = "enabled", havingValue = "true")
    public JobdirScheduler jobdirScheduler(TryJobProperties props,
                                           BuildsetStore store,
                                           EventLoopGroup group,
                                           ObjectMapper objectMapper) {
        TryJobProperties.Jobdir cfg = props.getJobdir();
        if (cfg.getDirectory() == null) {
            throw new IllegalStateException("tryjob.jobdir.directory must be set when tryjob.jobdir.enabled=true");
        }
        MailboxTransport mailbox = new MailboxTransport(cfg.getDirectory(), new JobCodec(objectMapper));
        return new JobdirScheduler(cfg.getName(), cfg.getBuilders(), mailbox, cfg.getPollInterval(), store, group);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tryjob.userpass", name = "enabled", havingValue = "true")
    public UserpassScheduler userpassScheduler(TryJobProperties props,
                                               BuildsetStore store,
                                               ObjectProvider<BuildStatusFeed> feed,
                                               EventLoopGroup group,
                                               ObjectMapper objectMapper) {
        TryJobProperties.Userpass cfg = props.getUserpass();
        return new UserpassScheduler(
                cfg.getName(),
                cfg.getBuilders(),
                cfg.getBindHost(),
                cfg.getPort(),
                cfg.getUsers(),
                store,
                feed.getIfAvailable(),
                group,
                objectMapper
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public TrySchedulerLifecycle trySchedulerLifecycle(ObjectProvider<TryScheduler> schedulers) {
        return new TrySchedulerLifecycle(schedulers.orderedStream().collect(Collectors.toList()));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "tryjob", name = "store", havingValue = "mongo", matchIfMissing = true)
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(BuildsetStore.class)
        public MongoBuildsetStore mongoBuildsetStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
            return new MongoBuildsetStore(mongoTemplate, objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean(BuildStatusFeed.class)
        public MongoBuildStatusFeed mongoBuildStatusFeed(MongoBuildsetStore store,
                                                         EventLoopGroup group,
                                                         TryJobProperties props) {
            return new MongoBuildStatusFeed(store, group, props.getStatusPollInterval());
        }

        @Bean
        @ConditionalOnMissingBean
        protected BuildsetMongoIndexConfig buildsetMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new BuildsetMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "tryjob", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton buildsetIndexesInitializer(BuildsetMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tryjob", name = "store", havingValue = "memory")
    static class InMemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean({BuildsetStore.class, BuildStatusFeed.class})
        public InMemoryBuildsetStore inMemoryBuildsetStore() {
            return new InMemoryBuildsetStore();
        }
    }
}
