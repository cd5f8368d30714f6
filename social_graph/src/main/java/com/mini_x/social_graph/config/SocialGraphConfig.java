package com.mini_x.social_graph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.mini_x.social_graph.repo.InMemorySetStore;
import com.mini_x.social_graph.repo.SetStore;
import com.mini_x.social_graph.service.BoundedRandomSampler;
import com.mini_x.social_graph.service.SocialGraphFactory;

/**
 * Graph beans. Expects a {@link SetStore} bean, normally the one from
 * {@link RedisConfig}. With {@code social-graph.store=memory} a process-local
 * store is used instead, for hosts running without Redis.
 */
@Configuration
public class SocialGraphConfig {

    private static final Logger logger = LoggerFactory.getLogger(SocialGraphConfig.class);

    @Bean
    @ConditionalOnProperty(name = "social-graph.store", havingValue = "memory")
    public SetStore inMemorySetStore() {
        logger.info("Social graph kept in process memory, nothing is persisted");
        return new InMemorySetStore();
    }

    @Bean
    public BoundedRandomSampler boundedRandomSampler(
            SetStore setStore,
            @Value("${social-graph.sampling.oversampling-factor:2}") int oversamplingFactor,
            @Value("${social-graph.sampling.min-rounds:8}") int minRounds) {
        logger.info("Random sampling: oversampling factor {}, at least {} rounds", oversamplingFactor, minRounds);
        return new BoundedRandomSampler(setStore, oversamplingFactor, minRounds);
    }

    @Bean(name = "socialGraphExecutor")
    public ThreadPoolTaskExecutor socialGraphExecutor(@Value("${social-graph.async.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("social-graph-");
        return executor;
    }

    @Bean
    public SocialGraphFactory socialGraphFactory(
            SetStore setStore,
            BoundedRandomSampler sampler,
            @Qualifier("socialGraphExecutor") ThreadPoolTaskExecutor executor,
            @Value("${social-graph.namespace:}") String namespace) {
        logger.info("Social graph keys under namespace '{}'", namespace);
        return new SocialGraphFactory(setStore, sampler, executor, namespace);
    }
}
