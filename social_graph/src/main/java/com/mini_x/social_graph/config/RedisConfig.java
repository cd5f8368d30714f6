package com.mini_x.social_graph.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.mini_x.social_graph.repo.RedisSetStore;
import com.mini_x.social_graph.repo.SetStore;

/**
 * Redis connection for the graph. The host application's context owns the
 * connection lifecycle. Active unless {@code social-graph.store=memory}.
 */
@Configuration
@ConditionalOnProperty(name = "social-graph.store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String standaloneHost;

    @Value("${spring.data.redis.port:6379}")
    private int standalonePort;

    @Value("${spring.data.redis.database:0}")
    private int database;

    @Bean(name = "socialGraphRedisConnectionFactory")
    public LettuceConnectionFactory socialGraphRedisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(standaloneHost, standalonePort);
        config.setDatabase(database);
        return new LettuceConnectionFactory(config);
    }

    // ids are plain strings, so keys and members both go through StringRedisSerializer
    @Bean(name = "socialGraphRedisTemplate")
    public StringRedisTemplate socialGraphRedisTemplate(
            @Qualifier("socialGraphRedisConnectionFactory") LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new StringRedisSerializer());
        return template;
    }

    @Bean
    public SetStore setStore(@Qualifier("socialGraphRedisTemplate") StringRedisTemplate redisTemplate) {
        return new RedisSetStore(redisTemplate);
    }
}
