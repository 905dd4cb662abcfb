package com.github.dimitryivaniuta.content.publishing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.content.publishing.service.dto.PostView;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis holds read snapshots of posts only; Postgres is the source of truth and every lifecycle
 * write evicts the snapshot. The manager is transaction-aware so evictions happen after commit.</p>
 */
@Configuration
@ConditionalOnProperty(name = "app.cache.enabled", havingValue = "true", matchIfMissing = true)
public class CacheConfig {

    /**
     * Cache name for post snapshots.
     */
    public static final String POST_CACHE = "postView";

    /**
     * Redis cache manager with JSON values.
     *
     * @param factory redis connection factory
     * @param objectMapper application object mapper (JavaTimeModule registered)
     * @param properties app properties
     * @return cache manager
     */
    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory factory, ObjectMapper objectMapper, AppProperties properties) {
        var postSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, PostView.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .disableCachingNullValues()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var postCfg = defaultCfg
                .entryTtl(properties.getCache().getPostTtl())
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(postSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(POST_CACHE, postCfg)
                .transactionAware()
                .build();
    }
}
