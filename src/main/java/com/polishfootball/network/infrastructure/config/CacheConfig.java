package com.polishfootball.network.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polishfootball.network.infrastructure.cache.CacheProperties;
import com.polishfootball.network.infrastructure.cache.CacheStore;
import com.polishfootball.network.infrastructure.cache.LocalCacheStore;
import com.polishfootball.network.infrastructure.cache.RedisCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the cache store implementation; exactly one {@link CacheStore} exists per process.
 */
@Configuration
public class CacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "football.cache", name = "provider", havingValue = "memory", matchIfMissing = true)
    public CacheStore localCacheStore(ObjectMapper objectMapper, CacheProperties properties) {
        logger.info("Using in-memory cache store (max {} entries, default ttl {})",
                properties.getMaximumSize(), properties.getDefaultTtl());
        return new LocalCacheStore(objectMapper, properties.getDefaultTtl(), properties.getMaximumSize());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "football.cache", name = "provider", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                      CacheProperties properties) {
        logger.info("Using Redis cache store with key prefix {}", properties.getKeyPrefix());
        return new RedisCacheStore(redisTemplate, objectMapper, properties.getKeyPrefix(), properties.getDefaultTtl());
    }
}
