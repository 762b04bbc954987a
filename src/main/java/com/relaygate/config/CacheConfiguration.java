package com.relaygate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.service.cache.InMemoryResponseCacheStore;
import com.relaygate.service.cache.RedisResponseCacheStore;
import com.relaygate.service.cache.ResponseCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Selects the response cache store: Caffeine in-process (default) or Redis.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final RelaygateProperties properties;

    public CacheConfiguration(RelaygateProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "relaygate.cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public ResponseCacheStore inMemoryResponseCacheStore() {
        RelaygateProperties.CacheConfig cache = properties.getCache();
        return new InMemoryResponseCacheStore(cache.getMaxSize(), cache.getTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "relaygate.cache", name = "store", havingValue = "redis")
    public ResponseCacheStore redisResponseCacheStore(
            @Qualifier("cacheRedisTemplate") RedisTemplate<String, byte[]> cacheRedisTemplate,
            ObjectMapper objectMapper) {
        log.info("Using Redis response cache store, ttl={}", properties.getCache().getTtl());
        return new RedisResponseCacheStore(cacheRedisTemplate, objectMapper, properties.getCache().getTtl());
    }
}
