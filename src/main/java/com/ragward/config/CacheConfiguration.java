package com.ragward.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.cache.CaffeineResponseCacheStore;
import com.ragward.cache.JsonFileResponseCacheStore;
import com.ragward.cache.RedisResponseCacheStore;
import com.ragward.cache.ResponseCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Response cache store selection.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final RagwardProperties properties;

    public CacheConfiguration(RagwardProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ResponseCacheStore responseCacheStore(ObjectMapper objectMapper,
                                                 ObjectProvider<RedisTemplate<String, byte[]>> redisTemplate) {
        RagwardProperties.CacheConfig cache = properties.getCache();

        ResponseCacheStore store = switch (cache.getStore()) {
            case MEMORY -> new CaffeineResponseCacheStore();
            case FILE -> new JsonFileResponseCacheStore(cache.getFilePath(), objectMapper);
            case REDIS -> new RedisResponseCacheStore(
                    redisTemplate.getObject(), objectMapper, cache.getRedisKeyPrefix());
        };

        log.info("Configured response cache store: {}", store.getName());
        return store;
    }
}
