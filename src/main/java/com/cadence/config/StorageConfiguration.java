package com.cadence.config;

import com.cadence.storage.InMemoryProfileStore;
import com.cadence.storage.ProfileStore;
import com.cadence.storage.RedisProfileStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the profile store with {@code cadence.storage.type} ({@code memory} or {@code redis})
 */
@Configuration
public class StorageConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "cadence.storage.type", havingValue = "redis")
    public ProfileStore redisProfileStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        logger.info("Profiles are stored in Redis");
        return new RedisProfileStore(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "cadence.storage.type", havingValue = "memory", matchIfMissing = true)
    public ProfileStore inMemoryProfileStore() {
        logger.info("Profiles are kept in memory only");
        return new InMemoryProfileStore();
    }
}
