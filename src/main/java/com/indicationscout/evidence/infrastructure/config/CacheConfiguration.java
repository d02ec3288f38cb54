package com.indicationscout.evidence.infrastructure.config;

import com.indicationscout.evidence.infrastructure.cache.DurableCacheStore;
import com.indicationscout.evidence.infrastructure.cache.RedisDurableCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DurableCacheStore durableCacheStore(CacheConfig config, ObjectProvider<StringRedisTemplate> redisTemplate) {
        if (!config.isPersistenceEnabled()) {
            logger.warn("Durable cache tier disabled by configuration; responses are cached in memory only");
            return DurableCacheStore.disabled();
        }
        return new RedisDurableCacheStore(redisTemplate.getObject(), config.getKeyPrefix());
    }
}
