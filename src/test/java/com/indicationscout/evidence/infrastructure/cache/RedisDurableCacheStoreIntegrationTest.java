package com.indicationscout.evidence.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.indicationscout.evidence.domain.model.target.Pathway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class RedisDurableCacheStoreIntegrationTest {

    private static final String PREFIX = "test:scout:cache:";

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--appendonly", "no", "--save", "");

    private LettuceConnectionFactory connectionFactory;
    private StringRedisTemplate redisTemplate;
    private RedisDurableCacheStore store;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        connectionFactory = new LettuceConnectionFactory(redis.getHost(), redis.getMappedPort(6379));
        connectionFactory.setDatabase(1);
        connectionFactory.afterPropertiesSet();

        redisTemplate = new StringRedisTemplate(connectionFactory);
        redisTemplate.afterPropertiesSet();

        store = new RedisDurableCacheStore(redisTemplate, PREFIX);
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        clearTestKeys();
    }

    @AfterEach
    void tearDown() {
        clearTestKeys();
        connectionFactory.destroy();
    }

    @Test
    void shouldStoreEnvelopeWithExpiry() {
        // When
        store.write("abc", "{\"payload\": 1}", Duration.ofMinutes(10));

        // Then
        assertThat(store.read("abc")).contains("{\"payload\": 1}");
        Long ttl = redisTemplate.getExpire(PREFIX + "abc");
        assertThat(ttl).isNotNull().isPositive().isLessThanOrEqualTo(600L);
    }

    @Test
    void shouldDeleteEntry() {
        // Given
        store.write("abc", "{}", Duration.ofMinutes(10));

        // When
        store.delete("abc");

        // Then
        assertThat(store.read("abc")).isEmpty();
    }

    @Test
    void shouldShareEntriesBetweenCacheInstances() {
        // Given
        Map<String, String> params = Map.of("target_id", "ENSG00000146648");
        Pathway pathway = new Pathway("R-HSA-177929", "Signaling by EGFR", "Signal Transduction");
        TwoTierCache writer = new TwoTierCache("writer", store, objectMapper, Clock.systemUTC(), Duration.ofDays(5));
        TwoTierCache reader = new TwoTierCache("reader", store, objectMapper, Clock.systemUTC(), Duration.ofDays(5));

        // When
        writer.set("pathway", params, pathway);

        // Then
        assertThat(reader.get("pathway", params, Pathway.class)).contains(pathway);
        assertThat(redisTemplate.hasKey(PREFIX + CacheKeys.keyFor("pathway", params))).isTrue();
        writer.close();
        reader.close();
    }

    private void clearTestKeys() {
        Set<String> keys = redisTemplate.keys(PREFIX + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }
}
