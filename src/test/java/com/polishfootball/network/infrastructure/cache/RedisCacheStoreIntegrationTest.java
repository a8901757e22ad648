package com.polishfootball.network.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Testcontainers(disabledWithoutDocker = true)
class RedisCacheStoreIntegrationTest {

    private static final String PREFIX = "test:cache:";

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--appendonly", "no", "--save", "");

    private LettuceConnectionFactory connectionFactory;
    private StringRedisTemplate redisTemplate;
    private RedisCacheStore cacheStore;

    @BeforeEach
    void setUp() {
        connectionFactory = new LettuceConnectionFactory(redis.getHost(), redis.getMappedPort(6379));
        connectionFactory.setDatabase(1);
        connectionFactory.afterPropertiesSet();

        redisTemplate = new StringRedisTemplate(connectionFactory);
        redisTemplate.afterPropertiesSet();

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());

        cacheStore = new RedisCacheStore(redisTemplate, objectMapper, PREFIX, Duration.ofMinutes(5));
        clearTestKeys();
    }

    @AfterEach
    void tearDown() {
        clearTestKeys();
        connectionFactory.destroy();
    }

    @Test
    void shouldRoundTripPrimitiveAndJsonValues() {
        // Given
        CacheValueType<LocalDate> dateType = CacheValueType.primitive(LocalDate.class);
        CacheValueType<Payload> jsonType = CacheValueType.json(Payload.class);
        var payload = new Payload("Wisła Kraków", List.of("ekstraklasa"));

        // When
        cacheStore.set("dashboard-stats:start-20240101", LocalDate.of(2024, 1, 1), dateType);
        cacheStore.set("graph-data:active", payload, jsonType);

        // Then
        assertThat(cacheStore.get("dashboard-stats:start-20240101", dateType)).contains(LocalDate.of(2024, 1, 1));
        assertThat(cacheStore.get("graph-data:active", jsonType)).contains(payload);
        assertThat(redisTemplate.hasKey(PREFIX + "graph-data:active")).isTrue();
    }

    @Test
    void shouldTreatKindMismatchAsMiss() {
        // Given
        cacheStore.set("clubs:count", "7", CacheValueType.primitive(String.class));

        // When & Then
        assertThat(cacheStore.get("clubs:count", CacheValueType.json(Payload.class))).isEmpty();
    }

    @Test
    void shouldExpireEntriesThroughRedisTtl() {
        // Given
        CacheValueType<String> type = CacheValueType.primitive(String.class);
        cacheStore.set("clubs:page-1:size-20", "page", type, Duration.ofSeconds(1));

        // Then
        assertThat(cacheStore.exists("clubs:page-1:size-20")).isTrue();
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> !cacheStore.exists("clubs:page-1:size-20"));
        assertThat(cacheStore.get("clubs:page-1:size-20", type)).isEmpty();
    }

    @Test
    void shouldTreatZeroTtlAsAbsent() {
        CacheValueType<String> type = CacheValueType.primitive(String.class);

        cacheStore.set("graph-data", "value", type, Duration.ZERO);

        assertThat(cacheStore.exists("graph-data")).isFalse();
        assertThat(cacheStore.stats().activeEntries()).isZero();
    }

    @Test
    void shouldRemoveByPatternAndPruneExpiredRegistryMembers() {
        // Given
        CacheValueType<String> type = CacheValueType.primitive(String.class);
        cacheStore.set("clubs:page-1:size-20", "a", type);
        cacheStore.set("clubs:page-2:size-20", "b", type);
        cacheStore.set("graph-data:active", "c", type);
        cacheStore.set("dashboard-stats", "d", type, Duration.ofSeconds(1));
        await().atMost(5, TimeUnit.SECONDS).until(() -> !cacheStore.exists("dashboard-stats"));

        // When
        int removed = cacheStore.removeByPattern("clubs:.*");

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(cacheStore.exists("graph-data:active")).isTrue();
        assertThat(redisTemplate.opsForSet().members(PREFIX + "registry")).containsExactly("graph-data:active");
        assertThat(cacheStore.stats().evictions()).isEqualTo(1);
    }

    @Test
    void shouldKeepRewrittenKeyRegisteredWhenPruningOtherNamespaces() {
        // Given
        CacheValueType<String> type = CacheValueType.primitive(String.class);
        cacheStore.set("clubs:page-1:size-20", "old", type);
        redisTemplate.delete(PREFIX + "clubs:page-1:size-20");
        cacheStore.set("clubs:page-1:size-20", "new", type);

        // When
        int prunedScan = cacheStore.removeByPattern("^graph-data(:|$)");

        // Then
        assertThat(prunedScan).isZero();
        assertThat(redisTemplate.opsForSet().isMember(PREFIX + "registry", "clubs:page-1:size-20")).isTrue();
        assertThat(cacheStore.stats().evictions()).isZero();
        assertThat(cacheStore.removeByPattern("^clubs(:|$)")).isEqualTo(1);
        assertThat(cacheStore.exists("clubs:page-1:size-20")).isFalse();
    }

    @Test
    void shouldWriteValueTtlAndRegistryMemberTogether() {
        // When
        cacheStore.set("graph-data:verified", "graph", CacheValueType.primitive(String.class), Duration.ofMinutes(2));

        // Then
        Long ttlSeconds = redisTemplate.getExpire(PREFIX + "graph-data:verified", TimeUnit.SECONDS);
        assertThat(ttlSeconds).isBetween(1L, 120L);
        assertThat(redisTemplate.opsForSet().members(PREFIX + "registry")).containsExactly("graph-data:verified");

        cacheStore.remove("graph-data:verified");
        assertThat(redisTemplate.hasKey(PREFIX + "graph-data:verified")).isFalse();
        assertThat(redisTemplate.opsForSet().size(PREFIX + "registry")).isZero();
    }

    private void clearTestKeys() {
        Set<String> keys = redisTemplate.keys(PREFIX + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    record Payload(String name, List<String> leagues) {}
}
