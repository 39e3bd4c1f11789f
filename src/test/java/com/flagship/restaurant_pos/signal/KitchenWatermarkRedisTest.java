package com.flagship.restaurant_pos.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.restaurant_pos.observability.PosMetrics;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.util.ReflectionTestUtils;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Kitchen watermark against a real Redis, where the compare-and-set script
 * actually runs.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Kitchen watermark in Redis")
class KitchenWatermarkRedisTest {

    static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate template;

    private TerminalSignalService service;

    @BeforeAll
    static void startRedis() {
        redis.start();
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        template = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void stopRedis() {
        connectionFactory.destroy();
        redis.stop();
    }

    @BeforeEach
    void setUp() {
        template.delete(TerminalSignalService.KITCHEN_WATERMARK_KEY);
        service = new TerminalSignalService(Optional.of(template), new ObjectMapper(), mock(PosMetrics.class));
        ReflectionTestUtils.setField(service, "kitchenTtl", Duration.ofHours(24));
    }

    @Test
    @DisplayName("A commit finishing late with an older stamp does not move the watermark back")
    void testOlderStampIgnored() {
        // Given
        Instant later = Instant.parse("2024-06-01T12:00:05Z");
        Instant earlier = Instant.parse("2024-06-01T12:00:01Z");
        service.advanceKitchenWatermark(template, later);

        // When
        service.advanceKitchenWatermark(template, earlier);

        // Then
        assertEquals(Optional.of(later), service.kitchenWatermark());
        Long ttl = template.getExpire(TerminalSignalService.KITCHEN_WATERMARK_KEY);
        assertNotNull(ttl);
        assertTrue(ttl > 0, "TTL refreshed even when the value is kept");
    }

    @Test
    @DisplayName("A newer stamp advances the watermark")
    void testNewerStampAdvances() {
        Instant first = Instant.parse("2024-06-01T12:00:01Z");
        Instant second = Instant.parse("2024-06-01T12:00:02Z");

        service.advanceKitchenWatermark(template, first);
        service.advanceKitchenWatermark(template, second);

        assertEquals(Optional.of(second), service.kitchenWatermark());
    }

    @Test
    @DisplayName("Touching outside a transaction stamps the current time")
    void testTouchStampsNow() {
        Instant before = Instant.now().minusMillis(1);

        service.touchKitchenWatermark();

        Instant stored = service.kitchenWatermark().orElseThrow();
        assertTrue(stored.isAfter(before));
    }
}
