package com.flagship.restaurant_pos;

import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.access.User;
import com.flagship.restaurant_pos.access.UserRepository;
import com.flagship.restaurant_pos.catalog.CatalogService;
import com.flagship.restaurant_pos.catalog.dto.CreateProductRequest;
import com.flagship.restaurant_pos.catalog.dto.ProductResponse;
import com.flagship.restaurant_pos.catalog.dto.TableResponse;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.Mockito.when;

/**
 * Shared setup for tests against a real PostgreSQL.
 *
 * One container serves every test class so the Spring context is cached
 * across them. Redis is replaced by a Mockito mock that stores nothing; the
 * Kafka publisher is switched off.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class PosIntegrationTestSupport {

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("restaurant_pos_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("pos.tax-rate", () -> "0");
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @MockBean
    protected ValueOperations<String, String> valueOperations;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected CatalogService catalogService;

    protected ActorContext admin;

    @BeforeEach
    void setUpSupport() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        admin = actor(createUser(Role.ADMIN), null);
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    // Fixtures, unique per call so tests never collide on shared data

    protected User createUser(Role role) {
        String username = role.name().toLowerCase() + "-" + UUID.randomUUID().toString().substring(0, 8);
        return userRepository.save(User.create(username, "Test " + role.name().toLowerCase(), role));
    }

    protected ActorContext actor(User user, String deviceId) {
        return ActorContext.of(user.getId(), deviceId, "127.0.0.1");
    }

    protected ProductResponse createProduct(String name, String price, String initialStock, String minStockLevel,
                                            boolean requiresKitchen) {
        return catalogService.createProduct(CreateProductRequest.builder()
                .name(name)
                .sku("SKU-" + UUID.randomUUID().toString().substring(0, 8))
                .price(new BigDecimal(price))
                .initialStock(new BigDecimal(initialStock))
                .minStockLevel(new BigDecimal(minStockLevel))
                .requiresKitchen(requiresKitchen)
                .build(), admin);
    }

    protected TableResponse createTable() {
        return catalogService.createTable("T" + UUID.randomUUID().toString().substring(0, 6), 4, admin);
    }
}
