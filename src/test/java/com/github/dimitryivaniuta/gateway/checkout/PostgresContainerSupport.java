package com.github.dimitryivaniuta.gateway.checkout;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared Postgres container for tests that need real row locks and advisory locks.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresContainerSupport {

    @Container
    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("checkout")
            .withUsername("checkout")
            .withPassword("checkout");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);

        // no broker in tests
        r.add("spring.kafka.bootstrap-servers", () -> "localhost:0");
        r.add("spring.kafka.admin.auto-create", () -> "false");
        r.add("app.outbox.publish-interval-ms", () -> "9999999");
    }
}
