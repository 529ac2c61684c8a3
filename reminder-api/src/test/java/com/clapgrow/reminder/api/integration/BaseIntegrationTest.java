package com.clapgrow.reminder.api.integration;

import com.clapgrow.reminder.api.ReminderApiApplication;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Base class for integration tests using Testcontainers.
 * The schema comes from the Flyway migrations, exactly as in production.
 */
@SpringBootTest(
    classes = ReminderApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@Testcontainers
public abstract class BaseIntegrationTest {

    protected static final String CRON_SECRET = "integration_secret";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
        DockerImageName.parse("postgres:15-alpine")
    )
        .withDatabaseName("reminder_db")
        .withUsername("reminder_user")
        .withPassword("reminder_pass");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "8");

        registry.add("cron.secret", () -> CRON_SECRET);
        registry.add("cron.worker-id", () -> "it-worker");
        registry.add("telegram.bot-token", () -> "");
    }
}
