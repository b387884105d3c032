package com.benchwise.test.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for integration tests, initialised with the application schema.
 */
@Testcontainers
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class PostgresIntegrationTestSupport {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("benchwise_it")
            .withUsername("postgres")
            .withPassword("postgres")
            .withInitScript("db/schema.sql");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void registerDataSource(DynamicPropertyRegistry registry) {
        ensurePostgresStarted();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", POSTGRES::getDriverClassName);
        registry.add("spring.ai.openai.api-key", () -> "test-key");
        registry.add("model-gateway.enabled", () -> "false");
        registry.add("task-watchdog.enabled", () -> "false");
        registry.add("executor.dispatch.enabled", () -> "false");
    }

    private static synchronized void ensurePostgresStarted() {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
    }

    @BeforeEach
    void truncateTables() {
        jdbcTemplate.execute("TRUNCATE TABLE agent_executions, agent_tasks, documents, matters RESTART IDENTITY CASCADE");
    }

    protected Long insertMatter(String name, String clientName) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO matters (name, client_name, matter_number, practice_area) VALUES (?, ?, ?, ?) RETURNING id",
                Long.class, name, clientName, "M-2026-001", "Litigation");
    }

    protected Long insertDocument(Long matterId, String filename, String text) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO documents (matter_id, filename, extracted_text, file_type) VALUES (?, ?, ?, ?) RETURNING id",
                Long.class, matterId, filename, text, filename.substring(filename.lastIndexOf('.') + 1));
    }
}
