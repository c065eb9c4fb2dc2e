package com.taskmesh.test.integration;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * PostgreSQL 容器基类：表结构由应用自身的 sql/schema.sql 初始化，每个用例前清空计划与会话上下文。
 */
@Testcontainers
public abstract class PostgresIntegrationTestSupport {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("taskmesh_it")
            .withUsername("taskmesh")
            .withPassword("taskmesh");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void registerDataSource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
        registry.add("spring.ai.openai.api-key", () -> "test-key");
        registry.add("plan-store.type", () -> "jdbc");
    }

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.execute("TRUNCATE TABLE task_plan, session_context");
    }

    protected long storedVersion(String sessionId) {
        Long version = jdbcTemplate.queryForObject(
                "SELECT version FROM task_plan WHERE session_id = ?", Long.class, sessionId);
        return version == null ? -1L : version;
    }
}
