package com.contentflow.test.integration;

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
 * 审批集成测试基类：共享一个 PostgreSQL 容器，按审批表结构建库，每个用例前清空审批相关表。
 */
@Testcontainers
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class PostgresIntegrationTestSupport {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("approval_it")
            .withUsername("postgres")
            .withPassword("postgres")
            .withInitScript("sql/integration-schema.sql");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void registerDataSource(DynamicPropertyRegistry registry) {
        ensurePostgresStarted();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", POSTGRES::getDriverClassName);
        registry.add("spring.sql.init.mode", () -> "never");
    }

    private static synchronized void ensurePostgresStarted() {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
    }

    @BeforeEach
    void truncateTables() {
        jdbcTemplate.execute("TRUNCATE TABLE team_activity, content_submissions, approval_workflows, team_members, users RESTART IDENTITY CASCADE");
    }

    protected void seedMember(String organizationId, String userId, String name, boolean canApproveContent) {
        jdbcTemplate.update("INSERT INTO users (id, name, email) VALUES (?, ?, ?) ON CONFLICT (id) DO NOTHING",
                userId, name, userId + "@contentflow.io");
        jdbcTemplate.update("INSERT INTO team_members (organization_id, user_id, role, status, can_approve_content) "
                        + "VALUES (?, ?, ?, 'active', ?)",
                organizationId, userId, canApproveContent ? "editor" : "member", canApproveContent);
    }
}
