package com.github.dimitryivaniuta.quota.infra;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:16-alpine")
                    .withDatabaseName("quota")
                    .withUsername("quota")
                    .withPassword("quota");

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    protected JdbcTemplate jdbc;

    @BeforeEach
    void cleanDatabase() {
        jdbc.execute("""
            DO $$
            BEGIN
              IF to_regclass('public.rate_limit_counters') IS NOT NULL THEN
                EXECUTE 'TRUNCATE TABLE rate_limit_counters';
              END IF;
            END$$;
            """);
    }

    protected Integer storedCount(String userId, String periodType) {
        return jdbc.queryForObject(
                "select coalesce(sum(request_count), 0) from rate_limit_counters where user_id = ? and period_type = ?",
                Integer.class, userId, periodType);
    }

    protected Integer rowCount(String userId) {
        return jdbc.queryForObject(
                "select count(*) from rate_limit_counters where user_id = ?", Integer.class, userId);
    }
}
