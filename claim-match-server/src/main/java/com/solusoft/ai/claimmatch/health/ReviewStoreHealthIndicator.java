package com.solusoft.ai.claimmatch.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class ReviewStoreHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;

    public ReviewStoreHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            Long candidates = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM assignments WHERE status = 'candidate'", Long.class);
            Long pendingDrafts = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM draft_claims WHERE status = 'pending'", Long.class);

            return Health.up()
                .withDetail("system", "SQLite review store")
                .withDetail("candidateAssignments", candidates)
                .withDetail("pendingDraftClaims", pendingDrafts)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("system", "SQLite review store")
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
