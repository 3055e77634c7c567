package com.ivamare.caseguard.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the case record store.
 *
 * <p>Checks:
 * <ul>
 *   <li>caseguard schema exists</li>
 *   <li>Active-case unique index is installed (reported, does not fail health)</li>
 *   <li>Reports the number of active cases</li>
 * </ul>
 */
public class CaseGuardHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(CaseGuardHealthIndicator.class);
    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;
    private final String activeCaseConstraint;

    public CaseGuardHealthIndicator(JdbcTemplate jdbcTemplate, String activeCaseConstraint) {
        this(jdbcTemplate, null, activeCaseConstraint);
    }

    public CaseGuardHealthIndicator(JdbcTemplate jdbcTemplate, DataSource dataSource, String activeCaseConstraint) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = dataSource;
        this.activeCaseConstraint = activeCaseConstraint;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Boolean schemaExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = 'caseguard')",
                Boolean.class
            );

            if (!Boolean.TRUE.equals(schemaExists)) {
                return Health.down()
                    .withDetail("error", "caseguard schema not found")
                    .build();
            }

            Boolean constraintExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM pg_indexes WHERE schemaname = 'caseguard' AND indexname = ?)",
                Boolean.class,
                activeCaseConstraint
            );

            boolean backstop = Boolean.TRUE.equals(constraintExists);
            if (!backstop) {
                log.warn("Active-case index {} not found; concurrent creates may open two active cases",
                    activeCaseConstraint);
            }

            Integer activeCount = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM caseguard.case_record WHERE status = 'ACTIVE'",
                Integer.class
            );

            Health.Builder builder = Health.up()
                .withDetail("schema", "caseguard")
                .withDetail("activeCaseConstraint", backstop ? activeCaseConstraint : "missing")
                .withDetail("activeCases", activeCount != null ? activeCount : 0);

            addPoolStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.debug("Connection validity check failed: {}", e.getMessage());
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
            }
        }
    }
}
