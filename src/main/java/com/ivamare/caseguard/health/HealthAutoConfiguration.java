package com.ivamare.caseguard.health;

import com.ivamare.caseguard.CaseGuardProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for Case Guard health indicators.
 */
@AutoConfiguration
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnProperty(prefix = "caseguard", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CaseGuardProperties.class)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(CaseGuardHealthIndicator.class)
    public CaseGuardHealthIndicator caseGuardHealthIndicator(
            JdbcTemplate jdbcTemplate,
            ObjectProvider<DataSource> dataSource,
            CaseGuardProperties properties) {
        return new CaseGuardHealthIndicator(
            jdbcTemplate,
            dataSource.getIfAvailable(),
            properties.getUniqueness().getActiveCaseConstraint()
        );
    }
}
