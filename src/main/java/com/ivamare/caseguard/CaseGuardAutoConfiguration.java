package com.ivamare.caseguard;

import com.ivamare.caseguard.api.CaseService;
import com.ivamare.caseguard.api.impl.DefaultCaseService;
import com.ivamare.caseguard.guard.CaseUniquenessGuard;
import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.pipeline.CreatePipeline;
import com.ivamare.caseguard.pipeline.InterceptorRegistry;
import com.ivamare.caseguard.pipeline.impl.DefaultCreatePipeline;
import com.ivamare.caseguard.pipeline.impl.DefaultInterceptorRegistry;
import com.ivamare.caseguard.repository.CaseRepositoryFactory;
import com.ivamare.caseguard.repository.impl.JdbcCaseRepositoryFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Auto-configuration for Case Guard.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Caller-scoped case repository factory</li>
 *   <li>Interceptor registry (discovers @PreCreate methods)</li>
 *   <li>Case uniqueness guard, registered for the case entity</li>
 *   <li>Create pipeline</li>
 *   <li>Case service</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * caseguard.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, TransactionAutoConfiguration.class})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "caseguard", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CaseGuardProperties.class)
public class CaseGuardAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper caseGuardObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Record Store ---

    @Bean
    @ConditionalOnMissingBean
    public CaseRepositoryFactory caseRepositoryFactory(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcCaseRepositoryFactory(jdbcTemplate, objectMapper);
    }

    // --- Interceptors ---

    // static with a concrete return type so the registry is detected as a BeanPostProcessor
    @Bean
    @ConditionalOnMissingBean(InterceptorRegistry.class)
    public static DefaultInterceptorRegistry interceptorRegistry() {
        return new DefaultInterceptorRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "caseguard.uniqueness", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CaseUniquenessGuard caseUniquenessGuard(
            CaseRepositoryFactory caseRepositoryFactory,
            InterceptorRegistry interceptorRegistry) {
        CaseUniquenessGuard guard = new CaseUniquenessGuard(caseRepositoryFactory);
        // Registered directly: a user-supplied registry need not be a BeanPostProcessor
        interceptorRegistry.register(CaseRecord.ENTITY_NAME, guard);
        return guard;
    }

    // --- Pipeline ---

    @Bean
    @ConditionalOnMissingBean
    public CreatePipeline createPipeline(
            InterceptorRegistry interceptorRegistry,
            PlatformTransactionManager transactionManager,
            CaseGuardProperties properties) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        int timeout = properties.getPipeline().getTransactionTimeoutSeconds();
        if (timeout > 0) {
            transactionTemplate.setTimeout(timeout);
        }
        return new DefaultCreatePipeline(
            interceptorRegistry,
            transactionTemplate,
            properties.getUniqueness().getActiveCaseConstraint()
        );
    }

    // --- Case Service ---

    @Bean
    @ConditionalOnMissingBean
    public CaseService caseService(CreatePipeline createPipeline, CaseRepositoryFactory caseRepositoryFactory) {
        return new DefaultCaseService(createPipeline, caseRepositoryFactory);
    }
}
