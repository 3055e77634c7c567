package com.ivamare.caseguard.pipeline.impl;

import com.ivamare.caseguard.exception.ActiveCaseExistsException;
import com.ivamare.caseguard.exception.BusinessRuleException;
import com.ivamare.caseguard.exception.DatabaseExceptionClassifier;
import com.ivamare.caseguard.exception.HostConfigurationException;
import com.ivamare.caseguard.model.CaseAttributes;
import com.ivamare.caseguard.model.CaseRecord;
import com.ivamare.caseguard.model.CustomerReference;
import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;
import com.ivamare.caseguard.pipeline.CreateInterceptor;
import com.ivamare.caseguard.pipeline.CreatePipeline;
import com.ivamare.caseguard.pipeline.InterceptorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.function.Function;

/**
 * Default implementation of CreatePipeline.
 *
 * <p>Validates the host context, then runs interceptors and the commit step
 * in a single transaction. A unique-key violation of the active-case
 * constraint raised by the commit is reported as
 * {@link ActiveCaseExistsException}, the same error the uniqueness guard
 * raises when it sees the conflict first.
 */
public class DefaultCreatePipeline implements CreatePipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultCreatePipeline.class);

    private final InterceptorRegistry interceptorRegistry;
    private final TransactionTemplate transactionTemplate;
    private final String activeCaseConstraint;

    /**
     * Creates a new DefaultCreatePipeline.
     *
     * @param interceptorRegistry Source of interceptors per entity
     * @param transactionTemplate Transaction boundary for interceptors and commit
     * @param activeCaseConstraint Name of the store's active-case unique index
     */
    public DefaultCreatePipeline(
            InterceptorRegistry interceptorRegistry,
            TransactionTemplate transactionTemplate,
            String activeCaseConstraint) {
        this.interceptorRegistry = Objects.requireNonNull(interceptorRegistry, "interceptorRegistry must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.activeCaseConstraint = activeCaseConstraint;
    }

    @Override
    public <T> T execute(ExecutionContext context, Function<PendingRecord, T> commit) {
        PendingRecord target = validateContext(context);

        log.debug("{} pipeline started for {} {} (correlationId={}, userId={})",
            context.operation(), target.entityName(), target.id(), context.correlationId(), context.userId());

        try {
            T result = transactionTemplate.execute(status -> {
                for (CreateInterceptor interceptor : interceptorRegistry.interceptorsFor(target.entityName())) {
                    interceptor.beforeCreate(target, context);
                }
                return commitOrTranslate(target, commit);
            });

            log.info("Created {} {} (correlationId={})",
                target.entityName(), target.id(), context.correlationId());
            return result;

        } catch (BusinessRuleException e) {
            log.info("Create of {} {} rejected: {} (correlationId={})",
                target.entityName(), target.id(), e.getMessage(), context.correlationId());
            throw e;
        } catch (DataAccessException e) {
            log.warn("Create of {} {} failed on record store ({}): {} (correlationId={})",
                target.entityName(), target.id(),
                DatabaseExceptionClassifier.isTransient(e) ? "transient" : "non-transient",
                e.getMessage(), context.correlationId());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Create of {} {} failed: {} (correlationId={})",
                target.entityName(), target.id(), e.getMessage(), context.correlationId());
            throw e;
        }
    }

    private <T> T commitOrTranslate(PendingRecord target, Function<PendingRecord, T> commit) {
        try {
            return commit.apply(target);
        } catch (DataAccessException e) {
            if (CaseRecord.ENTITY_NAME.equals(target.entityName())
                    && DatabaseExceptionClassifier.isUniqueViolation(e, activeCaseConstraint)) {
                CustomerReference customer = target.attribute(CaseAttributes.CUSTOMER, CustomerReference.class)
                    .orElse(null);
                log.info("Active-case constraint {} rejected commit of case {}", activeCaseConstraint, target.id());
                ActiveCaseExistsException rejection =
                    new ActiveCaseExistsException(customer != null ? customer.id() : null);
                rejection.initCause(e);
                throw rejection;
            }
            throw e;
        }
    }

    private PendingRecord validateContext(ExecutionContext context) {
        if (context == null) {
            throw new HostConfigurationException("Execution context unavailable");
        }
        if (!ExecutionContext.CREATE.equals(context.operation())) {
            throw new HostConfigurationException("Unsupported operation " + context.operation());
        }
        if (context.userId() == null) {
            throw new HostConfigurationException("Caller identity unavailable");
        }
        if (!(context.target() instanceof PendingRecord target)) {
            throw new HostConfigurationException("Target record is missing or invalid");
        }
        if (!target.entityName().equals(context.primaryEntityName())) {
            throw new HostConfigurationException(
                "Target entity " + target.entityName() + " does not match primary entity "
                    + context.primaryEntityName());
        }
        if (!target.id().equals(context.primaryEntityId())) {
            throw new HostConfigurationException(
                "Target id " + target.id() + " does not match primary entity id " + context.primaryEntityId());
        }
        return target;
    }
}
