package com.ivamare.caseguard.pipeline;

import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;

/**
 * Functional interface for pre-create interceptors.
 *
 * <p>Interceptors run inside the create transaction, after the host context
 * has been validated and before the record is committed. An interceptor
 * allows the create by returning normally and rejects it by throwing:
 * <ul>
 *   <li>{@link com.ivamare.caseguard.exception.BusinessRuleException} - business rule violated</li>
 *   <li>{@link com.ivamare.caseguard.exception.InvalidCustomerReferenceException} - record data is invalid</li>
 *   <li>Any other exception - propagated to the caller unchanged</li>
 * </ul>
 */
@FunctionalInterface
public interface CreateInterceptor {

    /**
     * Inspect a pending record.
     *
     * @param target The record about to be created (read-only)
     * @param context Execution context of the create
     */
    void beforeCreate(PendingRecord target, ExecutionContext context);
}
