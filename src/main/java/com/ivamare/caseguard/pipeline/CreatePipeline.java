package com.ivamare.caseguard.pipeline;

import com.ivamare.caseguard.model.ExecutionContext;
import com.ivamare.caseguard.model.PendingRecord;

import java.util.function.Function;

/**
 * Runs a create operation through its pre-create interceptors and commits it.
 */
public interface CreatePipeline {

    /**
     * Execute a create.
     *
     * <p>The host context is validated first; then, in one transaction, the
     * interceptors registered for the target entity run in order and
     * {@code commit} is applied. Any exception aborts the create and rolls
     * the transaction back.
     *
     * @param context Execution context carrying the pending record as its target
     * @param commit Persists the pending record once every interceptor allowed it
     * @return the result of {@code commit}
     * @throws com.ivamare.caseguard.exception.HostConfigurationException if the context is incomplete
     */
    <T> T execute(ExecutionContext context, Function<PendingRecord, T> commit);
}
