package com.ivamare.caseguard.model;

import java.util.Map;
import java.util.UUID;

/**
 * Context the create pipeline hands to every interceptor.
 *
 * <p>The record being created travels as the {@value #TARGET} input
 * parameter. Its presence and type are checked by the pipeline before
 * any interceptor runs.
 *
 * @param operation Operation name (e.g., "Create")
 * @param primaryEntityName Entity the operation applies to
 * @param primaryEntityId Identifier of the record being created
 * @param userId Caller on whose behalf the operation runs
 * @param correlationId Correlation ID for log tracing
 * @param inputParameters Operation inputs keyed by name
 */
public record ExecutionContext(
    String operation,
    String primaryEntityName,
    UUID primaryEntityId,
    UUID userId,
    UUID correlationId,
    Map<String, Object> inputParameters
) {
    public static final String CREATE = "Create";
    public static final String TARGET = "Target";

    public ExecutionContext {
        inputParameters = inputParameters != null ? Map.copyOf(inputParameters) : Map.of();
    }

    /**
     * Build the context for creating {@code target} on behalf of {@code userId}.
     *
     * @param target The pending record
     * @param userId The caller
     * @return a new context with a fresh correlation ID
     */
    public static ExecutionContext forCreate(PendingRecord target, UUID userId) {
        return new ExecutionContext(
            CREATE,
            target.entityName(),
            target.id(),
            userId,
            UUID.randomUUID(),
            Map.of(TARGET, target)
        );
    }

    /**
     * Get the raw {@value #TARGET} input parameter.
     *
     * @return the target, or null if absent
     */
    public Object target() {
        return inputParameters.get(TARGET);
    }
}
