package com.ivamare.caseguard.pipeline;

import java.util.List;

/**
 * Registry of pre-create interceptors.
 *
 * <p>Maps entity names to ordered interceptor lists. Interceptors are
 * registered programmatically or discovered from @PreCreate methods.
 */
public interface InterceptorRegistry {

    /**
     * Register an interceptor with order 0.
     *
     * @param entityName The entity (e.g., "case")
     * @param interceptor The interceptor
     * @throws com.ivamare.caseguard.exception.InterceptorAlreadyRegisteredException if already registered
     */
    default void register(String entityName, CreateInterceptor interceptor) {
        register(entityName, interceptor, 0);
    }

    /**
     * Register an interceptor.
     *
     * @param entityName The entity
     * @param interceptor The interceptor
     * @param order Execution order, lowest first; ties run in registration order
     * @throws com.ivamare.caseguard.exception.InterceptorAlreadyRegisteredException if already registered
     */
    void register(String entityName, CreateInterceptor interceptor, int order);

    /**
     * Get the interceptors of an entity in execution order.
     *
     * @param entityName The entity
     * @return ordered interceptors (empty if none)
     */
    List<CreateInterceptor> interceptorsFor(String entityName);

    /**
     * Check if an entity has any interceptors.
     *
     * @param entityName The entity
     * @return true if at least one interceptor is registered
     */
    boolean hasInterceptors(String entityName);

    /**
     * Get all registered interceptors.
     *
     * @return registration keys
     */
    List<InterceptorKey> registeredInterceptors();

    /**
     * Remove all interceptors. Useful for testing.
     */
    void clear();

    /**
     * Scan a bean for @PreCreate annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return keys of the registered interceptors
     */
    List<InterceptorKey> registerBean(Object bean);

    /**
     * Key describing a registration.
     *
     * @param entityName The entity
     * @param name Interceptor name (bean class and method, or class name)
     * @param order Execution order
     */
    record InterceptorKey(String entityName, String name, int order) {}
}
