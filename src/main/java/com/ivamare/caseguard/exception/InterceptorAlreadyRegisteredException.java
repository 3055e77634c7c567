package com.ivamare.caseguard.exception;

/**
 * Thrown when the same interceptor is registered twice for an entity.
 */
public class InterceptorAlreadyRegisteredException extends CaseGuardException {

    private final String entityName;
    private final String interceptorName;

    public InterceptorAlreadyRegisteredException(String entityName, String interceptorName) {
        super("Interceptor " + interceptorName + " already registered for " + entityName);
        this.entityName = entityName;
        this.interceptorName = interceptorName;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getInterceptorName() {
        return interceptorName;
    }
}
