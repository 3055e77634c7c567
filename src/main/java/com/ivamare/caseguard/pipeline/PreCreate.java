package com.ivamare.caseguard.pipeline;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a pre-create interceptor.
 *
 * <p>Methods annotated with @PreCreate are discovered and registered by the
 * InterceptorRegistry when the declaring bean is initialized.
 *
 * <p>Interceptor methods must have the signature:
 * <pre>
 * void methodName(PendingRecord target, ExecutionContext context)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class TitleRules {
 *
 *     {@literal @}PreCreate(entity = "case", order = 10)
 *     public void requireTitle(PendingRecord target, ExecutionContext context) {
 *         if (target.attribute("title", String.class).isEmpty()) {
 *             throw new BusinessRuleException("TITLE_REQUIRED", "A case needs a title");
 *         }
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface PreCreate {

    /**
     * The entity whose creates this method intercepts.
     *
     * @return entity name (e.g., "case")
     */
    String entity();

    /**
     * Execution order among the entity's interceptors, lowest first.
     *
     * @return order value
     */
    int order() default 0;
}
