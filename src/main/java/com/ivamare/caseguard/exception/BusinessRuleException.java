package com.ivamare.caseguard.exception;

import java.util.Map;

/**
 * Raised when an operation violates a business rule.
 *
 * <p>The hosting pipeline aborts the operation and surfaces
 * {@link #getErrorMessage()} to the original caller verbatim. Never
 * retried automatically; retries are a caller concern.
 */
public class BusinessRuleException extends CaseGuardException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public BusinessRuleException(String code, String message) {
        this(code, message, Map.of());
    }

    public BusinessRuleException(String code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
