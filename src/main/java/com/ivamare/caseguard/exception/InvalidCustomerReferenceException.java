package com.ivamare.caseguard.exception;

import java.util.Map;

/**
 * Raised when a pending case carries no customer reference, or a value
 * that is not a valid reference.
 *
 * <p>This is a data-integrity failure, distinct from
 * {@link ActiveCaseExistsException}.
 */
public class InvalidCustomerReferenceException extends CaseGuardException {

    public static final String CODE = "INVALID_CUSTOMER_REFERENCE";
    public static final String MESSAGE = "Customer ID is missing or invalid";

    private final String attribute;
    private final Map<String, Object> details;

    public InvalidCustomerReferenceException(String attribute, Object actualValue) {
        super("[" + CODE + "] " + MESSAGE);
        this.attribute = attribute;
        this.details = actualValue != null
            ? Map.of("attribute", attribute, "actualType", actualValue.getClass().getName())
            : Map.of("attribute", attribute);
    }

    public String getCode() {
        return CODE;
    }

    public String getErrorMessage() {
        return MESSAGE;
    }

    public String getAttribute() {
        return attribute;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
