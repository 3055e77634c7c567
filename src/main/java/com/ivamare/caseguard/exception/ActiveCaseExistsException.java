package com.ivamare.caseguard.exception;

import java.util.Map;
import java.util.UUID;

/**
 * Raised when a case is created for a customer that already has an active case.
 *
 * <p>Thrown by the uniqueness guard, and by the create pipeline when the
 * store's active-case constraint rejects the commit.
 */
public class ActiveCaseExistsException extends BusinessRuleException {

    public static final String CODE = "ACTIVE_CASE_EXISTS";
    public static final String MESSAGE = "Cannot create Case. This Customer is linked to another Active Case";

    private final UUID customerId;

    public ActiveCaseExistsException(UUID customerId) {
        super(CODE, MESSAGE, customerId != null ? Map.of("customerId", customerId.toString()) : Map.of());
        this.customerId = customerId;
    }

    public UUID getCustomerId() {
        return customerId;
    }
}
