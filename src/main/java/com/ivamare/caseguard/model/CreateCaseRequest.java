package com.ivamare.caseguard.model;

import java.util.Map;

/**
 * Request to open a new case.
 *
 * @param title Short description
 * @param customer Customer the case is for (may be null; rejected by the guard)
 * @param attributes Additional form attributes
 */
public record CreateCaseRequest(
    String title,
    CustomerReference customer,
    Map<String, Object> attributes
) {
    public CreateCaseRequest {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public CreateCaseRequest(String title, CustomerReference customer) {
        this(title, customer, Map.of());
    }
}
