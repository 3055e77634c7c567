package com.ivamare.caseguard.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A committed case (support or service ticket).
 *
 * @param caseId Unique case identifier
 * @param title Short description shown to agents
 * @param customer Customer the case is raised for
 * @param status Current lifecycle status
 * @param attributes Additional form attributes (contact details, description)
 * @param createdBy Caller that created the case
 * @param createdAt When the case was committed
 * @param updatedAt When the case was last changed
 */
public record CaseRecord(
    UUID caseId,
    String title,
    CustomerReference customer,
    CaseStatus status,
    Map<String, Object> attributes,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt
) {
    /** Entity name used to route pipeline interceptors. */
    public static final String ENTITY_NAME = "case";

    public CaseRecord {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /**
     * Create a copy with a new status.
     *
     * @param newStatus The status to apply
     * @param at Time of the change
     * @return updated copy
     */
    public CaseRecord withStatus(CaseStatus newStatus, Instant at) {
        return new CaseRecord(caseId, title, customer, newStatus, attributes, createdBy, createdAt, at);
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }
}
