package com.ivamare.caseguard.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Polymorphic reference from a case to the customer it belongs to.
 *
 * <p>A reference always names exactly one organization or one individual.
 * Uniqueness checks key on {@link #id()} only; the kind is carried for
 * display and for the stored record.
 *
 * @param kind Kind of the referenced customer record
 * @param id Identity of the referenced customer record
 */
public record CustomerReference(CustomerKind kind, UUID id) {

    public CustomerReference {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
    }

    public static CustomerReference organization(UUID id) {
        return new CustomerReference(CustomerKind.ORGANIZATION, id);
    }

    public static CustomerReference individual(UUID id) {
        return new CustomerReference(CustomerKind.INDIVIDUAL, id);
    }

    public boolean isOrganization() {
        return kind == CustomerKind.ORGANIZATION;
    }
}
