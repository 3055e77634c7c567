package com.ivamare.caseguard.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A record that is about to be created but has not been committed yet.
 *
 * <p>Interceptors read attributes by key and must not change them; the
 * attribute map is an immutable copy. Values may be {@code null} only by
 * absence, since {@link Map#copyOf} rejects null values.
 *
 * @param entityName Logical entity name (e.g., "case")
 * @param id Identifier the record will be committed under
 * @param attributes Attribute values keyed by attribute name
 */
public record PendingRecord(
    String entityName,
    UUID id,
    Map<String, Object> attributes
) {
    public PendingRecord {
        Objects.requireNonNull(entityName, "entityName must not be null");
        Objects.requireNonNull(id, "id must not be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /**
     * Check if an attribute is present.
     *
     * @param key Attribute name
     * @return true if the record carries a value for {@code key}
     */
    public boolean contains(String key) {
        return attributes.containsKey(key);
    }

    /**
     * Get a raw attribute value.
     *
     * @param key Attribute name
     * @return the value, or null if absent
     */
    public Object attribute(String key) {
        return attributes.get(key);
    }

    /**
     * Get an attribute value if it is present and of the expected type.
     *
     * @param key Attribute name
     * @param type Expected value type
     * @return Optional containing the typed value
     */
    public <T> Optional<T> attribute(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
