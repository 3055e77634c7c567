package com.ivamare.caseguard.model;

/**
 * Kind of record a {@link CustomerReference} points at.
 */
public enum CustomerKind {
    /** Company or other legal entity */
    ORGANIZATION("organization"),

    /** Individual person */
    INDIVIDUAL("individual");

    private final String value;

    CustomerKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CustomerKind fromValue(String value) {
        for (CustomerKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown CustomerKind: " + value);
    }
}
