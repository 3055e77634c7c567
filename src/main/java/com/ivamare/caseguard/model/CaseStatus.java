package com.ivamare.caseguard.model;

/**
 * Status of a case in its lifecycle.
 */
public enum CaseStatus {
    /** Open or in progress */
    ACTIVE("ACTIVE"),

    /** Closed after the issue was resolved */
    RESOLVED("RESOLVED"),

    /** Closed without resolution */
    CANCELLED("CANCELLED");

    private final String value;

    CaseStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Check if this status counts towards the one-active-case-per-customer rule.
     *
     * @return true for {@link #ACTIVE}
     */
    public boolean isActive() {
        return this == ACTIVE;
    }

    public static CaseStatus fromValue(String value) {
        for (CaseStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown CaseStatus: " + value);
    }
}
