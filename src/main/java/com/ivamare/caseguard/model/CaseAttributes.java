package com.ivamare.caseguard.model;

import java.util.Set;

/**
 * Stable attribute keys of a pending case record.
 */
public final class CaseAttributes {

    private CaseAttributes() {
    }

    public static final String CUSTOMER = "customer";
    public static final String TITLE = "title";
    public static final String STATUS = "status";

    // Contact details mirrored from the customer by the case form
    public static final String EMAIL_ADDRESS = "emailAddress";
    public static final String MOBILE_PHONE = "mobilePhone";
    public static final String DESCRIPTION = "description";

    /** Keys stored in dedicated columns rather than the attribute document. */
    public static final Set<String> CORE = Set.of(CUSTOMER, TITLE, STATUS);
}
