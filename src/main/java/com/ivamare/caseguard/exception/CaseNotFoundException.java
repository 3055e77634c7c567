package com.ivamare.caseguard.exception;

import java.util.UUID;

/**
 * Thrown when a case cannot be found.
 */
public class CaseNotFoundException extends CaseGuardException {

    private final UUID caseId;

    public CaseNotFoundException(UUID caseId) {
        super("Case " + caseId + " not found");
        this.caseId = caseId;
    }

    public UUID getCaseId() {
        return caseId;
    }
}
