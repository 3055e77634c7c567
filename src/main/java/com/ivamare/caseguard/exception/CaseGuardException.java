package com.ivamare.caseguard.exception;

/**
 * Base exception for all Case Guard errors.
 */
public class CaseGuardException extends RuntimeException {

    public CaseGuardException(String message) {
        super(message);
    }

    public CaseGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
