package com.ivamare.caseguard.exception;

/**
 * Thrown when an invalid state transition or operation is attempted.
 */
public class InvalidOperationException extends CaseGuardException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
