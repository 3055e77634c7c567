package com.ivamare.caseguard.exception;

/**
 * Raised when the hosting pipeline does not provide a required service or
 * context value, or provides one of the wrong type.
 *
 * <p>Always fatal to the attempt and never retried.
 */
public class HostConfigurationException extends CaseGuardException {

    public HostConfigurationException(String message) {
        super(message);
    }
}
