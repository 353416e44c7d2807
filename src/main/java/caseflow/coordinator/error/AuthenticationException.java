package caseflow.coordinator.error;

/**
 * Caller could not be authenticated (bad signature, secret or bearer credential).
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
