package caseflow.coordinator.error;

/**
 * An external call failed in a way that may succeed on a later attempt:
 * timeouts, connection errors, 5xx and 429 responses.
 */
public class TransientExternalException extends RuntimeException {

    private final String resource;

    public TransientExternalException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    public TransientExternalException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
