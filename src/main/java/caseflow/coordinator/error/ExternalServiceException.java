package caseflow.coordinator.error;

/**
 * Non-retryable failure of an external call (rejected request, unusable response).
 */
public class ExternalServiceException extends RuntimeException {

    private final String resource;
    private final int statusCode;

    public ExternalServiceException(String resource, int statusCode, String message) {
        super(message);
        this.resource = resource;
        this.statusCode = statusCode;
    }

    public ExternalServiceException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
        this.statusCode = -1;
    }

    public String resource() {
        return resource;
    }

    public int statusCode() {
        return statusCode;
    }
}
