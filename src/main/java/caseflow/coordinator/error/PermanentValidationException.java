package caseflow.coordinator.error;

/**
 * Inbound payload is malformed or missing required fields.
 * Rejected at the boundary; never enqueued, never retried.
 */
public class PermanentValidationException extends IllegalArgumentException {

    public PermanentValidationException(String message) {
        super(message);
    }
}
