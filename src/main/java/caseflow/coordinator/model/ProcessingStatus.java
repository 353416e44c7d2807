package caseflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Case-level processing status, the only externally visible outcome signal.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProcessingStatus fromWire(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Allowed transitions. A terminal case may go back to PROCESSING only
     * because a new run started (queue retry or manual reprocess).
     */
    public boolean canTransitionTo(ProcessingStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> next == PROCESSING;
        };
    }
}
