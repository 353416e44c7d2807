package caseflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Queue job status.
 */
public enum JobStatus {
    /** Waiting for scheduled_for to pass and a worker to claim it */
    PENDING,
    /** Leased by exactly one worker invocation */
    PROCESSING,
    /** Handler finished, result recorded */
    COMPLETED,
    /** Attempts exhausted; only a new enqueue runs it again */
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
