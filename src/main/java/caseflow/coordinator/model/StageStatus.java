package caseflow.coordinator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StageStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
