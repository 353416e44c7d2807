package caseflow.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for queue cleanup.
 * POST /internal/v1/queues/{name}/cleanup
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CleanupRequest(
        @JsonProperty("maxAgeHours") Integer maxAgeHours) {

    public void validate() {
        if (maxAgeHours == null) {
            throw new IllegalArgumentException("maxAgeHours is required");
        }
        if (maxAgeHours < 0) {
            throw new IllegalArgumentException("maxAgeHours must be >= 0");
        }
    }
}
