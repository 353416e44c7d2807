package caseflow.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a worker tick.
 * POST /internal/v1/worker/tick
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TickRequest(
        @JsonProperty("queueName") String queueName) {

    public String queueOr(String defaultQueue) {
        return queueName == null || queueName.isBlank() ? defaultQueue : queueName;
    }
}
