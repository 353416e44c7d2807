package caseflow.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a worker batch.
 * POST /internal/v1/worker/batch
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchRequest(
        @JsonProperty("queueName") String queueName,
        @JsonProperty("batchSize") Integer batchSize) {

    public static final int DEFAULT_BATCH_SIZE = 5;

    public void validate() {
        if (batchSize != null && batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }

    public String queueOr(String defaultQueue) {
        return queueName == null || queueName.isBlank() ? defaultQueue : queueName;
    }

    public int batchSizeOrDefault() {
        return batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
    }
}
