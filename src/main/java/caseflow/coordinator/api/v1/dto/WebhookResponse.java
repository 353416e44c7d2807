package caseflow.coordinator.api.v1.dto;

import caseflow.coordinator.service.IntakeResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for accepted change events and reprocess requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("caseId") String caseId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("message") String message) {

    public static WebhookResponse from(IntakeResult result) {
        boolean success = !IntakeResult.CONFLICT.equals(result.outcome());
        return new WebhookResponse(success, result.outcome(), result.caseId(), result.jobId(), result.message());
    }
}
