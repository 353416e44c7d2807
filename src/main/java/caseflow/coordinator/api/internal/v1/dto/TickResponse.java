package caseflow.coordinator.api.internal.v1.dto;

import caseflow.coordinator.service.WorkerOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a worker tick. An empty queue is {@code processed=false} with a reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TickResponse(
        @JsonProperty("processed") boolean processed,
        @JsonProperty("reason") String reason,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("succeeded") Boolean succeeded,
        @JsonProperty("error") String error) {

    public static TickResponse from(WorkerOutcome outcome) {
        if (!outcome.processed()) {
            return new TickResponse(false, WorkerOutcome.NO_ELIGIBLE_JOB, null, null, null);
        }
        return new TickResponse(true, null, outcome.jobId(), outcome.succeeded(), outcome.error());
    }
}
