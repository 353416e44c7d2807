package caseflow.coordinator.api.v1.dto;

import caseflow.coordinator.model.StageRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One stage of a case, as listed by GET /api/v1/cases/{id}/stages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResponse(
        @JsonProperty("stage") String stage,
        @JsonProperty("step") int step,
        @JsonProperty("status") String status,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("error") String error,
        @JsonProperty("hasOutput") boolean hasOutput) {

    public static StageResponse from(StageRecord record) {
        return new StageResponse(
                record.stage().stageName(),
                record.stage().step(),
                record.status().wireName(),
                record.startedAt(),
                record.completedAt(),
                record.error(),
                record.output() != null);
    }
}
