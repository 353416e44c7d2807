package caseflow.coordinator.api.v1.dto;

import caseflow.coordinator.service.CaseStatusService.CaseStatusView;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Response DTO for case status.
 * GET /api/v1/cases/{id}/status
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseStatusResponse(
        @JsonProperty("caseId") String caseId,
        @JsonProperty("status") String status,
        @JsonProperty("lastUpdate") Instant lastUpdate,
        @JsonProperty("error") String error,
        @JsonProperty("currentStage") String currentStage,
        @JsonProperty("completedStages") int completedStages,
        @JsonProperty("totalStages") int totalStages,
        @JsonProperty("outcomePredictionScore") Integer outcomePredictionScore,
        @JsonProperty("riskLevel") String riskLevel,
        @JsonProperty("results") JsonNode results) {

    public static CaseStatusResponse from(CaseStatusView view) {
        return new CaseStatusResponse(
                view.caseId(),
                view.status().wireName(),
                view.lastUpdate(),
                view.error(),
                view.currentStage() != null ? view.currentStage().stageName() : null,
                view.completedStages(),
                view.totalStages(),
                view.outcomePredictionScore(),
                view.riskLevel(),
                view.results());
    }
}
