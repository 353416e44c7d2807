package caseflow.coordinator.pipeline;

import java.util.List;

/**
 * Outcome of one pipeline run.
 */
public record PipelineResult(
        String caseId,
        boolean succeeded,
        StageKind failedStage,
        String error,
        List<StageKind> completedStages) {

    public static PipelineResult success(String caseId, List<StageKind> completed) {
        return new PipelineResult(caseId, true, null, null, List.copyOf(completed));
    }

    public static PipelineResult failure(String caseId, StageKind failedStage, String error,
            List<StageKind> completed) {
        return new PipelineResult(caseId, false, failedStage, error, List.copyOf(completed));
    }
}
