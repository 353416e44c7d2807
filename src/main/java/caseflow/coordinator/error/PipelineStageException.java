package caseflow.coordinator.error;

import caseflow.coordinator.pipeline.StageKind;

/**
 * A pipeline stage could not produce its output.
 * Caught by the orchestrator and turned into a case-level failure.
 */
public class PipelineStageException extends RuntimeException {

    private final StageKind stage;

    public PipelineStageException(StageKind stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineStageException(StageKind stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public StageKind stage() {
        return stage;
    }
}
