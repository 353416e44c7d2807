package caseflow.coordinator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Logic of one pipeline stage. The returned JSON is the stage's checkpoint.
 */
public interface StageHandler {

    StageKind kind();

    /**
     * Run the stage. Outputs of every declared dependency are available in the context.
     */
    JsonNode execute(PipelineContext context) throws Exception;
}
