package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.ratelimit.ExternalCallExecutor;
import caseflow.external.LlmClient;
import caseflow.external.LlmRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A stage whose output is one model completion, optionally normalized.
 */
public class LlmAnalysisStage implements StageHandler {

    private final StageKind kind;
    private final String model;
    private final int maxTokens;
    private final Function<PipelineContext, String> prompt;
    private final UnaryOperator<JsonNode> normalizer;
    private final LlmClient llm;
    private final ExternalCallExecutor executor;

    public LlmAnalysisStage(StageKind kind, String model, int maxTokens, Function<PipelineContext, String> prompt,
            UnaryOperator<JsonNode> normalizer, LlmClient llm, ExternalCallExecutor executor) {
        this.kind = kind;
        this.model = model;
        this.maxTokens = maxTokens;
        this.prompt = prompt;
        this.normalizer = normalizer;
        this.llm = llm;
        this.executor = executor;
    }

    @Override
    public StageKind kind() {
        return kind;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        LlmRequest request = new LlmRequest(model, StagePromptSet.SYSTEM, prompt.apply(context), maxTokens, 0.2);
        JsonNode answer = executor.call(model, request.estimatePayload(), () -> llm.complete(request));
        return normalizer.apply(answer);
    }

    public String model() {
        return model;
    }
}
