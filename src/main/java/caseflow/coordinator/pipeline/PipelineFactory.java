package caseflow.coordinator.pipeline;

import caseflow.coordinator.pipeline.stages.CaseLawSearchStage;
import caseflow.coordinator.pipeline.stages.DocumentExtractionStage;
import caseflow.coordinator.pipeline.stages.EnhancementPersistStage;
import caseflow.coordinator.pipeline.stages.FinalPersistStage;
import caseflow.coordinator.pipeline.stages.IntakePersistStage;
import caseflow.coordinator.pipeline.stages.LlmAnalysisStage;
import caseflow.coordinator.pipeline.stages.PrecedentPersistStage;
import caseflow.coordinator.pipeline.stages.PredictionNormalizer;
import caseflow.coordinator.pipeline.stages.StagePromptSet;
import caseflow.coordinator.pipeline.stages.SupplementaryAnalysisStage;
import caseflow.coordinator.ratelimit.ExternalCallExecutor;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.external.CaseLawClient;
import caseflow.external.DocumentTextExtractor;
import caseflow.external.LlmClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Wires every stage handler into a validated {@link StageGraph}.
 */
public final class PipelineFactory {

    public static final String INTAKE_MODEL = "gpt-4o-mini";
    public static final String JURISDICTION_MODEL = "gpt-4o";
    public static final String ENHANCEMENT_MODEL = "gpt-4o";
    public static final String ANALYSIS_MODEL = "gpt-4-turbo";
    public static final String COMPLEXITY_MODEL = "gpt-4o-mini";
    public static final String PREDICTION_MODEL = "gpt-4o";

    private PipelineFactory() {
    }

    public static StageGraph build(CaseRepository cases, LlmClient llm, CaseLawClient caseLaw,
            DocumentTextExtractor extractor, ExternalCallExecutor executor, FanOut fanOut,
            ObjectMapper mapper, Clock clock) {
        UnaryOperator<JsonNode> asIs = UnaryOperator.identity();
        return StageGraph.of(List.of(
                new DocumentExtractionStage(cases, extractor, executor, mapper),
                new LlmAnalysisStage(StageKind.INTAKE_ANALYSIS, INTAKE_MODEL, 2000,
                        StagePromptSet::intake, asIs, llm, executor),
                new IntakePersistStage(cases, mapper),
                new LlmAnalysisStage(StageKind.JURISDICTION_ANALYSIS, JURISDICTION_MODEL, 1500,
                        StagePromptSet::jurisdiction, asIs, llm, executor),
                new LlmAnalysisStage(StageKind.CASE_ENHANCEMENT, ENHANCEMENT_MODEL, 3000,
                        StagePromptSet::enhancement, asIs, llm, executor),
                new EnhancementPersistStage(cases, mapper),
                new CaseLawSearchStage(caseLaw, cases, executor, fanOut, mapper),
                new LlmAnalysisStage(StageKind.OPINION_ANALYSIS, ANALYSIS_MODEL, 3000,
                        StagePromptSet::opinionAnalysis, asIs, llm, executor),
                new PrecedentPersistStage(cases, mapper),
                new LlmAnalysisStage(StageKind.COMPLEXITY_SCORE, COMPLEXITY_MODEL, 1000,
                        StagePromptSet::complexity, PredictionNormalizer.complexity(), llm, executor),
                new LlmAnalysisStage(StageKind.OUTCOME_PREDICTION, PREDICTION_MODEL, 3000,
                        StagePromptSet::prediction, new PredictionNormalizer(), llm, executor),
                new SupplementaryAnalysisStage(mapper),
                new FinalPersistStage(cases, mapper, clock)));
    }
}
