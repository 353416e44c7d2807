package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.repository.CaseRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;

/**
 * Stores the prediction and supplementary analysis, and copies the headline
 * score and risk level onto the case.
 */
public class FinalPersistStage implements StageHandler {

    private final CaseRepository cases;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FinalPersistStage(CaseRepository cases, ObjectMapper mapper, Clock clock) {
        this.cases = cases;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public StageKind kind() {
        return StageKind.FINAL_PERSIST;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        JsonNode prediction = context.output(StageKind.OUTCOME_PREDICTION);
        JsonNode supplementary = context.output(StageKind.SUPPLEMENTARY_ANALYSIS);
        int score = prediction.path("outcome_prediction_score").asInt(50);
        String riskLevel = prediction.path("risk_level").asText("medium");

        cases.savePrediction(context.caseId(), mapper.writeValueAsString(prediction),
                mapper.writeValueAsString(supplementary), clock.instant());
        cases.updatePrediction(context.caseId(), score, riskLevel);
        context.updateCase(c -> c.toBuilder().outcomePredictionScore(score).riskLevel(riskLevel).build());

        ObjectNode output = mapper.createObjectNode();
        output.put("outcomePredictionScore", score);
        output.put("riskLevel", riskLevel);
        return output;
    }
}
