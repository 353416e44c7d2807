package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Derived estimates computed locally from earlier outputs: litigation cost,
 * risk factors, settlement recommendation and timeline.
 */
public class SupplementaryAnalysisStage implements StageHandler {

    static final double BASE_COST = 50_000;
    static final double FEDERAL_MULTIPLIER = 1.5;
    static final double BASE_MONTHS = 12;

    private final ObjectMapper mapper;

    public SupplementaryAnalysisStage(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public StageKind kind() {
        return StageKind.SUPPLEMENTARY_ANALYSIS;
    }

    @Override
    public JsonNode execute(PipelineContext context) {
        int complexity = context.output(StageKind.COMPLEXITY_SCORE).path("complexity_score").asInt(50);
        JsonNode prediction = context.output(StageKind.OUTCOME_PREDICTION);
        boolean federal = context.caseRecord().isFederal()
                || context.output(StageKind.JURISDICTION_ANALYSIS).path("is_federal").asBoolean(false);
        int precedents = context.output(StageKind.PRECEDENT_PERSIST).path("count").asInt(0);

        ObjectNode output = mapper.createObjectNode();
        output.set("costEstimate", costEstimate(complexity, federal));
        output.set("riskAssessment", riskAssessment(prediction, complexity, federal, precedents));
        output.set("settlementAnalysis", settlementAnalysis(prediction, complexity, precedents));
        output.set("timelineEstimate", timelineEstimate(complexity));
        return output;
    }

    static long estimatedCost(int complexity, boolean federal) {
        return Math.round(BASE_COST * (1 + complexity / 100.0) * (federal ? FEDERAL_MULTIPLIER : 1.0));
    }

    private ObjectNode costEstimate(int complexity, boolean federal) {
        long total = estimatedCost(complexity, federal);
        ObjectNode node = mapper.createObjectNode();
        node.putObject("total")
                .put("min", Math.round(total * 0.7))
                .put("avg", total)
                .put("max", Math.round(total * 1.5));
        node.putObject("breakdown")
                .put("filing", Math.round(total * 0.05))
                .put("discovery", Math.round(total * 0.35))
                .put("motions", Math.round(total * 0.15))
                .put("trial", Math.round(total * 0.30))
                .put("other", Math.round(total * 0.15));
        return node;
    }

    private ObjectNode riskAssessment(JsonNode prediction, int complexity, boolean federal, int precedents) {
        ObjectNode node = mapper.createObjectNode();
        node.put("overallRisk", prediction.path("risk_level").asText("medium"));
        ArrayNode factors = node.putArray("riskFactors");
        factors.addObject()
                .put("factor", "complexity")
                .put("level", complexity > 70 ? "high" : complexity > 40 ? "medium" : "low")
                .put("impact", complexity / 100.0);
        factors.addObject()
                .put("factor", "jurisdiction")
                .put("level", federal ? "high" : "medium")
                .put("impact", 0.3);
        factors.addObject()
                .put("factor", "precedent_support")
                .put("level", precedents > 5 ? "low" : "high")
                .put("impact", 0.4);
        return node;
    }

    private ObjectNode settlementAnalysis(JsonNode prediction, int complexity, int precedents) {
        int likelihood = prediction.path("settlement_probability").asInt(50);
        ObjectNode node = mapper.createObjectNode();
        node.put("settlementLikelihood", likelihood);
        node.put("recommendedApproach", likelihood > 60 ? "settlement" : "trial");
        node.putObject("factors")
                .put("caseStrength", prediction.path("case_strength_score").asInt(50))
                .put("complexity", complexity)
                .put("precedentSupport", precedents);
        return node;
    }

    private ObjectNode timelineEstimate(int complexity) {
        double factor = 1 + complexity / 100.0;
        ObjectNode node = mapper.createObjectNode();
        node.put("totalMonths", Math.round(BASE_MONTHS * factor));
        ArrayNode phases = node.putArray("phases");
        phases.addObject().put("phase", "filing").put("months", 1);
        phases.addObject().put("phase", "discovery").put("months", Math.round(6 * factor));
        phases.addObject().put("phase", "pre_trial").put("months", 2);
        phases.addObject().put("phase", "trial").put("months", Math.round(3 * factor));
        return node;
    }
}
