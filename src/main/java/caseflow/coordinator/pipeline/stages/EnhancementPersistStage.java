package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.repository.CaseRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes the resolved jurisdiction and enhanced summary onto the case.
 */
public class EnhancementPersistStage implements StageHandler {

    private final CaseRepository cases;
    private final ObjectMapper mapper;

    public EnhancementPersistStage(CaseRepository cases, ObjectMapper mapper) {
        this.cases = cases;
        this.mapper = mapper;
    }

    @Override
    public StageKind kind() {
        return StageKind.ENHANCEMENT_PERSIST;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        // Jurisdiction is a transitive dependency through the enhancement stage
        String jurisdiction = context.output(StageKind.JURISDICTION_ANALYSIS).path("jurisdiction").asText(null);
        if (jurisdiction == null || jurisdiction.isBlank()) {
            jurisdiction = context.caseRecord().jurisdiction();
        }
        String summary = context.output(StageKind.CASE_ENHANCEMENT).path("enhanced_summary").asText(null);
        if (summary == null || summary.isBlank()) {
            throw new IllegalStateException("Enhancement returned no enhanced_summary");
        }

        cases.updateEnhancement(context.caseId(), jurisdiction, summary);
        String persistedJurisdiction = jurisdiction;
        context.updateCase(c -> c.toBuilder().jurisdiction(persistedJurisdiction).enhancedSummary(summary).build());

        ObjectNode output = mapper.createObjectNode();
        output.put("jurisdiction", jurisdiction);
        output.put("summaryLength", summary.length());
        return output;
    }
}
