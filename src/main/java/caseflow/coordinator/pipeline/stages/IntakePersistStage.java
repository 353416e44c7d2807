package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.repository.CaseRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes the intake classification (case type, legal issues) onto the case.
 */
public class IntakePersistStage implements StageHandler {

    private final CaseRepository cases;
    private final ObjectMapper mapper;

    public IntakePersistStage(CaseRepository cases, ObjectMapper mapper) {
        this.cases = cases;
        this.mapper = mapper;
    }

    @Override
    public StageKind kind() {
        return StageKind.INTAKE_PERSIST;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        JsonNode intake = context.output(StageKind.INTAKE_ANALYSIS);
        String caseType = intake.path("case_type").asText(null);
        if (caseType == null || caseType.isBlank()) {
            caseType = context.caseRecord().caseType();
        }

        ArrayNode issues = mapper.createArrayNode();
        for (JsonNode issue : intake.path("legal_issues")) {
            if (issue.isTextual() && !issue.asText().isBlank()) {
                issues.add(issue.asText());
            }
        }
        String issuesJson = mapper.writeValueAsString(issues);

        cases.updateIntake(context.caseId(), caseType, issuesJson);
        String persistedType = caseType;
        context.updateCase(c -> c.toBuilder().caseType(persistedType).legalIssues(issuesJson).build());

        ObjectNode output = mapper.createObjectNode();
        output.put("caseType", caseType);
        output.set("legalIssues", issues);
        return output;
    }
}
