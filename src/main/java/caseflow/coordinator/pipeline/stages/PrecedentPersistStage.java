package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.model.PrecedentCase;
import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.repository.CaseRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Replaces the case's stored precedents with this run's search results.
 */
public class PrecedentPersistStage implements StageHandler {

    private static final TypeReference<List<PrecedentCase>> PRECEDENTS = new TypeReference<>() {
    };

    private final CaseRepository cases;
    private final ObjectMapper mapper;

    public PrecedentPersistStage(CaseRepository cases, ObjectMapper mapper) {
        this.cases = cases;
        this.mapper = mapper;
    }

    @Override
    public StageKind kind() {
        return StageKind.PRECEDENT_PERSIST;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        JsonNode found = context.output(StageKind.CASE_LAW_SEARCH).path("precedents");
        List<PrecedentCase> precedents = found.isArray() ? mapper.convertValue(found, PRECEDENTS) : List.of();
        cases.replacePrecedents(context.caseId(), precedents);

        ObjectNode output = mapper.createObjectNode();
        output.put("count", precedents.size());
        output.put("influenceScore", context.output(StageKind.OPINION_ANALYSIS).path("influence_score").asDouble(0));
        return output;
    }
}
