package caseflow.coordinator.pipeline;

import caseflow.coordinator.model.CaseRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Working state of one pipeline run: the case as last persisted plus the
 * outputs of the stages completed so far.
 */
public final class PipelineContext {

    private CaseRecord caseRecord;
    private final Map<StageKind, JsonNode> outputs = new EnumMap<>(StageKind.class);

    public PipelineContext(CaseRecord caseRecord) {
        this.caseRecord = caseRecord;
    }

    public String caseId() {
        return caseRecord.id();
    }

    public CaseRecord caseRecord() {
        return caseRecord;
    }

    /**
     * Replace the working copy of the case after a persist stage wrote to it.
     */
    public void updateCase(UnaryOperator<CaseRecord> update) {
        this.caseRecord = update.apply(caseRecord);
    }

    /**
     * Output of a completed stage.
     *
     * @throws IllegalStateException if that stage has not completed in this run
     */
    public JsonNode output(StageKind stage) {
        JsonNode node = outputs.get(stage);
        if (node == null) {
            throw new IllegalStateException("No output for stage " + stage.stageName());
        }
        return node;
    }

    public boolean hasOutput(StageKind stage) {
        return outputs.containsKey(stage);
    }

    void record(StageKind stage, JsonNode output) {
        outputs.put(stage, output);
    }

    public Map<StageKind, JsonNode> outputs() {
        return Collections.unmodifiableMap(outputs);
    }
}
