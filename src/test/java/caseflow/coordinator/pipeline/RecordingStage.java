package caseflow.coordinator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage handler that logs its invocation and either answers {@code {"stage": name}} or throws.
 */
final class RecordingStage implements StageHandler {

    private final StageKind kind;
    private final List<StageKind> invocations;
    private final Exception failure;

    RecordingStage(StageKind kind, List<StageKind> invocations, Exception failure) {
        this.kind = kind;
        this.invocations = invocations;
        this.failure = failure;
    }

    static StageGraph graph(List<StageKind> invocations, StageKind failing, Exception failure) {
        List<StageHandler> handlers = new ArrayList<>();
        for (StageKind kind : StageKind.values()) {
            handlers.add(new RecordingStage(kind, invocations, kind == failing ? failure : null));
        }
        return StageGraph.of(handlers);
    }

    @Override
    public StageKind kind() {
        return kind;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        invocations.add(kind);
        for (StageKind dependency : kind.dependencies()) {
            context.output(dependency);
        }
        if (failure != null) {
            throw failure;
        }
        return JsonNodeFactory.instance.objectNode().put("stage", kind.stageName());
    }
}
