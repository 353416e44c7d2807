package caseflow.coordinator.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The validated set of stage handlers, in execution order.
 * Building fails fast on a missing or duplicate handler or a dependency that
 * does not run earlier.
 */
public final class StageGraph {

    private final List<StageHandler> ordered;

    private StageGraph(List<StageHandler> ordered) {
        this.ordered = ordered;
    }

    public static StageGraph of(List<? extends StageHandler> handlers) {
        Map<StageKind, StageHandler> byKind = new EnumMap<>(StageKind.class);
        for (StageHandler handler : handlers) {
            StageHandler previous = byKind.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for stage " + handler.kind().stageName());
            }
        }

        List<StageHandler> ordered = new ArrayList<>();
        for (StageKind kind : StageKind.values()) {
            StageHandler handler = byKind.get(kind);
            if (handler == null) {
                throw new IllegalArgumentException("No handler registered for stage " + kind.stageName());
            }
            for (StageKind dependency : kind.dependencies()) {
                if (dependency.ordinal() >= kind.ordinal()) {
                    throw new IllegalArgumentException("Stage " + kind.stageName()
                            + " depends on " + dependency.stageName() + " which does not run before it");
                }
            }
            ordered.add(handler);
        }
        return new StageGraph(Collections.unmodifiableList(ordered));
    }

    public List<StageHandler> ordered() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }
}
