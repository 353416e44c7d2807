package caseflow.coordinator.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageGraphTest {

    private static List<StageHandler> allHandlers() {
        List<StageHandler> handlers = new ArrayList<>();
        for (StageKind kind : StageKind.values()) {
            handlers.add(new RecordingStage(kind, new ArrayList<>(), null));
        }
        return handlers;
    }

    @Test
    void ordersHandlersByStageRegardlessOfRegistration() {
        List<StageHandler> handlers = allHandlers();
        Collections.reverse(handlers);

        StageGraph graph = StageGraph.of(handlers);

        assertEquals(StageKind.values().length, graph.size());
        assertEquals(Arrays.asList(StageKind.values()), graph.ordered().stream().map(StageHandler::kind).toList());
    }

    @Test
    void missingHandlerIsRejected() {
        List<StageHandler> handlers = allHandlers();
        handlers.remove(5);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> StageGraph.of(handlers));
        assertTrue(e.getMessage().contains(StageKind.values()[5].stageName()));
    }

    @Test
    void duplicateHandlerIsRejected() {
        List<StageHandler> handlers = allHandlers();
        handlers.add(new RecordingStage(StageKind.CASE_LAW_SEARCH, new ArrayList<>(), null));

        assertThrows(IllegalArgumentException.class, () -> StageGraph.of(handlers));
    }

    @Test
    void everyDependencyRunsEarlier() {
        for (StageKind kind : StageKind.values()) {
            for (StageKind dependency : kind.dependencies()) {
                assertTrue(dependency.ordinal() < kind.ordinal(), kind + " depends on " + dependency);
            }
        }
        assertTrue(StageKind.DOCUMENT_EXTRACTION.dependencies().isEmpty());
        assertTrue(StageKind.FINAL_PERSIST.isTerminal());
    }

    @Test
    void stageNames() {
        assertEquals("case_law_search", StageKind.CASE_LAW_SEARCH.stageName());
        assertEquals(StageKind.CASE_LAW_SEARCH, StageKind.fromName("case_law_search"));
        assertEquals(1, StageKind.DOCUMENT_EXTRACTION.step());
        assertThrows(IllegalArgumentException.class, () -> StageKind.fromName("unknown_stage"));
    }
}
