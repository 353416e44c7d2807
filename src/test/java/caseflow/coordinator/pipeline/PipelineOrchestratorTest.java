package caseflow.coordinator.pipeline;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.error.TransientExternalException;
import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.ProcessingErrorRecord;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.model.StageRecord;
import caseflow.coordinator.model.StageStatus;
import caseflow.coordinator.store.Database;
import caseflow.coordinator.store.JdbcCaseRepository;
import caseflow.coordinator.store.JdbcStageRepository;
import caseflow.coordinator.testsupport.MutableClock;
import caseflow.coordinator.testsupport.TestDatabases;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Database db;
    private static JdbcStageRepository stages;
    private static JdbcCaseRepository cases;

    private MutableClock clock;
    private List<StageKind> invocations;
    private CaseRecord caseRecord;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("test-orchestrator")));
        stages = new JdbcStageRepository(db);
        cases = new JdbcCaseRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clear(db, "case_stages", "processing_errors", "cases");
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        invocations = new CopyOnWriteArrayList<>();
        caseRecord = CaseRecord.builder().id("c1").userId("u1").processingStatus(ProcessingStatus.PROCESSING).build();
        cases.upsert(caseRecord);
    }

    private PipelineOrchestrator orchestrator(StageKind failing, Exception failure) {
        return new PipelineOrchestrator(RecordingStage.graph(invocations, failing, failure), stages, cases, MAPPER,
                clock);
    }

    @Test
    void successfulRunCheckpointsEveryStage() {
        PipelineResult result = orchestrator(null, null).run(caseRecord);

        assertTrue(result.succeeded());
        assertEquals(Arrays.asList(StageKind.values()), invocations);
        assertEquals(Arrays.asList(StageKind.values()), result.completedStages());

        List<StageRecord> records = stages.findByCase("c1");
        assertEquals(StageKind.values().length, records.size());
        for (StageRecord record : records) {
            assertEquals(StageStatus.COMPLETED, record.status());
            assertEquals("{\"stage\":\"" + record.stage().stageName() + "\"}", record.output());
        }
    }

    @Test
    void failureStopsAtTheFailingStage() {
        StageKind failing = StageKind.CASE_LAW_SEARCH;
        PipelineResult result = orchestrator(failing, new TransientExternalException("caselaw", "HTTP 503"))
                .run(caseRecord);

        assertFalse(result.succeeded());
        assertEquals(failing, result.failedStage());
        assertEquals("case_law_search: HTTP 503", result.error());
        assertEquals(failing.ordinal() + 1, invocations.size());
        assertEquals(failing.ordinal(), result.completedStages().size());

        StageRecord failed = stages.find("c1", failing).orElseThrow();
        assertEquals(StageStatus.FAILED, failed.status());
        assertEquals("case_law_search: HTTP 503", failed.error());
        assertTrue(stages.find("c1", StageKind.OPINION_ANALYSIS).isEmpty());
        assertTrue(stages.find("c1", StageKind.ENHANCEMENT_PERSIST).orElseThrow().isCompleted());
    }

    @Test
    void failureRecordsDiagnostic() {
        orchestrator(StageKind.INTAKE_ANALYSIS, new IllegalStateException("model returned prose")).run(caseRecord);

        List<ProcessingErrorRecord> errors = cases.findErrors("c1");
        assertEquals(1, errors.size());
        assertEquals("intake_analysis", errors.get(0).stage());
        assertEquals("IllegalStateException", errors.get(0).errorType());
        assertEquals("intake_analysis: model returned prose", errors.get(0).message());
        assertTrue(errors.get(0).stackTrace().contains("IllegalStateException"));
    }

    @Test
    void rerunStartsFromScratch() {
        orchestrator(StageKind.COMPLEXITY_SCORE, new IllegalStateException("boom")).run(caseRecord);
        assertEquals(StageStatus.FAILED, stages.find("c1", StageKind.COMPLEXITY_SCORE).orElseThrow().status());

        invocations.clear();
        PipelineResult rerun = orchestrator(null, null).run(caseRecord);

        assertTrue(rerun.succeeded());
        assertEquals(StageKind.DOCUMENT_EXTRACTION, invocations.get(0));
        assertEquals(StageStatus.COMPLETED, stages.find("c1", StageKind.COMPLEXITY_SCORE).orElseThrow().status());
    }

    @Test
    void stageBookkeepingFailureBecomesAStageFailure() {
        StageKind broken = StageKind.CASE_LAW_SEARCH;
        JdbcStageRepository unwritable = new JdbcStageRepository(db) {
            @Override
            public void markRunning(String caseId, StageKind stage, Instant now) {
                if (stage == broken) {
                    throw new RuntimeException("Failed to write stage " + stage.stageName());
                }
                super.markRunning(caseId, stage, now);
            }
        };
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(RecordingStage.graph(invocations, null, null),
                unwritable, cases, MAPPER, clock);

        PipelineResult result = assertDoesNotThrow(() -> orchestrator.run(caseRecord));

        assertFalse(result.succeeded());
        assertEquals(broken, result.failedStage());
        assertEquals("case_law_search: Failed to write stage case_law_search", result.error());
        assertFalse(invocations.contains(broken));
        assertEquals(StageStatus.FAILED, stages.find("c1", broken).orElseThrow().status());

        List<ProcessingErrorRecord> errors = cases.findErrors("c1");
        assertEquals(1, errors.size());
        assertEquals("case_law_search", errors.get(0).stage());
    }

    @Test
    void failedStageIsReportedEvenWhenItsRowCannotBeWritten() {
        JdbcStageRepository unwritable = new JdbcStageRepository(db) {
            @Override
            public void markFailed(String caseId, StageKind stage, String error, Instant now) {
                throw new RuntimeException("Failed to write stage " + stage.stageName());
            }
        };
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                RecordingStage.graph(invocations, StageKind.COMPLEXITY_SCORE, new IllegalStateException("boom")),
                unwritable, cases, MAPPER, clock);

        PipelineResult result = assertDoesNotThrow(() -> orchestrator.run(caseRecord));

        assertEquals(StageKind.COMPLEXITY_SCORE, result.failedStage());
        assertEquals("complexity_score: boom", result.error());
        assertEquals(1, cases.findErrors("c1").size());
    }

    @Test
    void describeUsesTypeWhenMessageIsMissing() {
        assertEquals("NullPointerException", PipelineOrchestrator.describe(new NullPointerException()));
    }
}
