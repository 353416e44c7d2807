package caseflow.coordinator.pipeline;

import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.ProcessingErrorRecord;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.coordinator.repository.StageRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one case through every stage in dependency order.
 *
 * <p>
 * Each stage's output is checkpointed as soon as the stage succeeds. The first
 * failing stage stops the run: its record is marked failed, a diagnostic is
 * written and a failed {@link PipelineResult} is returned. Stage errors never
 * propagate past this class.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final int MAX_STACK_TRACE = 8000;

    private final StageGraph graph;
    private final StageRepository stageRepository;
    private final CaseRepository caseRepository;
    private final ObjectMapper mapper;
    private final Clock clock;

    public PipelineOrchestrator(StageGraph graph, StageRepository stageRepository, CaseRepository caseRepository,
            ObjectMapper mapper, Clock clock) {
        this.graph = graph;
        this.stageRepository = stageRepository;
        this.caseRepository = caseRepository;
        this.mapper = mapper;
        this.clock = clock;
    }

    public PipelineResult run(CaseRecord caseRecord) {
        String caseId = caseRecord.id();
        PipelineContext context = new PipelineContext(caseRecord);
        List<StageKind> completed = new ArrayList<>();

        stageRepository.clear(caseId);
        log.info("Starting pipeline for case {} ({} stages)", caseId, graph.size());

        for (StageHandler handler : graph.ordered()) {
            StageKind stage = handler.kind();
            for (StageKind dependency : stage.dependencies()) {
                if (!context.hasOutput(dependency)) {
                    return fail(context, stage, new IllegalStateException(
                            "Dependency " + dependency.stageName() + " has not completed"), completed);
                }
            }

            long started = clock.millis();
            try {
                stageRepository.markRunning(caseId, stage, clock.instant());
                JsonNode output = handler.execute(context);
                if (output == null) {
                    throw new IllegalStateException("Stage produced no output");
                }
                stageRepository.markCompleted(caseId, stage, mapper.writeValueAsString(output), clock.instant());
                context.record(stage, output);
                completed.add(stage);
                log.debug("Case {} stage {}/{} {} done in {}ms",
                        caseId, stage.step(), graph.size(), stage.stageName(), clock.millis() - started);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(context, stage, e, completed);
            } catch (Exception e) {
                return fail(context, stage, e, completed);
            }
        }

        log.info("Pipeline completed for case {}", caseId);
        return PipelineResult.success(caseId, completed);
    }

    private PipelineResult fail(PipelineContext context, StageKind stage, Exception cause, List<StageKind> completed) {
        String caseId = context.caseId();
        String message = stage.stageName() + ": " + describe(cause);
        log.warn("Pipeline failed for case {} at stage {}: {}", caseId, stage.stageName(), describe(cause));

        // Bookkeeping failures are logged; the returned result still carries the stage error
        try {
            stageRepository.markFailed(caseId, stage, message, clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to mark stage {} failed for case {}", stage.stageName(), caseId, e);
        }
        try {
            caseRepository.recordError(new ProcessingErrorRecord(caseId, stage.stageName(),
                    cause.getClass().getSimpleName(), message, stackTrace(cause), clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to record diagnostic for case {}", caseId, e);
        }
        return PipelineResult.failure(caseId, stage, message, completed);
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        String trace = out.toString();
        return trace.length() <= MAX_STACK_TRACE ? trace : trace.substring(0, MAX_STACK_TRACE);
    }

    public StageGraph graph() {
        return graph;
    }
}
