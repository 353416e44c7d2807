package caseflow.coordinator.service;

import caseflow.coordinator.error.PipelineStageException;
import caseflow.coordinator.model.BatchResult;
import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.notify.CaseStatusNotifier;
import caseflow.coordinator.pipeline.PipelineOrchestrator;
import caseflow.coordinator.pipeline.PipelineResult;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.coordinator.scheduler.LeaseExpiryListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Processes case jobs: one claimed job per tick, or a bounded batch.
 *
 * <p>
 * A run moves the case to processing, runs the pipeline and moves the case to
 * completed or failed. A failed run fails the job, so queue retries re-run the
 * whole pipeline.
 */
public class CaseProcessingWorker implements JobHandler, LeaseExpiryListener {

    private static final Logger log = LoggerFactory.getLogger(CaseProcessingWorker.class);

    private final JobQueueService queue;
    private final CaseRepository cases;
    private final PipelineOrchestrator orchestrator;
    private final CaseStatusNotifier notifier;
    private final ObjectMapper mapper;

    public CaseProcessingWorker(JobQueueService queue, CaseRepository cases, PipelineOrchestrator orchestrator,
            CaseStatusNotifier notifier, ObjectMapper mapper) {
        this.queue = queue;
        this.cases = cases;
        this.orchestrator = orchestrator;
        this.notifier = notifier;
        this.mapper = mapper;
    }

    /**
     * Claim and process at most one job.
     */
    public WorkerOutcome tick(String queueName) {
        Optional<Job> claimed = queue.claimNext(queueName);
        if (claimed.isEmpty()) {
            log.debug("No eligible job on {}", queueName);
            return WorkerOutcome.noEligibleJob();
        }
        return process(claimed.get());
    }

    public BatchResult batch(String queueName, int batchSize) {
        return queue.claimBatch(queueName, batchSize, this);
    }

    WorkerOutcome process(Job job) {
        try {
            String result = handle(job);
            queue.complete(job.id(), result);
            return WorkerOutcome.succeeded(job.id());
        } catch (Exception e) {
            String error = JobQueueService.describe(e);
            queue.fail(job.id(), error);
            return WorkerOutcome.failed(job.id(), error);
        }
    }

    @Override
    public String handle(Job job) throws Exception {
        String caseId = caseIdOf(job);
        PipelineResult result = runPipeline(caseId);
        if (!result.succeeded()) {
            throw new PipelineStageException(result.failedStage(), result.error());
        }

        ObjectNode summary = mapper.createObjectNode();
        summary.put("caseId", caseId);
        summary.put("completedStages", result.completedStages().size());
        return mapper.writeValueAsString(summary);
    }

    /**
     * Run one case through the pipeline without the queue.
     */
    public PipelineResult runSynchronously(String caseId) {
        return runPipeline(caseId);
    }

    private PipelineResult runPipeline(String caseId) {
        notifier.transition(caseId, ProcessingStatus.PROCESSING, null);
        CaseRecord caseRecord = cases.findById(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Case not found: " + caseId));

        PipelineResult result;
        try {
            result = orchestrator.run(caseRecord);
        } catch (RuntimeException e) {
            // Failure outside any stage; do not leave the case in processing
            markFailed(caseId, "Pipeline error: " + JobQueueService.describe(e), e);
            throw e;
        }

        if (result.succeeded()) {
            notifier.transition(caseId, ProcessingStatus.COMPLETED, null);
        } else {
            notifier.transition(caseId, ProcessingStatus.FAILED, result.error());
        }
        return result;
    }

    /**
     * A job's lease expired: its run was abandoned, so the case is no longer processing.
     */
    @Override
    public void onLeaseExpired(Job job) {
        String caseId;
        try {
            caseId = caseIdOf(job);
        } catch (IllegalArgumentException e) {
            log.warn("Expired job {} carries no case id", job.id());
            return;
        }
        Optional<CaseRecord> caseRecord = cases.findById(caseId);
        if (caseRecord.isPresent() && caseRecord.get().processingStatus() == ProcessingStatus.PROCESSING) {
            notifier.transition(caseId, ProcessingStatus.FAILED, "Processing interrupted: lease expired");
        }
    }

    private void markFailed(String caseId, String error, RuntimeException cause) {
        try {
            notifier.transition(caseId, ProcessingStatus.FAILED, error);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    String caseIdOf(Job job) {
        JsonNode data;
        try {
            data = mapper.readTree(job.data());
        } catch (IOException e) {
            throw new IllegalArgumentException("Job " + job.id() + " has malformed data", e);
        }
        String caseId = data == null ? null : data.path("caseId").asText(null);
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("Job " + job.id() + " has no caseId");
        }
        return caseId;
    }
}
