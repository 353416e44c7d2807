package caseflow.coordinator.service;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.error.PermanentValidationException;
import caseflow.coordinator.model.CaseDocument;
import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.ChangeEvent;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.notify.CaseStatusNotifier;
import caseflow.coordinator.repository.CaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns inbound change events into stored rows and queued pipeline work.
 * Every event is written to the inbound event log with its outcome.
 */
public class CaseIntakeService {

    private static final Logger log = LoggerFactory.getLogger(CaseIntakeService.class);

    public static final String SOURCE_FIRST_PARTY = "webhook";
    public static final String SOURCE_EXTERNAL = "external";
    public static final String SOURCE_MANUAL = "manual";

    private final CaseRepository cases;
    private final JobQueueService queue;
    private final CaseStatusNotifier notifier;
    private final CoordinatorConfig config;

    public CaseIntakeService(CaseRepository cases, JobQueueService queue, CaseStatusNotifier notifier,
            CoordinatorConfig config) {
        this.cases = cases;
        this.queue = queue;
        this.notifier = notifier;
        this.config = config;
    }

    /**
     * Handle an event whose signature was already verified.
     * Unsupported tables and types are accepted and ignored.
     */
    public IntakeResult acceptFirstParty(ChangeEvent event) {
        try {
            event.validateBasics();
        } catch (PermanentValidationException e) {
            recordRejected(event, SOURCE_FIRST_PARTY);
            throw e;
        }
        return route(event, SOURCE_FIRST_PARTY);
    }

    /**
     * Handle an event from outside the platform.
     *
     * @throws PermanentValidationException if the event is structurally invalid; nothing is enqueued
     */
    public IntakeResult acceptExternal(ChangeEvent event) {
        try {
            event.validateStructure();
        } catch (PermanentValidationException e) {
            log.warn("Rejected external event: {}", e.getMessage());
            recordRejected(event, SOURCE_EXTERNAL);
            throw e;
        }
        return route(event, SOURCE_EXTERNAL);
    }

    private IntakeResult route(ChangeEvent event, String source) {
        IntakeResult result;
        try {
            if (!event.isUpsert()) {
                result = IntakeResult.ignored(event.recordId(), event.type() + " on " + event.table() + " needs no work");
            } else if (event.isCaseTable()) {
                result = upsertCase(event, source);
            } else if (event.isDocumentTable()) {
                result = upsertDocument(event);
            } else {
                result = IntakeResult.ignored(event.recordId(), "Table " + event.table() + " is not processed");
            }
        } catch (PermanentValidationException e) {
            recordRejected(event, source);
            throw e;
        }

        cases.recordWebhookEvent(event.type(), event.table(), event.recordId(), source, result.outcome());
        log.info("{} {} event on {} for {}: {}", source, event.type(), event.table(), event.recordId(),
                result.outcome());
        return result;
    }

    private IntakeResult upsertCase(ChangeEvent event, String source) {
        String caseId = require(event, "id");
        String userId = require(event, "user_id");

        cases.upsert(CaseRecord.builder()
                .id(caseId)
                .userId(userId)
                .caseName(event.text("case_name"))
                .narrative(event.text("case_narrative"))
                .caseType(event.text("case_type"))
                .jurisdiction(event.text("jurisdiction"))
                .processingStatus(ProcessingStatus.PENDING)
                .build());

        String jobId = queue.enqueue(config.caseQueue(), payload(caseId, userId, event.type(), source));
        return IntakeResult.enqueued(caseId, jobId);
    }

    private IntakeResult upsertDocument(ChangeEvent event) {
        String documentId = require(event, "id");
        String caseId = require(event, "case_id");
        String path = event.text("file_path") != null ? event.text("file_path") : event.text("storage_path");

        cases.upsertDocument(new CaseDocument(documentId, caseId, event.text("file_name"),
                event.text("file_type"), path, null, null));
        return IntakeResult.stored(caseId, "Document " + documentId + " stored");
    }

    /**
     * Start a fresh run for an existing case.
     *
     * @return a conflict result if the case is being processed right now
     * @throws IllegalArgumentException if the case does not exist
     */
    public IntakeResult reprocess(String caseId) {
        CaseRecord existing = cases.findById(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Case not found: " + caseId));
        if (!notifier.resetForReprocess(caseId)) {
            return IntakeResult.conflict(caseId, "Case is already processing");
        }
        String jobId = queue.enqueue(config.caseQueue(), payload(caseId, existing.userId(), "REPROCESS", SOURCE_MANUAL));
        cases.recordWebhookEvent("REPROCESS", ChangeEvent.CASES, caseId, SOURCE_MANUAL, IntakeResult.ENQUEUED);
        return IntakeResult.enqueued(caseId, jobId);
    }

    private void recordRejected(ChangeEvent event, String source) {
        cases.recordWebhookEvent(event.type(), event.table(), event.recordId(), source, "rejected");
    }

    private static String require(ChangeEvent event, String field) {
        String value = event.text(field);
        if (value == null) {
            throw new PermanentValidationException("record." + field + " is required");
        }
        return value;
    }

    static Map<String, String> payload(String caseId, String userId, String webhookType, String source) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("caseId", caseId);
        payload.put("userId", userId);
        payload.put("webhookType", webhookType);
        payload.put("source", source);
        return payload;
    }
}
