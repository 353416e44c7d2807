package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.model.CaseDocument;
import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.ratelimit.ExternalCallExecutor;
import caseflow.coordinator.ratelimit.RateLimitConfig;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.external.DocumentTextExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Extracts text from the case's documents. Already extracted documents are reused.
 * A document that cannot be extracted is recorded on its row and skipped.
 */
public class DocumentExtractionStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(DocumentExtractionStage.class);

    private final CaseRepository cases;
    private final DocumentTextExtractor extractor;
    private final ExternalCallExecutor executor;
    private final ObjectMapper mapper;

    public DocumentExtractionStage(CaseRepository cases, DocumentTextExtractor extractor,
            ExternalCallExecutor executor, ObjectMapper mapper) {
        this.cases = cases;
        this.extractor = extractor;
        this.executor = executor;
        this.mapper = mapper;
    }

    @Override
    public StageKind kind() {
        return StageKind.DOCUMENT_EXTRACTION;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        List<CaseDocument> documents = cases.findDocuments(context.caseId());
        StringBuilder content = new StringBuilder();
        ObjectNode output = mapper.createObjectNode();
        ArrayNode entries = output.putArray("documents");
        int extracted = 0;
        int failed = 0;

        for (CaseDocument document : documents) {
            ObjectNode entry = entries.addObject()
                    .put("id", document.id())
                    .put("fileName", document.fileName());
            String text = document.extractedText();
            if (document.isExtracted()) {
                entry.put("status", "cached");
            } else {
                try {
                    text = executor.call(RateLimitConfig.EXTRACTOR, document.storagePath(),
                            () -> extractor.extract(document));
                    cases.updateDocumentExtraction(document.id(), text, null);
                    entry.put("status", "extracted");
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    log.warn("Extraction failed for document {} of case {}: {}",
                            document.id(), context.caseId(), e.getMessage());
                    cases.updateDocumentExtraction(document.id(), null, e.getMessage());
                    entry.put("status", "failed").put("error", e.getMessage());
                    failed++;
                    continue;
                }
            }
            extracted++;
            content.append("\n\n--- ").append(document.fileName()).append(" ---\n").append(text);
        }

        output.put("extractedContent", content.toString().trim());
        output.put("extractedCount", extracted);
        output.put("failedCount", failed);
        return output;
    }
}
