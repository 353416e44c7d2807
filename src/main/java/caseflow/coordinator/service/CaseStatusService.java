package caseflow.coordinator.service;

import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.model.StageRecord;
import caseflow.coordinator.model.StageStatus;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.coordinator.repository.StageRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side for case progress: the stored status plus stage progress, and the
 * stored prediction once the case is completed.
 */
public class CaseStatusService {

    private final CaseRepository cases;
    private final StageRepository stages;
    private final ObjectMapper mapper;

    public CaseStatusService(CaseRepository cases, StageRepository stages, ObjectMapper mapper) {
        this.cases = cases;
        this.stages = stages;
        this.mapper = mapper;
    }

    public record CaseStatusView(
            String caseId,
            ProcessingStatus status,
            Instant lastUpdate,
            String error,
            StageKind currentStage,
            int completedStages,
            int totalStages,
            Integer outcomePredictionScore,
            String riskLevel,
            JsonNode results) {
    }

    public Optional<CaseStatusView> status(String caseId) {
        Optional<CaseRecord> found = cases.findById(caseId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CaseRecord c = found.get();
        List<StageRecord> records = stages.findByCase(caseId);

        int completed = (int) records.stream().filter(StageRecord::isCompleted).count();
        StageKind current = records.stream()
                .filter(r -> r.status() == StageStatus.RUNNING || r.status() == StageStatus.FAILED)
                .map(StageRecord::stage)
                .findFirst()
                .orElse(null);

        JsonNode results = null;
        if (c.processingStatus() == ProcessingStatus.COMPLETED) {
            results = cases.findPrediction(caseId).map(this::parse).orElse(null);
        }

        return Optional.of(new CaseStatusView(caseId, c.processingStatus(), c.lastUpdate(),
                c.processingError(), current, completed, StageKind.values().length,
                c.outcomePredictionScore(), c.riskLevel(), results));
    }

    public List<StageRecord> stages(String caseId) {
        return stages.findByCase(caseId);
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (IOException e) {
            throw new IllegalStateException("Stored prediction is not valid JSON", e);
        }
    }
}
