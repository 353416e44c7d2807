package caseflow.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of a case as the pipeline sees it.
 * Only the fields the pipeline reads or writes are modelled.
 */
public final class CaseRecord {
    private final String id;
    private final String userId;
    private final String caseName;
    private final String narrative;
    private final String caseType;
    private final String jurisdiction;
    private final String legalIssues; // JSON array
    private final String enhancedSummary;
    private final ProcessingStatus processingStatus;
    private final String processingError;
    private final Integer outcomePredictionScore;
    private final String riskLevel;
    private final boolean aiProcessed;
    private final Instant lastUpdate;
    private final Instant createdAt;

    private CaseRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.userId = Objects.requireNonNull(builder.userId, "userId is required");
        this.caseName = builder.caseName;
        this.narrative = builder.narrative;
        this.caseType = builder.caseType;
        this.jurisdiction = builder.jurisdiction;
        this.legalIssues = builder.legalIssues;
        this.enhancedSummary = builder.enhancedSummary;
        this.processingStatus = Objects.requireNonNull(builder.processingStatus, "processingStatus is required");
        this.processingError = builder.processingError;
        this.outcomePredictionScore = builder.outcomePredictionScore;
        this.riskLevel = builder.riskLevel;
        this.aiProcessed = builder.aiProcessed;
        this.lastUpdate = builder.lastUpdate;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String caseName() {
        return caseName;
    }

    public String narrative() {
        return narrative;
    }

    public String caseType() {
        return caseType;
    }

    public String jurisdiction() {
        return jurisdiction;
    }

    public String legalIssues() {
        return legalIssues;
    }

    public String enhancedSummary() {
        return enhancedSummary;
    }

    public ProcessingStatus processingStatus() {
        return processingStatus;
    }

    public String processingError() {
        return processingError;
    }

    public Integer outcomePredictionScore() {
        return outcomePredictionScore;
    }

    public String riskLevel() {
        return riskLevel;
    }

    public boolean aiProcessed() {
        return aiProcessed;
    }

    public Instant lastUpdate() {
        return lastUpdate;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isFederal() {
        return jurisdiction != null && jurisdiction.toLowerCase().contains("federal");
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .userId(userId)
                .caseName(caseName)
                .narrative(narrative)
                .caseType(caseType)
                .jurisdiction(jurisdiction)
                .legalIssues(legalIssues)
                .enhancedSummary(enhancedSummary)
                .processingStatus(processingStatus)
                .processingError(processingError)
                .outcomePredictionScore(outcomePredictionScore)
                .riskLevel(riskLevel)
                .aiProcessed(aiProcessed)
                .lastUpdate(lastUpdate)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private String caseName;
        private String narrative;
        private String caseType;
        private String jurisdiction;
        private String legalIssues;
        private String enhancedSummary;
        private ProcessingStatus processingStatus = ProcessingStatus.PENDING;
        private String processingError;
        private Integer outcomePredictionScore;
        private String riskLevel;
        private boolean aiProcessed;
        private Instant lastUpdate;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder caseName(String caseName) {
            this.caseName = caseName;
            return this;
        }

        public Builder narrative(String narrative) {
            this.narrative = narrative;
            return this;
        }

        public Builder caseType(String caseType) {
            this.caseType = caseType;
            return this;
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder legalIssues(String legalIssues) {
            this.legalIssues = legalIssues;
            return this;
        }

        public Builder enhancedSummary(String enhancedSummary) {
            this.enhancedSummary = enhancedSummary;
            return this;
        }

        public Builder processingStatus(ProcessingStatus processingStatus) {
            this.processingStatus = processingStatus;
            return this;
        }

        public Builder processingError(String processingError) {
            this.processingError = processingError;
            return this;
        }

        public Builder outcomePredictionScore(Integer outcomePredictionScore) {
            this.outcomePredictionScore = outcomePredictionScore;
            return this;
        }

        public Builder riskLevel(String riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder aiProcessed(boolean aiProcessed) {
            this.aiProcessed = aiProcessed;
            return this;
        }

        public Builder lastUpdate(Instant lastUpdate) {
            this.lastUpdate = lastUpdate;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CaseRecord build() {
            return new CaseRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CaseRecord that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CaseRecord{id='" + id + "', status=" + processingStatus + "}";
    }
}
