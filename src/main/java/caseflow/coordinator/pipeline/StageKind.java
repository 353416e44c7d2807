package caseflow.coordinator.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of enrichment stages, in execution order.
 * Each stage declares the stages whose outputs it needs.
 */
public enum StageKind {
    DOCUMENT_EXTRACTION,
    INTAKE_ANALYSIS,
    INTAKE_PERSIST,
    JURISDICTION_ANALYSIS,
    CASE_ENHANCEMENT,
    ENHANCEMENT_PERSIST,
    CASE_LAW_SEARCH,
    OPINION_ANALYSIS,
    PRECEDENT_PERSIST,
    COMPLEXITY_SCORE,
    OUTCOME_PREDICTION,
    SUPPLEMENTARY_ANALYSIS,
    FINAL_PERSIST;

    public Set<StageKind> dependencies() {
        return Collections.unmodifiableSet(switch (this) {
            case DOCUMENT_EXTRACTION -> EnumSet.noneOf(StageKind.class);
            case INTAKE_ANALYSIS -> EnumSet.of(DOCUMENT_EXTRACTION);
            case INTAKE_PERSIST -> EnumSet.of(INTAKE_ANALYSIS);
            case JURISDICTION_ANALYSIS -> EnumSet.of(INTAKE_PERSIST);
            case CASE_ENHANCEMENT -> EnumSet.of(INTAKE_ANALYSIS, JURISDICTION_ANALYSIS);
            case ENHANCEMENT_PERSIST -> EnumSet.of(CASE_ENHANCEMENT);
            case CASE_LAW_SEARCH -> EnumSet.of(INTAKE_ANALYSIS, ENHANCEMENT_PERSIST);
            case OPINION_ANALYSIS -> EnumSet.of(CASE_LAW_SEARCH);
            case PRECEDENT_PERSIST -> EnumSet.of(CASE_LAW_SEARCH, OPINION_ANALYSIS);
            case COMPLEXITY_SCORE -> EnumSet.of(CASE_ENHANCEMENT, PRECEDENT_PERSIST);
            case OUTCOME_PREDICTION -> EnumSet.of(COMPLEXITY_SCORE, OPINION_ANALYSIS);
            case SUPPLEMENTARY_ANALYSIS -> EnumSet.of(COMPLEXITY_SCORE, OUTCOME_PREDICTION);
            case FINAL_PERSIST -> EnumSet.of(OUTCOME_PREDICTION, SUPPLEMENTARY_ANALYSIS);
        });
    }

    /** Stage name as stored and reported, e.g. {@code intake_analysis} */
    @JsonValue
    public String stageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 1-based position in the pipeline */
    public int step() {
        return ordinal() + 1;
    }

    public boolean isTerminal() {
        return this == values()[values().length - 1];
    }

    /**
     * Resolve a stored or configured stage name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static StageKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (StageKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + name);
    }
}
