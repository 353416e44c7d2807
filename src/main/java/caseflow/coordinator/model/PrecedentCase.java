package caseflow.coordinator.model;

/**
 * A prior decision found by the case-law search and kept as a precedent for a case.
 */
public record PrecedentCase(
        String externalId,
        String caseName,
        String citation,
        String court,
        String jurisdiction,
        String outcome,
        String summary,
        double similarityScore,
        String source) {
}
