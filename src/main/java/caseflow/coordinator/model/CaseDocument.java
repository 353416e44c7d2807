package caseflow.coordinator.model;

/**
 * Document attached to a case. extractedText is null until extraction succeeded.
 */
public record CaseDocument(
        String id,
        String caseId,
        String fileName,
        String fileType,
        String storagePath,
        String extractedText,
        String extractionError) {

    public boolean isExtracted() {
        return extractedText != null;
    }
}
