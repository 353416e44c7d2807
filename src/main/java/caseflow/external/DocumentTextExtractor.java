package caseflow.external;

import caseflow.coordinator.model.CaseDocument;

/**
 * Turns a stored document into plain text.
 */
public interface DocumentTextExtractor {

    String extract(CaseDocument document) throws Exception;
}
