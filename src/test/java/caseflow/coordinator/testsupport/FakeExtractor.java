package caseflow.coordinator.testsupport;

import caseflow.coordinator.model.CaseDocument;
import caseflow.external.DocumentTextExtractor;

/**
 * Extracts a fixed text; documents whose file name contains "corrupt" fail.
 */
public final class FakeExtractor implements DocumentTextExtractor {

    @Override
    public String extract(CaseDocument document) {
        if (document.fileName() != null && document.fileName().contains("corrupt")) {
            throw new IllegalArgumentException("Unreadable document " + document.fileName());
        }
        return "Text of " + document.fileName();
    }
}
