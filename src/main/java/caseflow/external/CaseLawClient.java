package caseflow.external;

import caseflow.coordinator.model.PrecedentCase;

import java.util.List;

/**
 * Searches published opinions.
 */
public interface CaseLawClient {

    List<PrecedentCase> search(String query, int limit) throws Exception;
}
