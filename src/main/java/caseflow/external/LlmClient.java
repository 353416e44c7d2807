package caseflow.external;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Completion client that returns the model's answer parsed as a JSON object.
 */
public interface LlmClient {

    JsonNode complete(LlmRequest request) throws Exception;
}
