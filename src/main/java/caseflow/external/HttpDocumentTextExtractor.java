package caseflow.external;

import caseflow.coordinator.error.ExternalServiceException;
import caseflow.coordinator.model.CaseDocument;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls an extraction service with the document's storage path and reads back {@code text}.
 */
public class HttpDocumentTextExtractor implements DocumentTextExtractor {

    private final JsonHttpClient http;
    private final URI endpoint;
    private final String apiKey;

    public HttpDocumentTextExtractor(JsonHttpClient http, String baseUrl, String apiKey) {
        this.http = http;
        this.endpoint = URI.create(HttpLlmClient.stripSlash(baseUrl) + "/extract");
        this.apiKey = apiKey;
    }

    @Override
    public String extract(CaseDocument document) throws Exception {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("path", document.storagePath());
        body.put("fileName", document.fileName());
        body.put("fileType", document.fileType());

        JsonNode response = http.post(endpoint, Map.of("Authorization", "Bearer " + apiKey), body);
        JsonNode text = response.get("text");
        if (text == null || text.isNull()) {
            throw new ExternalServiceException(http.resource(), "No text extracted from " + document.fileName(), null);
        }
        return text.asText();
    }
}
