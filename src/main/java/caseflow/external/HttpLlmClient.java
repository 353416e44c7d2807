package caseflow.external;

import caseflow.coordinator.error.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Chat-completions client that asks for a JSON object response.
 */
public class HttpLlmClient implements LlmClient {

    private final JsonHttpClient http;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String apiKey;

    public HttpLlmClient(JsonHttpClient http, ObjectMapper mapper, String baseUrl, String apiKey) {
        this.http = http;
        this.mapper = mapper;
        this.endpoint = URI.create(stripSlash(baseUrl) + "/chat/completions");
        this.apiKey = apiKey;
    }

    @Override
    public JsonNode complete(LlmRequest request) throws Exception {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", request.model());
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        body.putObject("response_format").put("type", "json_object");
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", request.systemPrompt());
        messages.addObject().put("role", "user").put("content", request.userPrompt());

        JsonNode response = http.post(endpoint, Map.of("Authorization", "Bearer " + apiKey), body);
        String content = response.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new ExternalServiceException(http.resource(), "Empty completion from " + request.model(), null);
        }
        try {
            JsonNode parsed = mapper.readTree(content);
            if (!parsed.isObject()) {
                throw new ExternalServiceException(http.resource(), "Completion is not a JSON object", null);
            }
            return parsed;
        } catch (IOException e) {
            throw new ExternalServiceException(http.resource(), "Completion is not valid JSON", e);
        }
    }

    static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
