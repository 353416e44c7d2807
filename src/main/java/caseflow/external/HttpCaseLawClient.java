package caseflow.external;

import caseflow.coordinator.model.PrecedentCase;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Opinion search over a REST search endpoint ({@code /search/?q=...&type=o}).
 */
public class HttpCaseLawClient implements CaseLawClient {

    static final String SOURCE = "caselaw";

    private final JsonHttpClient http;
    private final String baseUrl;
    private final String apiKey;

    public HttpCaseLawClient(JsonHttpClient http, String baseUrl, String apiKey) {
        this.http = http;
        this.baseUrl = HttpLlmClient.stripSlash(baseUrl);
        this.apiKey = apiKey;
    }

    @Override
    public List<PrecedentCase> search(String query, int limit) throws Exception {
        URI uri = URI.create(baseUrl + "/search/?type=o&order_by=score%20desc&q="
                + URLEncoder.encode(query, StandardCharsets.UTF_8));
        JsonNode response = http.get(uri, Map.of("Authorization", "Token " + apiKey));

        List<PrecedentCase> results = new ArrayList<>();
        for (JsonNode hit : response.path("results")) {
            if (results.size() >= limit) {
                break;
            }
            results.add(toPrecedent(hit));
        }
        return results;
    }

    static PrecedentCase toPrecedent(JsonNode hit) {
        JsonNode citation = hit.path("citation");
        String cite = citation.isArray() && citation.size() > 0 ? citation.get(0).asText() : citation.asText(null);
        return new PrecedentCase(
                hit.path("id").asText(null),
                hit.path("caseName").asText(null),
                cite,
                hit.path("court").asText(null),
                hit.path("court_id").asText(null),
                hit.path("status").asText(null),
                hit.path("snippet").asText(null),
                hit.path("score").asDouble(0.0),
                SOURCE);
    }
}
