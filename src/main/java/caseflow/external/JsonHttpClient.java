package caseflow.external;

import caseflow.coordinator.error.ExternalServiceException;
import caseflow.coordinator.error.TransientExternalException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Small JSON-over-HTTP helper shared by the outbound clients.
 * Maps transport failures, timeouts, 429 and 5xx to {@link TransientExternalException};
 * any other non-2xx status is a permanent {@link ExternalServiceException}.
 */
public class JsonHttpClient {

    private final String resource;
    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public JsonHttpClient(String resource, ObjectMapper mapper, Duration timeout) {
        this(resource, HttpClient.newBuilder().connectTimeout(timeout).build(), mapper, timeout);
    }

    public JsonHttpClient(String resource, HttpClient http, ObjectMapper mapper, Duration timeout) {
        this.resource = resource;
        this.http = http;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    public JsonNode post(URI uri, Map<String, String> headers, Object body) throws InterruptedException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new ExternalServiceException(resource, "Failed to serialize request", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        headers.forEach(builder::header);
        return send(builder.build());
    }

    public JsonNode get(URI uri, Map<String, String> headers) throws InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);
        return send(builder.build());
    }

    private JsonNode send(HttpRequest request) throws InterruptedException {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientExternalException(resource, "Request timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientExternalException(resource, "Request failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientExternalException(resource, "HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new ExternalServiceException(resource, status, "HTTP " + status + ": " + abbreviate(response.body()));
        }

        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ExternalServiceException(resource, "Malformed JSON response", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    public String resource() {
        return resource;
    }
}
