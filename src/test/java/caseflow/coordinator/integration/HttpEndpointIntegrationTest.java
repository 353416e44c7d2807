package caseflow.coordinator.integration;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.config.Dependencies;
import caseflow.coordinator.config.ExternalClients;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.server.CoordinatorNettyServer;
import caseflow.coordinator.service.SignatureVerifier;
import caseflow.coordinator.testsupport.FakeCaseLawClient;
import caseflow.coordinator.testsupport.FakeExtractor;
import caseflow.coordinator.testsupport.FakeLlmClient;
import caseflow.coordinator.testsupport.TestDatabases;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints of a running server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;
    private static final String WEBHOOK_SECRET = "whsec-test";
    private static final String SERVICE_NAME = "caseflow-backend";
    private static final String SERVICE_SECRET = "svc-secret";

    private Dependencies deps;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        // Stop any existing server instance
        if (CoordinatorNettyServer.isRunning()) {
            CoordinatorNettyServer.stop();
        }

        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.memUrl("test-http"))
                .withWebhookSecret(WEBHOOK_SECRET)
                .withServiceCredentials(SERVICE_NAME, SERVICE_SECRET)
                .withMinCallDelay(Duration.ZERO)
                .withMaxAttempts(3);
        deps = Dependencies.create(config,
                new ExternalClients(new FakeLlmClient(), new FakeCaseLawClient(), new FakeExtractor()));

        assertTrue(CoordinatorNettyServer.start(TEST_PORT, deps));

        // Wait for server to be ready
        TimeUnit.MILLISECONDS.sleep(200);

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        CoordinatorNettyServer.stop();
        if (deps != null)
            deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + path))
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> postInternal(String path, String body) throws Exception {
        return post(path, body, "X-Internal-Service", SERVICE_NAME, "X-Service-Secret", SERVICE_SECRET);
    }

    private HttpResponse<String> postSigned(String body) throws Exception {
        String signature = new SignatureVerifier(WEBHOOK_SECRET).sign(body.getBytes(StandardCharsets.UTF_8));
        return post("/api/v1/webhooks/cases", body, "X-Webhook-Signature", "sha256=" + signature);
    }

    private static String caseInsert(String caseId) {
        return """
                {"type": "INSERT", "table": "cases", "schema": "public",
                 "record": {"id": "%s", "user_id": "u1", "case_name": "Acme v. Widget",
                            "case_narrative": "Goods never arrived."}}
                """.formatted(caseId);
    }

    @Test
    @DisplayName("Health reports database and queue counts")
    void health() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals(0, body.get("pendingJobs").asInt());
    }

    @Test
    @DisplayName("Unsigned or mis-signed first-party events are refused")
    void webhookSignatureRequired() throws Exception {
        HttpResponse<String> unsigned = post("/api/v1/webhooks/cases", caseInsert("c1"));
        assertEquals(401, unsigned.statusCode(), unsigned.body());

        HttpResponse<String> wrong = post("/api/v1/webhooks/cases", caseInsert("c1"),
                "X-Webhook-Signature", "sha256=" + "0".repeat(64));
        assertEquals(401, wrong.statusCode(), wrong.body());

        assertTrue(deps.caseRepository().findById("c1").isEmpty());
    }

    @Test
    @DisplayName("Signed case event is stored, queued and processed by a worker tick")
    void signedEventThroughTick() throws Exception {
        HttpResponse<String> accepted = postSigned(caseInsert("c1"));

        assertEquals(200, accepted.statusCode(), accepted.body());
        JsonNode webhook = MAPPER.readTree(accepted.body());
        assertTrue(webhook.get("success").asBoolean());
        assertEquals("enqueued", webhook.get("outcome").asText());
        String jobId = webhook.get("jobId").asText();

        JsonNode pending = MAPPER.readTree(get("/api/v1/cases/c1/status").body());
        assertEquals("pending", pending.get("status").asText());

        HttpResponse<String> tick = postInternal("/internal/v1/worker/tick", "");
        assertEquals(200, tick.statusCode(), tick.body());
        JsonNode tickBody = MAPPER.readTree(tick.body());
        assertTrue(tickBody.get("processed").asBoolean());
        assertEquals(jobId, tickBody.get("jobId").asText());
        assertTrue(tickBody.get("succeeded").asBoolean(), tick.body());

        JsonNode status = MAPPER.readTree(get("/api/v1/cases/c1/status").body());
        assertEquals("completed", status.get("status").asText());
        assertEquals(72, status.get("outcomePredictionScore").asInt());
        assertEquals(status.get("totalStages").asInt(), status.get("completedStages").asInt());

        JsonNode stages = MAPPER.readTree(get("/api/v1/cases/c1/stages").body());
        assertTrue(stages.isArray());
        assertEquals(status.get("totalStages").asInt(), stages.size());

        JsonNode idle = MAPPER.readTree(postInternal("/internal/v1/worker/tick", "").body());
        assertFalse(idle.get("processed").asBoolean());
        assertEquals("no_eligible_job", idle.get("reason").asText());
    }

    @Test
    @DisplayName("Malformed external events are rejected with 400")
    void externalValidation() throws Exception {
        HttpResponse<String> badTable = post("/api/v1/webhooks/external/cases", """
                {"type": "INSERT", "table": "users", "record": {"id": "x"}}
                """);
        assertEquals(400, badTable.statusCode(), badTable.body());

        HttpResponse<String> notJson = post("/api/v1/webhooks/external/cases", "{not json");
        assertEquals(400, notJson.statusCode(), notJson.body());

        HttpResponse<String> ok = post("/api/v1/webhooks/external/cases", caseInsert("c2"));
        assertEquals(200, ok.statusCode(), ok.body());
        assertEquals("enqueued", MAPPER.readTree(ok.body()).get("outcome").asText());
    }

    @Test
    @DisplayName("Unknown cases and routes are 404")
    void notFound() throws Exception {
        assertEquals(404, get("/api/v1/cases/missing/status").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
        assertEquals(404, postInternal("/api/v1/cases/missing/process", "").statusCode());
    }

    @Test
    @DisplayName("Internal endpoints require service credentials")
    void serviceAuth() throws Exception {
        assertEquals(401, post("/internal/v1/worker/tick", "").statusCode());
        HttpResponse<String> wrongSecret = post("/internal/v1/worker/tick", "",
                "X-Internal-Service", SERVICE_NAME, "X-Service-Secret", "wrong");
        assertEquals(401, wrongSecret.statusCode(), wrongSecret.body());
        assertEquals("Invalid service credentials", MAPPER.readTree(wrongSecret.body()).get("error").asText());
        assertEquals(401, post("/internal/v1/worker/tick", "",
                "X-Internal-Service", "someone-else", "X-Service-Secret", SERVICE_SECRET).statusCode());
        assertEquals(401, post("/api/v1/cases/c1/process", "").statusCode());

        HttpResponse<String> stats = httpClient.send(HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + "/internal/v1/queues/case-processing/stats"))
                .header("X-Internal-Service", SERVICE_NAME)
                .header("X-Service-Secret", SERVICE_SECRET)
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, stats.statusCode(), stats.body());
    }

    @Test
    @DisplayName("Manual reprocess is accepted, or refused while the case is processing")
    void reprocess() throws Exception {
        postSigned(caseInsert("c1"));
        deps.caseRepository().updateStatus("c1", ProcessingStatus.PENDING, ProcessingStatus.FAILED, "boom", Instant.now());

        HttpResponse<String> accepted = postInternal("/api/v1/cases/c1/process", "");
        assertEquals(202, accepted.statusCode(), accepted.body());
        assertEquals("enqueued", MAPPER.readTree(accepted.body()).get("outcome").asText());

        deps.caseRepository().updateStatus("c1", ProcessingStatus.PENDING, ProcessingStatus.PROCESSING, null, Instant.now());
        HttpResponse<String> conflict = postInternal("/api/v1/cases/c1/process", "");
        assertEquals(409, conflict.statusCode(), conflict.body());
        assertEquals("conflict", MAPPER.readTree(conflict.body()).get("outcome").asText());
    }
}
