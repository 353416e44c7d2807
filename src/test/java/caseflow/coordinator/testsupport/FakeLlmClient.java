package caseflow.coordinator.testsupport;

import caseflow.external.LlmClient;
import caseflow.external.LlmRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers every completion with one canned object that carries the fields
 * all analysis stages read. Individual calls (1-based) can be made to throw.
 */
public final class FakeLlmClient implements LlmClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode answer;
    private final AtomicInteger calls = new AtomicInteger();
    private final Map<Integer, RuntimeException> failures = new ConcurrentHashMap<>();
    private final List<LlmRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public FakeLlmClient() {
        this.answer = defaultAnswer();
    }

    public static ObjectNode defaultAnswer() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("case_type", "contract_dispute");
        node.putArray("legal_issues").add("breach of contract").add("damages");
        node.put("jurisdiction", "California");
        node.put("is_federal", false);
        node.put("enhanced_summary", "Supplier failed to deliver goods under a signed agreement.");
        node.put("influence_score", 0.7);
        node.put("complexity_score", 40);
        node.put("outcome_prediction_score", 72);
        node.put("settlement_probability", 60);
        node.put("case_strength_score", 70);
        node.put("estimated_timeline", 9);
        node.put("risk_level", "low");
        node.put("prediction_confidence", "high");
        return node;
    }

    /**
     * Make the n-th call (1-based, counted across all stages) throw.
     */
    public FakeLlmClient failOnCall(int n, RuntimeException error) {
        failures.put(n, error);
        return this;
    }

    public ObjectNode answer() {
        return answer;
    }

    @Override
    public JsonNode complete(LlmRequest request) {
        requests.add(request);
        int call = calls.incrementAndGet();
        RuntimeException failure = failures.get(call);
        if (failure != null) {
            throw failure;
        }
        return answer.deepCopy();
    }

    public int calls() {
        return calls.get();
    }

    public List<LlmRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }
}
