package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.error.PipelineStageException;
import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.PrecedentCase;
import caseflow.coordinator.pipeline.FanOut;
import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageHandler;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.ratelimit.ExternalCallExecutor;
import caseflow.coordinator.ratelimit.RateLimitConfig;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.external.CaseLawClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Looks for precedents three ways at once: external search by legal issues,
 * external search by case type and jurisdiction, and similar internal cases.
 * The stage succeeds as long as one search returned at least one precedent;
 * failed searches are listed in the output.
 */
public class CaseLawSearchStage implements StageHandler {

    static final int RESULTS_PER_SEARCH = 10;
    static final int MAX_PRECEDENTS = 20;
    static final String INTERNAL_SOURCE = "internal";

    private final CaseLawClient caseLaw;
    private final CaseRepository cases;
    private final ExternalCallExecutor executor;
    private final FanOut fanOut;
    private final ObjectMapper mapper;

    public CaseLawSearchStage(CaseLawClient caseLaw, CaseRepository cases, ExternalCallExecutor executor,
            FanOut fanOut, ObjectMapper mapper) {
        this.caseLaw = caseLaw;
        this.cases = cases;
        this.executor = executor;
        this.fanOut = fanOut;
        this.mapper = mapper;
    }

    @Override
    public StageKind kind() {
        return StageKind.CASE_LAW_SEARCH;
    }

    @Override
    public JsonNode execute(PipelineContext context) throws Exception {
        CaseRecord caseRecord = context.caseRecord();
        String issuesQuery = issuesQuery(context.output(StageKind.INTAKE_ANALYSIS));
        String jurisdictionQuery = join(caseRecord.caseType(), caseRecord.jurisdiction());

        Map<String, Callable<List<PrecedentCase>>> searches = new LinkedHashMap<>();
        searches.put("issues", () -> external(issuesQuery));
        searches.put("jurisdiction", () -> external(jurisdictionQuery));
        searches.put(INTERNAL_SOURCE, () -> internal(caseRecord));

        List<FanOut.Branch<List<PrecedentCase>>> branches = fanOut.runAll(searches);

        Map<String, PrecedentCase> merged = new LinkedHashMap<>();
        ObjectNode output = mapper.createObjectNode();
        ObjectNode counts = output.putObject("sources");
        ArrayNode failures = output.putArray("failedSearches");
        for (FanOut.Branch<List<PrecedentCase>> branch : branches) {
            if (!branch.succeeded()) {
                failures.addObject().put("search", branch.name()).put("error", branch.error().getMessage());
                continue;
            }
            counts.put(branch.name(), branch.value().size());
            for (PrecedentCase precedent : branch.value()) {
                merged.putIfAbsent(precedent.source() + ":" + precedent.externalId(), precedent);
            }
        }
        if (merged.isEmpty()) {
            throw noPrecedents(branches);
        }

        List<PrecedentCase> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator.comparingDouble(PrecedentCase::similarityScore).reversed());
        if (ranked.size() > MAX_PRECEDENTS) {
            ranked = ranked.subList(0, MAX_PRECEDENTS);
        }
        output.set("precedents", mapper.valueToTree(ranked));
        output.put("totalFound", merged.size());
        return output;
    }

    private PipelineStageException noPrecedents(List<FanOut.Branch<List<PrecedentCase>>> branches) {
        Throwable firstError = branches.stream()
                .filter(b -> !b.succeeded())
                .map(FanOut.Branch::error)
                .findFirst().orElse(null);
        if (firstError == null) {
            return new PipelineStageException(kind(), "No precedents found by any search");
        }
        long failed = branches.stream().filter(b -> !b.succeeded()).count();
        String message = failed == branches.size()
                ? "All case-law searches failed: " + firstError.getMessage()
                : "No precedents found; " + failed + " of " + branches.size() + " searches failed: "
                        + firstError.getMessage();
        return new PipelineStageException(kind(), message, firstError);
    }

    private List<PrecedentCase> external(String query) throws Exception {
        if (query.isBlank()) {
            return List.of();
        }
        return executor.call(RateLimitConfig.CASE_LAW, query, () -> caseLaw.search(query, RESULTS_PER_SEARCH));
    }

    private List<PrecedentCase> internal(CaseRecord caseRecord) {
        List<PrecedentCase> similar = new ArrayList<>();
        for (CaseRecord other : cases.findSimilar(caseRecord.id(), caseRecord.caseType(),
                caseRecord.jurisdiction(), RESULTS_PER_SEARCH)) {
            boolean sameType = Objects.equals(other.caseType(), caseRecord.caseType());
            boolean sameJurisdiction = Objects.equals(other.jurisdiction(), caseRecord.jurisdiction());
            double score = sameType && sameJurisdiction ? 1.0 : 0.5;
            similar.add(new PrecedentCase(other.id(), other.caseName(), null, null, other.jurisdiction(),
                    other.riskLevel(), other.enhancedSummary(), score, INTERNAL_SOURCE));
        }
        return similar;
    }

    static String issuesQuery(JsonNode intake) {
        List<String> issues = new ArrayList<>();
        for (JsonNode issue : intake.path("legal_issues")) {
            if (issue.isTextual() && !issue.asText().isBlank()) {
                issues.add(issue.asText().trim());
            }
        }
        return String.join(" ", issues);
    }

    private static String join(String a, String b) {
        StringBuilder sb = new StringBuilder();
        if (a != null && !a.isBlank()) {
            sb.append(a.trim());
        }
        if (b != null && !b.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(b.trim());
        }
        return sb.toString();
    }
}
