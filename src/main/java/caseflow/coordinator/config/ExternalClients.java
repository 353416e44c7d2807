package caseflow.coordinator.config;

import caseflow.coordinator.ratelimit.RateLimitConfig;
import caseflow.external.CaseLawClient;
import caseflow.external.DocumentTextExtractor;
import caseflow.external.HttpCaseLawClient;
import caseflow.external.HttpDocumentTextExtractor;
import caseflow.external.HttpLlmClient;
import caseflow.external.JsonHttpClient;
import caseflow.external.LlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The outbound clients the pipeline calls.
 */
public record ExternalClients(LlmClient llm, CaseLawClient caseLaw, DocumentTextExtractor extractor) {

    public static ExternalClients http(CoordinatorConfig config, ObjectMapper mapper) {
        return new ExternalClients(
                new HttpLlmClient(new JsonHttpClient("llm", mapper, config.externalCallTimeout()), mapper,
                        config.llmBaseUrl(), config.llmApiKey()),
                new HttpCaseLawClient(new JsonHttpClient(RateLimitConfig.CASE_LAW, mapper,
                        config.externalCallTimeout()), config.caseLawBaseUrl(), config.caseLawApiKey()),
                new HttpDocumentTextExtractor(new JsonHttpClient(RateLimitConfig.EXTRACTOR, mapper,
                        config.externalCallTimeout()), config.extractorBaseUrl(), config.extractorApiKey()));
    }
}
