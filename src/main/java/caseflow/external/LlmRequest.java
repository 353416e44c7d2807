package caseflow.external;

/**
 * One chat completion request. The model is also the rate-limit key.
 */
public record LlmRequest(
        String model,
        String systemPrompt,
        String userPrompt,
        int maxTokens,
        double temperature) {

    /**
     * Text used to estimate the token cost of this request.
     */
    public String estimatePayload() {
        return systemPrompt + "\n" + userPrompt;
    }
}
