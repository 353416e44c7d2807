package caseflow.coordinator.ratelimit;

/**
 * Per-minute ceilings for one external resource.
 * A non-positive token limit means tokens are not metered.
 */
public record ResourceLimit(int requestsPerMinute, long tokensPerMinute) {

    public ResourceLimit {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be at least 1");
        }
    }

    public static ResourceLimit requestsOnly(int requestsPerMinute) {
        return new ResourceLimit(requestsPerMinute, 0);
    }

    public boolean metersTokens() {
        return tokensPerMinute > 0;
    }

    /**
     * Scale both ceilings down, keeping at least one request and one token.
     */
    public ResourceLimit scaled(double factor) {
        int rpm = Math.max(1, (int) Math.floor(requestsPerMinute * factor));
        long tpm = metersTokens() ? Math.max(1, (long) Math.floor(tokensPerMinute * factor)) : 0;
        return new ResourceLimit(rpm, tpm);
    }
}
