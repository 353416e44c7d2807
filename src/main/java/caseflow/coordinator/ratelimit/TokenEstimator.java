package caseflow.coordinator.ratelimit;

/**
 * Estimates the token cost of a call from its payload size.
 */
public final class TokenEstimator {

    private final int charactersPerToken;

    public TokenEstimator(int charactersPerToken) {
        if (charactersPerToken < 1) {
            throw new IllegalArgumentException("charactersPerToken must be at least 1");
        }
        this.charactersPerToken = charactersPerToken;
    }

    public long estimate(String payload) {
        if (payload == null || payload.isEmpty()) {
            return 1;
        }
        return Math.max(1, (payload.length() + charactersPerToken - 1) / charactersPerToken);
    }
}
