package caseflow.coordinator.model;

/**
 * Per-resource usage counters for the current one-minute window.
 * Times are epoch milliseconds.
 */
public record RateWindow(
        String resourceKey,
        long windowStart,
        int requestCount,
        long tokenCount,
        long lastAdmittedAt) {

    public boolean isExpired(long nowMillis, long windowMillis) {
        return nowMillis - windowStart >= windowMillis;
    }
}
