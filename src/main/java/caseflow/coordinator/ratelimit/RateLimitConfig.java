package caseflow.coordinator.ratelimit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate limits per external resource.
 * Production runs below the provider ceilings to keep headroom.
 */
public final class RateLimitConfig {

    public static final String CASE_LAW = "caselaw";
    public static final String EXTRACTOR = "extractor";

    static final double PRODUCTION_HEADROOM = 0.8;

    private final Map<String, ResourceLimit> limits;
    private final ResourceLimit defaultLimit;

    private RateLimitConfig(Map<String, ResourceLimit> limits, ResourceLimit defaultLimit) {
        this.limits = Collections.unmodifiableMap(new LinkedHashMap<>(limits));
        this.defaultLimit = defaultLimit;
    }

    public static RateLimitConfig development() {
        Map<String, ResourceLimit> limits = new LinkedHashMap<>();
        limits.put("gpt-4", new ResourceLimit(15, 150_000));
        limits.put("gpt-4-turbo", new ResourceLimit(15, 150_000));
        limits.put("gpt-4o", new ResourceLimit(20, 200_000));
        limits.put("gpt-4o-mini", new ResourceLimit(40, 300_000));
        limits.put(CASE_LAW, ResourceLimit.requestsOnly(30));
        limits.put(EXTRACTOR, ResourceLimit.requestsOnly(20));
        return new RateLimitConfig(limits, new ResourceLimit(15, 150_000));
    }

    public static RateLimitConfig production() {
        RateLimitConfig dev = development();
        Map<String, ResourceLimit> limits = new LinkedHashMap<>();
        dev.limits.forEach((key, limit) -> limits.put(key, limit.scaled(PRODUCTION_HEADROOM)));
        return new RateLimitConfig(limits, dev.defaultLimit.scaled(PRODUCTION_HEADROOM));
    }

    public static RateLimitConfig forEnvironment(boolean production) {
        return production ? production() : development();
    }

    /**
     * Copy with one resource overridden.
     */
    public RateLimitConfig withLimit(String resource, ResourceLimit limit) {
        Map<String, ResourceLimit> copy = new LinkedHashMap<>(limits);
        copy.put(resource, limit);
        return new RateLimitConfig(copy, defaultLimit);
    }

    public ResourceLimit limitFor(String resource) {
        return limits.getOrDefault(resource, defaultLimit);
    }

    public Map<String, ResourceLimit> limits() {
        return limits;
    }

    public ResourceLimit defaultLimit() {
        return defaultLimit;
    }
}
