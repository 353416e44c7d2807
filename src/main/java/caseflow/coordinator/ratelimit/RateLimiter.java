package caseflow.coordinator.ratelimit;

import caseflow.coordinator.model.Admission;
import caseflow.coordinator.repository.RateWindowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Gates outbound calls against per-resource windows held in the shared store.
 * Callers over the limit are suspended until the window frees up; they are
 * never rejected.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final long WINDOW_MILLIS = 60_000;

    private final RateWindowRepository windows;
    private final RateLimitConfig limits;
    private final TokenEstimator estimator;
    private final Duration minCallDelay;
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiter(RateWindowRepository windows, RateLimitConfig limits, TokenEstimator estimator,
            Duration minCallDelay, Clock clock, Sleeper sleeper) {
        this.windows = windows;
        this.limits = limits;
        this.estimator = estimator;
        this.minCallDelay = minCallDelay;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Block until one call carrying the given payload may be issued, then
     * record it against the resource's window.
     *
     * @return total time spent waiting
     * @throws InterruptedException if interrupted while waiting
     */
    public Duration acquire(String resource, String payload) throws InterruptedException {
        ResourceLimit limit = limits.limitFor(resource);
        long tokens = 0;
        long tokenLimit = Long.MAX_VALUE;
        if (limit.metersTokens()) {
            // A call larger than the whole budget is charged at the ceiling so it can still run
            tokens = Math.min(estimator.estimate(payload), limit.tokensPerMinute());
            tokenLimit = limit.tokensPerMinute();
        }

        long waited = 0;
        while (true) {
            Admission admission = windows.tryAdmit(resource, clock.millis(), limit.requestsPerMinute(),
                    tokenLimit, tokens, minCallDelay.toMillis(), WINDOW_MILLIS);
            if (admission.admitted()) {
                if (waited > 0) {
                    log.debug("Admitted call to {} after waiting {}ms", resource, waited);
                }
                return Duration.ofMillis(waited);
            }

            long wait = Math.min(admission.waitMillis(), WINDOW_MILLIS);
            log.debug("Rate limit reached for {}, waiting {}ms", resource, wait);
            sleeper.sleep(Duration.ofMillis(wait));
            waited += wait;
        }
    }

    public RateLimitConfig limits() {
        return limits;
    }
}
