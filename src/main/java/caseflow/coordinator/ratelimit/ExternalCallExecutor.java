package caseflow.coordinator.ratelimit;

import caseflow.coordinator.error.TransientExternalException;
import caseflow.coordinator.service.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs one external call: admission through the rate limiter, then the call,
 * retrying transient failures with jittered exponential backoff. Every retry
 * goes back through admission.
 */
public class ExternalCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final RateLimiter rateLimiter;
    private final BackoffPolicy backoff;
    private final int maxRetries;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public ExternalCallExecutor(RateLimiter rateLimiter, BackoffPolicy backoff, int maxRetries, Sleeper sleeper) {
        this(rateLimiter, backoff, maxRetries, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ExternalCallExecutor(RateLimiter rateLimiter, BackoffPolicy backoff, int maxRetries, Sleeper sleeper,
            DoubleSupplier random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.rateLimiter = rateLimiter;
        this.backoff = backoff;
        this.maxRetries = maxRetries;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Call an external resource.
     *
     * @param resource rate-limit key (model name, service name)
     * @param payload  request text used for the token estimate
     * @param call     the call itself
     * @return the call's result
     * @throws TransientExternalException when retries are exhausted
     * @throws Exception                  any non-transient failure, unchanged
     */
    public <T> T call(String resource, String payload, Callable<T> call) throws Exception {
        int attempt = 0;
        while (true) {
            rateLimiter.acquire(resource, payload);
            try {
                return call.call();
            } catch (TransientExternalException e) {
                if (attempt >= maxRetries) {
                    log.warn("Call to {} failed after {} retries: {}", resource, maxRetries, e.getMessage());
                    throw e;
                }
                Duration delay = backoff.jitteredDelay(attempt, random);
                attempt++;
                log.info("Transient failure calling {} ({}), retry {}/{} in {}ms",
                        resource, e.getMessage(), attempt, maxRetries, delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    public int maxRetries() {
        return maxRetries;
    }
}
