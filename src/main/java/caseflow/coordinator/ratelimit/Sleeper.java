package caseflow.coordinator.ratelimit;

import java.time.Duration;

/**
 * Suspends the caller. Replaced in tests by a sleeper that advances a fake clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
