package caseflow.coordinator.ratelimit;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.store.Database;
import caseflow.coordinator.store.JdbcRateWindowRepository;
import caseflow.coordinator.testsupport.AdvancingSleeper;
import caseflow.coordinator.testsupport.MutableClock;
import caseflow.coordinator.testsupport.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private static Database db;
    private static JdbcRateWindowRepository windows;

    private MutableClock clock;
    private AdvancingSleeper sleeper;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("test-limiter")));
        windows = new JdbcRateWindowRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clear(db, "rate_windows");
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        sleeper = new AdvancingSleeper(clock);
    }

    private RateLimiter limiter(ResourceLimit limit, Duration minCallDelay) {
        RateLimitConfig config = RateLimitConfig.development().withLimit("test", limit);
        return new RateLimiter(windows, config, new TokenEstimator(4), minCallDelay, clock, sleeper);
    }

    @Test
    void callOverRequestLimitWaitsForNextWindow() throws Exception {
        RateLimiter limiter = limiter(ResourceLimit.requestsOnly(3), Duration.ZERO);

        for (int i = 0; i < 3; i++) {
            assertEquals(Duration.ZERO, limiter.acquire("test", "q"));
        }
        Duration waited = limiter.acquire("test", "q");

        assertEquals(Duration.ofSeconds(60), waited);
        assertEquals(1, windows.find("test").orElseThrow().requestCount());
    }

    @Test
    void tokenBudgetDelaysLargeCalls() throws Exception {
        RateLimiter limiter = limiter(new ResourceLimit(100, 1000), Duration.ZERO);
        String fiveHundredTokens = "x".repeat(2000);

        assertEquals(Duration.ZERO, limiter.acquire("test", fiveHundredTokens));
        assertEquals(Duration.ZERO, limiter.acquire("test", fiveHundredTokens));
        assertEquals(Duration.ofSeconds(60), limiter.acquire("test", fiveHundredTokens));
    }

    @Test
    void oversizedCallIsChargedAtTheCeiling() throws Exception {
        RateLimiter limiter = limiter(new ResourceLimit(100, 1000), Duration.ZERO);

        assertEquals(Duration.ZERO, limiter.acquire("test", "x".repeat(10_000)));
        assertEquals(1000, windows.find("test").orElseThrow().tokenCount());
    }

    @Test
    void requestOnlyResourcesAreNotChargedTokens() throws Exception {
        RateLimiter limiter = limiter(ResourceLimit.requestsOnly(10), Duration.ZERO);

        limiter.acquire("test", "x".repeat(10_000));
        assertEquals(0, windows.find("test").orElseThrow().tokenCount());
    }

    @Test
    void minimumDelayBetweenCalls() throws Exception {
        RateLimiter limiter = limiter(ResourceLimit.requestsOnly(100), Duration.ofMillis(1000));

        assertEquals(Duration.ZERO, limiter.acquire("test", "q"));
        assertEquals(Duration.ofMillis(1000), limiter.acquire("test", "q"));
        clock.advance(Duration.ofSeconds(5));
        assertEquals(Duration.ZERO, limiter.acquire("test", "q"));
    }

    @Test
    void unknownResourceUsesDefaultLimit() {
        RateLimitConfig config = RateLimitConfig.development();
        assertEquals(config.defaultLimit(), config.limitFor("some-new-model"));
        assertEquals(new ResourceLimit(20, 200_000), config.limitFor("gpt-4o"));
        assertFalse(config.limitFor(RateLimitConfig.CASE_LAW).metersTokens());
    }

    @Test
    void productionKeepsHeadroom() {
        RateLimitConfig production = RateLimitConfig.forEnvironment(true);
        assertEquals(new ResourceLimit(16, 160_000), production.limitFor("gpt-4o"));
        assertEquals(ResourceLimit.requestsOnly(24), production.limitFor(RateLimitConfig.CASE_LAW));
        assertEquals(new ResourceLimit(1, 1), new ResourceLimit(1, 1).scaled(0.1));
    }

    @Test
    void tokenEstimateRoundsUp() {
        TokenEstimator estimator = new TokenEstimator(4);
        assertEquals(1, estimator.estimate(""));
        assertEquals(1, estimator.estimate(null));
        assertEquals(1, estimator.estimate("abcd"));
        assertEquals(2, estimator.estimate("abcde"));
    }
}
