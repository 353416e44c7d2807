package caseflow.coordinator.ratelimit;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.error.ExternalServiceException;
import caseflow.coordinator.error.TransientExternalException;
import caseflow.coordinator.service.BackoffPolicy;
import caseflow.coordinator.store.Database;
import caseflow.coordinator.store.JdbcRateWindowRepository;
import caseflow.coordinator.testsupport.AdvancingSleeper;
import caseflow.coordinator.testsupport.MutableClock;
import caseflow.coordinator.testsupport.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExternalCallExecutorTest {

    private static Database db;
    private static JdbcRateWindowRepository windows;

    private MutableClock clock;
    private AdvancingSleeper sleeper;
    private ExternalCallExecutor executor;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("test-executor")));
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
        RateLimiter limiter = new RateLimiter(windows, RateLimitConfig.development(), new TokenEstimator(4),
                Duration.ZERO, clock, sleeper);
        // Jitter pinned to the top of the range
        executor = new ExternalCallExecutor(limiter,
                new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(30)), 3, sleeper, () -> 1.0);
    }

    @Test
    void transientFailuresAreRetriedWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.call("caselaw", "q", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientExternalException("caselaw", "HTTP 503");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeper.sleeps());
        // Each attempt goes through the limiter
        assertEquals(3, windows.find("caselaw").orElseThrow().requestCount());
    }

    @Test
    void givesUpAfterMaxRetries() {
        AtomicInteger calls = new AtomicInteger();

        TransientExternalException e = assertThrows(TransientExternalException.class,
                () -> executor.call("caselaw", "q", () -> {
                    calls.incrementAndGet();
                    throw new TransientExternalException("caselaw", "timeout");
                }));

        assertEquals("timeout", e.getMessage());
        assertEquals(4, calls.get());
        assertEquals(3, sleeper.sleeps().size());
    }

    @Test
    void permanentFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ExternalServiceException.class, () -> executor.call("caselaw", "q", () -> {
            calls.incrementAndGet();
            throw new ExternalServiceException("caselaw", 400, "bad query");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void negativeRetriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalCallExecutor(null,
                new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1)), -1, sleeper));
    }
}
