package caseflow.coordinator.store;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.Admission;
import caseflow.coordinator.model.RateWindow;
import caseflow.coordinator.testsupport.TestDatabases;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRateWindowRepositoryTest {

    private static final long T0 = 1_772_000_000_000L;
    private static final long WINDOW = 60_000;

    private static Database db;
    private static JdbcRateWindowRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("test-rate")));
        repo = new JdbcRateWindowRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanWindows() throws Exception {
        TestDatabases.clear(db, "rate_windows");
    }

    @Test
    void admitsUpToRequestLimitThenWaitsForWindowEnd() {
        for (int i = 0; i < 3; i++) {
            assertTrue(repo.tryAdmit("gpt-4o", T0 + i, 3, Long.MAX_VALUE, 0, 0, WINDOW).admitted());
        }

        Admission denied = repo.tryAdmit("gpt-4o", T0 + 10_000, 3, Long.MAX_VALUE, 0, 0, WINDOW);
        assertFalse(denied.admitted());
        assertEquals(50_000, denied.waitMillis());

        RateWindow window = repo.find("gpt-4o").orElseThrow();
        assertEquals(3, window.requestCount());
        assertEquals(T0, window.windowStart());
    }

    @Test
    void tokenBudgetIsEnforced() {
        assertTrue(repo.tryAdmit("gpt-4o", T0, 100, 1000, 600, 0, WINDOW).admitted());
        assertFalse(repo.tryAdmit("gpt-4o", T0 + 1, 100, 1000, 500, 0, WINDOW).admitted());
        assertTrue(repo.tryAdmit("gpt-4o", T0 + 2, 100, 1000, 400, 0, WINDOW).admitted());
        assertEquals(1000, repo.find("gpt-4o").orElseThrow().tokenCount());
    }

    @Test
    void windowResetsAfterItsLength() {
        assertTrue(repo.tryAdmit("caselaw", T0, 1, Long.MAX_VALUE, 0, 0, WINDOW).admitted());
        assertFalse(repo.tryAdmit("caselaw", T0 + WINDOW - 1, 1, Long.MAX_VALUE, 0, 0, WINDOW).admitted());
        assertTrue(repo.tryAdmit("caselaw", T0 + WINDOW, 1, Long.MAX_VALUE, 0, 0, WINDOW).admitted());

        RateWindow window = repo.find("caselaw").orElseThrow();
        assertEquals(T0 + WINDOW, window.windowStart());
        assertEquals(1, window.requestCount());
    }

    @Test
    void minimumGapBetweenCalls() {
        assertTrue(repo.tryAdmit("extractor", T0, 100, Long.MAX_VALUE, 0, 1000, WINDOW).admitted());

        Admission tooSoon = repo.tryAdmit("extractor", T0 + 400, 100, Long.MAX_VALUE, 0, 1000, WINDOW);
        assertFalse(tooSoon.admitted());
        assertEquals(600, tooSoon.waitMillis());

        assertTrue(repo.tryAdmit("extractor", T0 + 1000, 100, Long.MAX_VALUE, 0, 1000, WINDOW).admitted());
    }

    @Test
    void resourcesAreIndependent() {
        assertTrue(repo.tryAdmit("a", T0, 1, Long.MAX_VALUE, 0, 0, WINDOW).admitted());
        assertTrue(repo.tryAdmit("b", T0, 1, Long.MAX_VALUE, 0, 0, WINDOW).admitted());
        assertFalse(repo.tryAdmit("a", T0 + 1, 1, Long.MAX_VALUE, 0, 0, WINDOW).admitted());
    }

    @Test
    void concurrentCallersNeverOverAdmit() throws Exception {
        int limit = 10;
        int callers = 8;
        int attemptsEach = 5;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int c = 0; c < callers; c++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    int admitted = 0;
                    for (int i = 0; i < attemptsEach; i++) {
                        if (repo.tryAdmit("shared", T0, limit, Long.MAX_VALUE, 0, 0, WINDOW).admitted()) {
                            admitted++;
                        }
                    }
                    return admitted;
                }));
            }
            start.countDown();
            int total = 0;
            for (Future<Integer> f : futures) {
                total += f.get(30, TimeUnit.SECONDS);
            }
            assertTrue(total <= limit, "admitted " + total + " calls with a limit of " + limit);
            assertEquals(total, repo.find("shared").orElseThrow().requestCount());
        } finally {
            pool.shutdownNow();
        }
    }
}
