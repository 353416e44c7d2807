package caseflow.coordinator.scheduler;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobStatus;
import caseflow.coordinator.service.JobQueueService;
import caseflow.coordinator.store.Database;
import caseflow.coordinator.store.JdbcJobRepository;
import caseflow.coordinator.testsupport.MutableClock;
import caseflow.coordinator.testsupport.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lease expiry of abandoned jobs.
 */
class JobReaperTest {

    private static final String QUEUE = "case-processing";
    private static final Duration LEASE = Duration.ofMinutes(10);

    private static Database db;
    private static JdbcJobRepository repo;

    private MutableClock clock;
    private JobQueueService queue;
    private List<String> expired;
    private JobReaper reaper;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("test-reaper")));
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clear(db, "jobs");
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withMaxAttempts(2)
                .withQueueBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10));
        queue = new JobQueueService(repo, config, clock);
        expired = new CopyOnWriteArrayList<>();
        reaper = new JobReaper(repo, queue, LEASE, clock, job -> expired.add(job.id()));
    }

    @Test
    void leaveFreshLeasesAlone() {
        queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE);
        clock.advance(LEASE.minusSeconds(1));

        assertEquals(0, reaper.reapExpiredLeases());
        assertTrue(expired.isEmpty());
    }

    @Test
    void expiredLeaseIsRetried() {
        String id = queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE);
        clock.advance(LEASE.plusSeconds(1));

        assertEquals(1, reaper.reapExpiredLeases());

        Job job = queue.findById(id).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(1, job.attempts());
        assertEquals(JobReaper.LEASE_EXPIRED, job.error());
        assertEquals(List.of(id), expired);
    }

    @Test
    void expiredLeaseOnLastAttemptFailsJob() {
        String id = queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE);
        clock.advance(LEASE.plusSeconds(1));
        reaper.reapExpiredLeases();

        clock.advance(Duration.ofMinutes(1));
        queue.claimNext(QUEUE).orElseThrow();
        clock.advance(LEASE.plusSeconds(1));
        assertEquals(1, reaper.reapExpiredLeases());

        assertEquals(JobStatus.FAILED, queue.findById(id).orElseThrow().status());
        assertEquals(2, expired.size());
    }

    @Test
    void completedJobsAreNeverReaped() {
        String id = queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE);
        queue.complete(id, "{}");
        clock.advance(LEASE.multipliedBy(3));

        assertEquals(0, reaper.reapExpiredLeases());
        assertEquals(JobStatus.COMPLETED, queue.findById(id).orElseThrow().status());
    }

    @Test
    void listenerFailureDoesNotStopTheSweep() {
        JobReaper failingListener = new JobReaper(repo, queue, LEASE, clock, job -> {
            throw new IllegalStateException("listener broke");
        });
        queue.enqueue(QUEUE, "{}");
        queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE);
        queue.claimNext(QUEUE);
        clock.advance(LEASE.plusSeconds(1));

        assertDoesNotThrow(failingListener::run);
        assertEquals(2, queue.stats(QUEUE).pending());
    }
}
