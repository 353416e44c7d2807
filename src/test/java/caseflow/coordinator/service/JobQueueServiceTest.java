package caseflow.coordinator.service;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.BatchResult;
import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobCompleteResult;
import caseflow.coordinator.model.JobFailResult;
import caseflow.coordinator.model.JobStatus;
import caseflow.coordinator.store.Database;
import caseflow.coordinator.store.JdbcJobRepository;
import caseflow.coordinator.testsupport.MutableClock;
import caseflow.coordinator.testsupport.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueServiceTest {

    private static final String QUEUE = "case-processing";

    private static Database db;
    private static JdbcJobRepository repo;

    private MutableClock clock;
    private JobQueueService queue;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("test-queue")));
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
                .withMaxAttempts(3)
                .withQueueBackoff(Duration.ofSeconds(2), Duration.ofMinutes(5));
        queue = new JobQueueService(repo, config, clock);
    }

    @Test
    void enqueueStoresPendingJob() {
        String id = queue.enqueue(QUEUE, Map.of("caseId", "c1"));

        Job job = queue.findById(id).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(3, job.maxAttempts());
        assertEquals(clock.instant(), job.scheduledFor());
        assertEquals("{\"caseId\":\"c1\"}", job.data());
    }

    @Test
    void enqueueIsNotDeduplicated() {
        String a = queue.enqueue(QUEUE, "{\"caseId\":\"c1\"}");
        String b = queue.enqueue(QUEUE, "{\"caseId\":\"c1\"}");
        assertNotEquals(a, b);
        assertEquals(2, queue.stats(QUEUE).pending());
    }

    @Test
    void enqueueValidatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(" ", "{}"));
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(QUEUE, null));
        assertThrows(IllegalArgumentException.class,
                () -> queue.enqueue(QUEUE, "{}", new JobQueueService.EnqueueOptions(null, 0, null)));
    }

    @Test
    void priorityWins() {
        queue.enqueue(QUEUE, "{\"n\":1}");
        String urgent = queue.enqueue(QUEUE, "{\"n\":2}", JobQueueService.EnqueueOptions.withPriority(10));

        assertEquals(urgent, queue.claimNext(QUEUE).orElseThrow().id());
    }

    @Test
    void failedJobComesBackAfterBackoff() {
        String id = queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE).orElseThrow();

        assertEquals(JobFailResult.RETRIED, queue.fail(id, "upstream 503"));

        // First retry waits delay(1) = 4s
        clock.advance(Duration.ofSeconds(3));
        assertTrue(queue.claimNext(QUEUE).isEmpty());
        clock.advance(Duration.ofSeconds(1));
        Job retried = queue.claimNext(QUEUE).orElseThrow();
        assertEquals(id, retried.id());
        assertEquals(1, retried.attempts());
        assertEquals("upstream 503", retried.error());
    }

    @Test
    void jobFailsPermanentlyAfterMaxAttempts() {
        String id = queue.enqueue(QUEUE, "{}");
        List<JobFailResult> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofMinutes(10));
            queue.claimNext(QUEUE).orElseThrow();
            results.add(queue.fail(id, "attempt " + i));
        }

        assertEquals(List.of(JobFailResult.RETRIED, JobFailResult.RETRIED, JobFailResult.FAILED), results);
        assertEquals(JobStatus.FAILED, queue.findById(id).orElseThrow().status());
        clock.advance(Duration.ofHours(1));
        assertTrue(queue.claimNext(QUEUE).isEmpty());
    }

    @Test
    void completeTwiceIsReported() {
        String id = queue.enqueue(QUEUE, "{}");
        queue.claimNext(QUEUE);

        assertEquals(JobCompleteResult.COMPLETED, queue.complete(id, "{\"ok\":true}"));
        assertEquals(JobCompleteResult.ALREADY_TERMINAL, queue.complete(id, "{}"));
        assertEquals(JobFailResult.NOT_PROCESSING, queue.fail(id, "late"));
    }

    @Test
    void batchProcessesUntilQueueIsEmpty() {
        queue.enqueue(QUEUE, "{\"ok\":true}");
        queue.enqueue(QUEUE, "{\"ok\":false}");
        queue.enqueue(QUEUE, "{\"ok\":true}");

        BatchResult result = queue.claimBatch(QUEUE, 5, job -> {
            if (job.data().contains("false")) {
                throw new IllegalStateException("handler said no");
            }
            return "{}";
        });

        assertEquals(3, result.processed());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(2, queue.stats(QUEUE).completed());
        assertEquals(1, queue.stats(QUEUE).pending());
    }

    @Test
    void batchSizeIsBounded() {
        for (int i = 0; i < 5; i++) {
            queue.enqueue(QUEUE, "{}");
        }
        BatchResult result = queue.claimBatch(QUEUE, 2, job -> null);
        assertEquals(2, result.processed());
        assertEquals(3, queue.stats(QUEUE).pending());

        assertThrows(IllegalArgumentException.class, () -> queue.claimBatch(QUEUE, 0, job -> null));
    }

    @Test
    void cleanupRemovesOldFailedJobs() {
        String id = queue.enqueue(QUEUE, "{}", new JobQueueService.EnqueueOptions(null, 1, null));
        queue.claimNext(QUEUE);
        assertEquals(JobFailResult.FAILED, queue.fail(id, "fatal"));

        assertEquals(0, queue.cleanup(QUEUE, 24));
        clock.advance(Duration.ofHours(25));
        assertEquals(1, queue.cleanup(QUEUE, 24));
        assertTrue(queue.findById(id).isEmpty());
    }

    @Test
    void describeFallsBackToExceptionType() {
        assertEquals("boom", JobQueueService.describe(new RuntimeException("boom")));
        assertEquals("NullPointerException", JobQueueService.describe(new NullPointerException()));
    }
}
