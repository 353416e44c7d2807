package caseflow.coordinator.store;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobCompleteResult;
import caseflow.coordinator.model.JobFailResult;
import caseflow.coordinator.model.JobStatus;
import caseflow.coordinator.model.QueueStats;
import caseflow.coordinator.testsupport.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static final String QUEUE = "case-processing";
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static Database db;
    private static JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestDatabases.memUrl("test-jobs"));
        db = new Database(config);
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        TestDatabases.clear(db, "jobs");
    }

    private static Job pending(String id, int priority, Instant createdAt) {
        return Job.builder()
                .id(id)
                .queueName(QUEUE)
                .data("{\"caseId\":\"" + id + "\"}")
                .priority(priority)
                .maxAttempts(3)
                .createdAt(createdAt)
                .scheduledFor(createdAt)
                .build();
    }

    @Test
    void saveAndFindById() {
        repo.save(pending("job-1", 5, T0));

        Optional<Job> found = repo.findById("job-1");
        assertTrue(found.isPresent());
        assertEquals(QUEUE, found.get().queueName());
        assertEquals(JobStatus.PENDING, found.get().status());
        assertEquals(5, found.get().priority());
        assertEquals(0, found.get().attempts());
        assertEquals("{\"caseId\":\"job-1\"}", found.get().data());
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void claimsByPriorityThenAge() {
        repo.save(pending("old-low", 0, T0));
        repo.save(pending("new-high", 10, T0.plusSeconds(5)));
        repo.save(pending("newer-low", 0, T0.plusSeconds(10)));

        Instant now = T0.plusSeconds(60);
        assertEquals("new-high", repo.claimNext(QUEUE, now).orElseThrow().id());
        assertEquals("old-low", repo.claimNext(QUEUE, now).orElseThrow().id());
        assertEquals("newer-low", repo.claimNext(QUEUE, now).orElseThrow().id());
        assertTrue(repo.claimNext(QUEUE, now).isEmpty());
    }

    @Test
    void claimSetsProcessingAndStartedAt() {
        repo.save(pending("job-1", 0, T0));
        Instant now = T0.plusSeconds(1);

        Job claimed = repo.claimNext(QUEUE, now).orElseThrow();

        assertEquals(JobStatus.PROCESSING, claimed.status());
        assertEquals(now, claimed.startedAt());
        assertEquals(JobStatus.PROCESSING, repo.findById("job-1").orElseThrow().status());
    }

    @Test
    void futureJobsAreNotClaimed() {
        repo.save(pending("job-1", 0, T0).toBuilder().scheduledFor(T0.plusSeconds(30)).build());

        assertTrue(repo.claimNext(QUEUE, T0.plusSeconds(29)).isEmpty());
        assertTrue(repo.claimNext(QUEUE, T0.plusSeconds(30)).isPresent());
    }

    @Test
    void otherQueuesAreNotClaimed() {
        repo.save(pending("job-1", 0, T0).toBuilder().queueName("other").build());
        assertTrue(repo.claimNext(QUEUE, T0.plusSeconds(1)).isEmpty());
    }

    @Test
    void completeOnlyFromProcessing() {
        repo.save(pending("job-1", 0, T0));
        assertEquals(JobCompleteResult.NOT_PROCESSING, repo.complete("job-1", "{}", T0));

        repo.claimNext(QUEUE, T0.plusSeconds(1));
        assertEquals(JobCompleteResult.COMPLETED, repo.complete("job-1", "{\"ok\":true}", T0.plusSeconds(2)));
        assertEquals(JobCompleteResult.ALREADY_TERMINAL, repo.complete("job-1", "{}", T0.plusSeconds(3)));
        assertEquals(JobCompleteResult.NOT_FOUND, repo.complete("missing", "{}", T0));

        Job done = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals("{\"ok\":true}", done.result());
        assertEquals(T0.plusSeconds(2), done.completedAt());
    }

    @Test
    void failReschedulesWithDelayForNewAttemptCount() {
        repo.save(pending("job-1", 0, T0));
        repo.claimNext(QUEUE, T0);

        List<Integer> seenAttempts = new ArrayList<>();
        Instant failedAt = T0.plusSeconds(5);
        JobFailResult result = repo.fail("job-1", "boom", failedAt, attempts -> {
            seenAttempts.add(attempts);
            return Duration.ofSeconds(4);
        });

        assertEquals(JobFailResult.RETRIED, result);
        assertEquals(List.of(1), seenAttempts);
        Job job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(1, job.attempts());
        assertEquals("boom", job.error());
        assertEquals(failedAt.plusSeconds(4), job.scheduledFor());

        assertTrue(repo.claimNext(QUEUE, failedAt.plusSeconds(3)).isEmpty());
        assertTrue(repo.claimNext(QUEUE, failedAt.plusSeconds(4)).isPresent());
    }

    @Test
    void failExhaustsAttempts() {
        repo.save(pending("job-1", 0, T0));
        Instant now = T0;
        for (int i = 0; i < 2; i++) {
            repo.claimNext(QUEUE, now);
            assertEquals(JobFailResult.RETRIED, repo.fail("job-1", "err " + i, now, a -> Duration.ZERO));
        }
        repo.claimNext(QUEUE, now);
        assertEquals(JobFailResult.FAILED, repo.fail("job-1", "final", now.plusSeconds(1), a -> Duration.ZERO));

        Job job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(3, job.attempts());
        assertEquals("final", job.error());
        assertEquals(now.plusSeconds(1), job.failedAt());
        assertTrue(repo.claimNext(QUEUE, now.plusSeconds(60)).isEmpty());
    }

    @Test
    void failRequiresProcessing() {
        repo.save(pending("job-1", 0, T0));
        assertEquals(JobFailResult.NOT_PROCESSING, repo.fail("job-1", "x", T0, a -> Duration.ZERO));
        assertEquals(JobFailResult.NOT_FOUND, repo.fail("missing", "x", T0, a -> Duration.ZERO));
    }

    @Test
    void findsStuckProcessingJobs() {
        repo.save(pending("stuck", 0, T0));
        repo.save(pending("fresh", 0, T0));
        repo.claimNext(QUEUE, T0);
        repo.claimNext(QUEUE, T0.plusSeconds(600));

        List<Job> stuck = repo.findStuckProcessing(T0.plusSeconds(300));
        assertEquals(1, stuck.size());
        assertEquals(T0, stuck.get(0).startedAt());
    }

    @Test
    void statsAndRetention() {
        repo.save(pending("p", 0, T0));
        repo.save(pending("f-old", 5, T0));
        repo.save(pending("f-new", 4, T0));
        Job oldFail = repo.claimNext(QUEUE, T0).orElseThrow();
        repo.fail(oldFail.id(), "x", T0, a -> Duration.ZERO);
        repo.claimNext(QUEUE, T0);
        repo.fail(oldFail.id(), "x", T0, a -> Duration.ZERO);
        repo.claimNext(QUEUE, T0);
        repo.fail(oldFail.id(), "x", T0, a -> Duration.ZERO);

        QueueStats stats = repo.stats(QUEUE);
        assertEquals(1, stats.failed());
        assertEquals(2, stats.pending());
        assertEquals(3, stats.total());

        assertEquals(0, repo.deleteFailedBefore(QUEUE, T0));
        assertEquals(1, repo.deleteFailedBefore(QUEUE, T0.plusSeconds(1)));
        assertTrue(repo.findById("f-old").isEmpty());
        assertEquals(2, repo.stats(QUEUE).total());
    }

    @Test
    void concurrentClaimsNeverShareAJob() throws Exception {
        int jobs = 30;
        for (int i = 0; i < jobs; i++) {
            repo.save(pending("job-" + i, 0, T0.plusMillis(i)));
        }

        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> claimed = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
                    // A contended claim may come back empty; keep going until the queue is drained
                    while (claimed.size() + duplicates.get() < jobs && System.nanoTime() < deadline) {
                        Optional<Job> job = repo.claimNext(QUEUE, T0.plusSeconds(60));
                        if (job.isPresent() && !claimed.add(job.get().id())) {
                            duplicates.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, duplicates.get());
        assertEquals(jobs, claimed.size());
        assertEquals(jobs, repo.stats(QUEUE).processing());
    }
}
