package caseflow.coordinator.config;

import caseflow.coordinator.api.internal.v1.WorkerController;
import caseflow.coordinator.api.v1.CaseController;
import caseflow.coordinator.api.v1.HealthController;
import caseflow.coordinator.api.v1.WebhookController;
import caseflow.coordinator.notify.CaseStatusNotifier;
import caseflow.coordinator.notify.HmacTokenVerifier;
import caseflow.coordinator.notify.StatusChannel;
import caseflow.coordinator.notify.StatusChannels;
import caseflow.coordinator.notify.SubscriptionRegistry;
import caseflow.coordinator.notify.TokenVerifier;
import caseflow.coordinator.pipeline.FanOut;
import caseflow.coordinator.pipeline.PipelineFactory;
import caseflow.coordinator.pipeline.PipelineOrchestrator;
import caseflow.coordinator.pipeline.StageGraph;
import caseflow.coordinator.ratelimit.ExternalCallExecutor;
import caseflow.coordinator.ratelimit.RateLimitConfig;
import caseflow.coordinator.ratelimit.RateLimiter;
import caseflow.coordinator.ratelimit.Sleeper;
import caseflow.coordinator.ratelimit.TokenEstimator;
import caseflow.coordinator.repository.CaseRepository;
import caseflow.coordinator.repository.JobRepository;
import caseflow.coordinator.repository.RateWindowRepository;
import caseflow.coordinator.repository.StageRepository;
import caseflow.coordinator.scheduler.JobReaper;
import caseflow.coordinator.scheduler.QueuePoller;
import caseflow.coordinator.scheduler.RetentionSweeper;
import caseflow.coordinator.scheduler.Scheduler;
import caseflow.coordinator.server.RouterHandler;
import caseflow.coordinator.service.BackoffPolicy;
import caseflow.coordinator.service.CaseIntakeService;
import caseflow.coordinator.service.CaseProcessingWorker;
import caseflow.coordinator.service.CaseStatusService;
import caseflow.coordinator.service.JobQueueService;
import caseflow.coordinator.service.SignatureVerifier;
import caseflow.coordinator.store.Database;
import caseflow.coordinator.store.JdbcCaseRepository;
import caseflow.coordinator.store.JdbcJobRepository;
import caseflow.coordinator.store.JdbcRateWindowRepository;
import caseflow.coordinator.store.JdbcStageRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * CaseProcessingWorker worker = deps.worker();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Database database;
    private final JobRepository jobRepository;
    private final CaseRepository caseRepository;
    private final StageRepository stageRepository;
    private final RateWindowRepository rateWindowRepository;

    private final JobQueueService queueService;
    private final RateLimiter rateLimiter;
    private final ExternalCallExecutor callExecutor;
    private final ExecutorService fanOutExecutor;
    private final PipelineOrchestrator orchestrator;
    private final SubscriptionRegistry subscriptions;
    private final StatusChannel statusChannel;
    private final TokenVerifier tokenVerifier;
    private final CaseStatusNotifier notifier;
    private final CaseIntakeService intakeService;
    private final CaseStatusService statusService;
    private final CaseProcessingWorker worker;

    // Controllers
    private final HealthController healthController;
    private final WebhookController webhookController;
    private final CaseController caseController;
    private final WorkerController workerController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, ExternalClients clients, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.mapper = RouterHandler.mapper();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.caseRepository = new JdbcCaseRepository(database);
        this.stageRepository = new JdbcStageRepository(database);
        this.rateWindowRepository = new JdbcRateWindowRepository(database);

        // Queue
        this.queueService = new JobQueueService(jobRepository, config, clock);

        // Outbound calls
        ExternalClients external = clients != null ? clients : ExternalClients.http(config, mapper);
        this.rateLimiter = new RateLimiter(rateWindowRepository,
                RateLimitConfig.forEnvironment(config.isProduction()),
                new TokenEstimator(config.charactersPerToken()),
                config.minCallDelay(), clock, sleeper);
        this.callExecutor = new ExternalCallExecutor(rateLimiter,
                new BackoffPolicy(config.retryBaseDelay(), config.retryMaxDelay()),
                config.maxRetries(), sleeper);
        this.fanOutExecutor = Executors.newFixedThreadPool(config.fanOutThreads(), fanOutThreadFactory());

        // Pipeline
        StageGraph graph = PipelineFactory.build(caseRepository, external.llm(), external.caseLaw(),
                external.extractor(), callExecutor, new FanOut(fanOutExecutor), mapper, clock);
        this.orchestrator = new PipelineOrchestrator(graph, stageRepository, caseRepository, mapper, clock);

        // Status notification
        this.subscriptions = new SubscriptionRegistry();
        this.statusChannel = StatusChannels.select(config, subscriptions, mapper);
        this.tokenVerifier = StatusChannels.liveSupported(config)
                ? new HmacTokenVerifier(config.tokenSecret(), clock)
                : null;
        this.notifier = new CaseStatusNotifier(caseRepository, statusChannel, clock);

        // Services
        this.intakeService = new CaseIntakeService(caseRepository, queueService, notifier, config);
        this.statusService = new CaseStatusService(caseRepository, stageRepository, mapper);
        this.worker = new CaseProcessingWorker(queueService, caseRepository, orchestrator, notifier, mapper);

        // Controllers (public API)
        this.healthController = new HealthController(database, queueService, config, statusChannel.name());
        this.webhookController = new WebhookController(intakeService,
                config.hasWebhookSecret() ? new SignatureVerifier(config.webhookSecret()) : null);
        this.caseController = new CaseController(statusService, intakeService);

        // Controllers (internal API)
        this.workerController = new WorkerController(worker, queueService, config);

        log.info("Dependencies initialized successfully (status channel: {})", statusChannel.name());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return create(config, null);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    /**
     * Create dependencies with caller-supplied outbound clients.
     */
    public static Dependencies create(CoordinatorConfig config, ExternalClients clients) {
        return create(config, clients, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public static Dependencies create(CoordinatorConfig config, ExternalClients clients, Clock clock,
            Sleeper sleeper) {
        return new Dependencies(config, clients, clock, sleeper);
    }

    private static ThreadFactory fanOutThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "caseflow-fanout-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public CaseRepository caseRepository() {
        return caseRepository;
    }

    public StageRepository stageRepository() {
        return stageRepository;
    }

    public RateWindowRepository rateWindowRepository() {
        return rateWindowRepository;
    }

    public JobQueueService queueService() {
        return queueService;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public PipelineOrchestrator orchestrator() {
        return orchestrator;
    }

    public SubscriptionRegistry subscriptions() {
        return subscriptions;
    }

    public StatusChannel statusChannel() {
        return statusChannel;
    }

    /**
     * @return null when the live channel is not served
     */
    public TokenVerifier tokenVerifier() {
        return tokenVerifier;
    }

    public CaseStatusNotifier notifier() {
        return notifier;
    }

    public CaseIntakeService intakeService() {
        return intakeService;
    }

    public CaseStatusService statusService() {
        return statusService;
    }

    public CaseProcessingWorker worker() {
        return worker;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(webhookController)
                    .registerController(caseController)
                    .registerController(workerController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            JobReaper reaper = new JobReaper(jobRepository, queueService, config.jobLeaseTimeout(), clock, worker);
            RetentionSweeper sweeper = new RetentionSweeper(queueService, config.caseQueue(),
                    config.retentionMaxAgeHours());
            QueuePoller poller = config.pollEnabled()
                    ? new QueuePoller(worker, config.caseQueue(), config.maxBatchSize())
                    : null;
            scheduler = new Scheduler(reaper, sweeper, poller, config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for lease reaping and retention.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        fanOutExecutor.shutdown();
        try {
            if (!fanOutExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fanOutExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fanOutExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
