package caseflow.coordinator.api.internal.v1;

import caseflow.coordinator.api.Controller;
import caseflow.coordinator.api.internal.v1.dto.BatchRequest;
import caseflow.coordinator.api.internal.v1.dto.CleanupRequest;
import caseflow.coordinator.api.internal.v1.dto.TickRequest;
import caseflow.coordinator.api.internal.v1.dto.TickResponse;
import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.BatchResult;
import caseflow.coordinator.model.QueueStats;
import caseflow.coordinator.server.RouterHandler;
import caseflow.coordinator.service.CaseProcessingWorker;
import caseflow.coordinator.service.JobQueueService;
import caseflow.coordinator.service.WorkerOutcome;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for worker triggers and queue maintenance (internal API).
 * POST /internal/v1/worker/tick - process at most one job
 * POST /internal/v1/worker/batch - process a bounded batch
 * GET /internal/v1/queues/{name}/stats - job counts per status
 * POST /internal/v1/queues/{name}/cleanup - delete old failed jobs
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final String TICK_PATH = "/internal/v1/worker/tick";
    private static final String BATCH_PATH = "/internal/v1/worker/batch";
    private static final Pattern STATS_PATTERN = Pattern.compile("^/internal/v1/queues/([^/]+)/stats$");
    private static final Pattern CLEANUP_PATTERN = Pattern.compile("^/internal/v1/queues/([^/]+)/cleanup$");

    private final CaseProcessingWorker worker;
    private final JobQueueService queue;
    private final CoordinatorConfig config;

    public WorkerController(CaseProcessingWorker worker, JobQueueService queue, CoordinatorConfig config) {
        this.worker = worker;
        this.queue = queue;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return STATS_PATTERN.matcher(path).matches();
        }
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return TICK_PATH.equals(path) || BATCH_PATH.equals(path) || CLEANUP_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TICK_PATH.equals(path)) {
                return handleTick(req);
            }
            if (BATCH_PATH.equals(path)) {
                return handleBatch(req);
            }

            Matcher stats = STATS_PATTERN.matcher(path);
            if (stats.matches()) {
                QueueStats result = queue.stats(stats.group(1));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(result));
            }

            Matcher cleanup = CLEANUP_PATTERN.matcher(path);
            if (cleanup.matches()) {
                return handleCleanup(req, cleanup.group(1));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/worker/tick
     */
    private ControllerResponse handleTick(FullHttpRequest req) throws Exception {
        TickRequest request = read(req, TickRequest.class, new TickRequest(null));
        WorkerOutcome outcome = worker.tick(request.queueOr(config.caseQueue()));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TickResponse.from(outcome)));
    }

    /**
     * POST /internal/v1/worker/batch
     */
    private ControllerResponse handleBatch(FullHttpRequest req) throws Exception {
        BatchRequest request = read(req, BatchRequest.class, new BatchRequest(null, null));
        request.validate();
        BatchResult result = worker.batch(request.queueOr(config.caseQueue()), request.batchSizeOrDefault());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(result));
    }

    /**
     * POST /internal/v1/queues/{name}/cleanup
     */
    private ControllerResponse handleCleanup(FullHttpRequest req, String queueName) throws Exception {
        CleanupRequest request = read(req, CleanupRequest.class, new CleanupRequest(null));
        request.validate();
        int removed = queue.cleanup(queueName, request.maxAgeHours());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("removed", removed)));
    }

    private static <T> T read(FullHttpRequest req, Class<T> type, T empty) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return empty;
        }
        try {
            return RouterHandler.mapper().readValue(body, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed request body");
        }
    }
}
