package caseflow.coordinator.api.v1;

import caseflow.coordinator.api.Controller;
import caseflow.coordinator.api.v1.dto.HealthResponse;
import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.QueueStats;
import caseflow.coordinator.server.RouterHandler;
import caseflow.coordinator.service.JobQueueService;
import caseflow.coordinator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "1.0.0";

    private final Database database;
    private final JobQueueService queue;
    private final CoordinatorConfig config;
    private final String statusChannel;

    public HealthController(Database database, JobQueueService queue, CoordinatorConfig config,
            String statusChannel) {
        this.database = database;
        this.queue = queue;
        this.config = config;
        this.statusChannel = statusChannel;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            QueueStats stats = queue.stats(config.caseQueue());
            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION, config.environment(),
                    statusChannel, stats.pending(), stats.processing(), stats.failed());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return unhealthy(e.getMessage());
        }
    }

    private ControllerResponse unhealthy(String reason) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
        } catch (Exception e) {
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
