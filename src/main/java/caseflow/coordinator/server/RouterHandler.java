package caseflow.coordinator.server;

import caseflow.coordinator.api.Controller;
import caseflow.coordinator.api.Controller.ControllerResponse;
import caseflow.coordinator.api.v1.CaseController;
import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.error.AuthenticationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Machine-to-machine endpoints (/internal/* and manual reprocess) require the
 * service identity and secret headers when a service secret is configured.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String SERVICE_HEADER = "X-Internal-Service";
    public static final String SECRET_HEADER = "X-Service-Secret";

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (requiresServiceAuth(method, path) && !checkServiceAuth(req)) {
                throw new AuthenticationException("Invalid service credentials");
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (AuthenticationException e) {
            log.warn("Authentication failed for {} {}: {}", method, path, e.getMessage());
            writeSafe(ctx, UNAUTHORIZED, "application/json",
                    "{\"error\":\"" + ControllerResponse.escapeJson(e.getMessage()) + "\"}");
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + ControllerResponse.escapeJson(e.getMessage()) + "\"}");
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"internal error\"}");
        }
    }

    static boolean requiresServiceAuth(HttpMethod method, String path) {
        return path.startsWith("/internal/")
                || (HttpMethod.POST.equals(method) && CaseController.PROCESS_PATTERN.matcher(path).matches());
    }

    private boolean checkServiceAuth(FullHttpRequest req) {
        if (!config.hasServiceSecret()) {
            return true; // No auth configured
        }
        String service = req.headers().get(SERVICE_HEADER);
        String secret = req.headers().get(SECRET_HEADER);
        if (service == null || secret == null || !config.serviceName().equals(service)) {
            return false;
        }
        return MessageDigest.isEqual(
                config.serviceSecret().getBytes(StandardCharsets.UTF_8),
                secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Write that never lets a response failure escape; falls back to closing the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
