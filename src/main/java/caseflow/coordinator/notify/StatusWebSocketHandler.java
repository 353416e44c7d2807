package caseflow.coordinator.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Speaks the live status protocol on an upgraded connection:
 * {@code subscribe_case}, {@code unsubscribe_case} and {@code ping} from the client;
 * {@code connection_established}, {@code subscribed}, {@code unsubscribed},
 * {@code pong} and {@code error} from the server.
 */
@Sharable
public class StatusWebSocketHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(StatusWebSocketHandler.class);

    private final SubscriptionRegistry registry;
    private final ObjectMapper mapper;
    private final Clock clock;

    public StatusWebSocketHandler(SubscriptionRegistry registry, ObjectMapper mapper, Clock clock) {
        this.registry = registry;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            String userId = ctx.channel().attr(SubscriptionRegistry.USER_ID).get();
            registry.register(ctx.channel(), userId);
            log.info("Live channel opened for user {}", userId);
            send(ctx, message("connection_established").put("userId", userId));
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        JsonNode request;
        try {
            request = mapper.readTree(frame.text());
        } catch (JsonProcessingException e) {
            send(ctx, message("error").put("message", "Malformed message"));
            return;
        }

        String type = request.path("type").asText("");
        String caseId = request.path("caseId").asText(null);
        switch (type) {
            case "subscribe_case" -> {
                if (caseId == null || caseId.isBlank()) {
                    send(ctx, message("error").put("message", "caseId is required"));
                    return;
                }
                registry.subscribe(ctx.channel(), caseId);
                send(ctx, message("subscribed").put("caseId", caseId));
            }
            case "unsubscribe_case" -> {
                if (caseId == null || caseId.isBlank()) {
                    send(ctx, message("error").put("message", "caseId is required"));
                    return;
                }
                registry.unsubscribe(ctx.channel(), caseId);
                send(ctx, message("unsubscribed").put("caseId", caseId));
            }
            case "ping" -> send(ctx, message("pong"));
            default -> send(ctx, message("error").put("message", "Unknown message type: " + type));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        registry.remove(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Live channel error: {}", cause.getMessage());
        registry.remove(ctx.channel());
        ctx.close();
    }

    private ObjectNode message(String type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type);
        node.put("timestamp", clock.instant().toString());
        return node;
    }

    private void send(ChannelHandlerContext ctx, ObjectNode message) {
        try {
            ctx.writeAndFlush(new TextWebSocketFrame(mapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode live message", e);
        }
    }
}
