package caseflow.coordinator.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Pushes {@code status_update} messages over open WebSocket connections.
 */
public class LiveStatusChannel implements StatusChannel {

    private static final Logger log = LoggerFactory.getLogger(LiveStatusChannel.class);

    private final SubscriptionRegistry registry;
    private final ObjectMapper mapper;

    public LiveStatusChannel(SubscriptionRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    @Override
    public void send(StatusEvent event) {
        Set<Channel> recipients = registry.recipients(event.caseId(), event.userId());
        if (recipients.isEmpty()) {
            return;
        }

        String text;
        try {
            text = mapper.writeValueAsString(toMessage(event));
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode status update for case {}", event.caseId(), e);
            return;
        }

        for (Channel channel : recipients) {
            if (!channel.isActive()) {
                registry.remove(channel);
                continue;
            }
            channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(future -> {
                if (!future.isSuccess()) {
                    log.debug("Status update to {} failed: {}", channel.id(), future.cause().getMessage());
                }
            });
        }
        log.debug("Pushed {} for case {} to {} connection(s)", event.status().wireName(), event.caseId(),
                recipients.size());
    }

    ObjectNode toMessage(StatusEvent event) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", "status_update");
        message.put("caseId", event.caseId());
        message.put("status", event.status().wireName());
        if (event.error() != null) {
            message.put("error", event.error());
        }
        message.put("timestamp", event.timestamp().toString());
        return message;
    }

    @Override
    public String name() {
        return "live";
    }
}
