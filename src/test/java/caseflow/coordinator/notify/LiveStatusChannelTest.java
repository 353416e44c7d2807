package caseflow.coordinator.notify;

import caseflow.coordinator.model.ProcessingStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LiveStatusChannelTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final LiveStatusChannel live = new LiveStatusChannel(registry, MAPPER);

    private static JsonNode read(EmbeddedChannel channel) throws Exception {
        TextWebSocketFrame frame = channel.readOutbound();
        assertNotNull(frame);
        try {
            return MAPPER.readTree(frame.text());
        } finally {
            frame.release();
        }
    }

    @Test
    void ownerAndSubscribersReceiveUpdates() throws Exception {
        EmbeddedChannel owner = new EmbeddedChannel();
        EmbeddedChannel watcher = new EmbeddedChannel();
        EmbeddedChannel stranger = new EmbeddedChannel();
        registry.register(owner, "u1");
        registry.register(watcher, "u2");
        registry.register(stranger, "u3");
        registry.subscribe(watcher, "c1");

        live.send(new StatusEvent("c1", "u1", ProcessingStatus.FAILED, "case_law_search: 503", NOW));

        JsonNode toOwner = read(owner);
        assertEquals("status_update", toOwner.path("type").asText());
        assertEquals("c1", toOwner.path("caseId").asText());
        assertEquals("failed", toOwner.path("status").asText());
        assertEquals("case_law_search: 503", toOwner.path("error").asText());
        assertEquals(NOW.toString(), toOwner.path("timestamp").asText());

        assertEquals("failed", read(watcher).path("status").asText());
        assertNull(stranger.readOutbound());
    }

    @Test
    void successHasNoErrorField() throws Exception {
        EmbeddedChannel owner = new EmbeddedChannel();
        registry.register(owner, "u1");

        live.send(new StatusEvent("c1", "u1", ProcessingStatus.COMPLETED, null, NOW));

        assertFalse(read(owner).has("error"));
    }

    @Test
    void closedConnectionsArePruned() {
        EmbeddedChannel owner = new EmbeddedChannel();
        registry.register(owner, "u1");
        owner.close().syncUninterruptibly();

        live.send(new StatusEvent("c1", "u1", ProcessingStatus.PROCESSING, null, NOW));

        assertEquals(0, registry.connectionCount());
    }

    @Test
    void noRecipientsIsNotAnError() {
        assertDoesNotThrow(() -> live.send(new StatusEvent("c9", "u9", ProcessingStatus.PROCESSING, null, NOW)));
    }
}
