package caseflow.coordinator.server;

import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    @Test
    void internalPathsNeedServiceAuth() {
        assertTrue(RouterHandler.requiresServiceAuth(HttpMethod.POST, "/internal/v1/worker/tick"));
        assertTrue(RouterHandler.requiresServiceAuth(HttpMethod.GET, "/internal/v1/queues/case-processing/stats"));
    }

    @Test
    void reprocessNeedsServiceAuth() {
        assertTrue(RouterHandler.requiresServiceAuth(HttpMethod.POST, "/api/v1/cases/c1/process"));
    }

    @Test
    void publicPathsDoNot() {
        assertFalse(RouterHandler.requiresServiceAuth(HttpMethod.GET, "/api/v1/health"));
        assertFalse(RouterHandler.requiresServiceAuth(HttpMethod.GET, "/api/v1/cases/c1/status"));
        assertFalse(RouterHandler.requiresServiceAuth(HttpMethod.POST, "/api/v1/webhooks/cases"));
        assertFalse(RouterHandler.requiresServiceAuth(HttpMethod.GET, "/api/v1/cases/c1/process"));
    }

    @Test
    void mapperWritesInstantsAsText() throws Exception {
        String json = RouterHandler.mapper().writeValueAsString(Instant.parse("2026-03-01T10:00:00Z"));
        assertEquals("\"2026-03-01T10:00:00Z\"", json);
    }
}
