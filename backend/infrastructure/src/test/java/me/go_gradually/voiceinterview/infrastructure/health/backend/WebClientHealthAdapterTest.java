package me.go_gradually.voiceinterview.infrastructure.health.backend;

import me.go_gradually.voiceinterview.application.health.model.HealthStatus;
import me.go_gradually.voiceinterview.infrastructure.support.TestWebClients;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebClientHealthAdapterTest {

    private MockWebServer server;
    private WebClientHealthAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = new WebClientHealthAdapter(TestWebClients.backend(server));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void check_readsHealthyStatusAndRealtimeFlag() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json")
                .setBody("{\"status\": \"healthy\", \"livekit_connected\": true}"));

        HealthStatus status = adapter.check().join();

        assertTrue(status.healthy());
        assertTrue(status.realtimeConfigured());
        assertEquals("/api/health", server.takeRequest().getPath());
    }

    @Test
    void check_treatsNon2xxAsUnhealthy() {
        server.enqueue(new MockResponse().setResponseCode(503));

        HealthStatus status = adapter.check().join();

        assertFalse(status.healthy());
        assertEquals("HTTP 503", status.detail());
    }

    @Test
    void check_degradedStatusIsNotHealthy() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json")
                .setBody("{\"status\": \"degraded\", \"livekit_connected\": false}"));

        HealthStatus status = adapter.check().join();

        assertFalse(status.healthy());
        assertFalse(status.realtimeConfigured());
    }
}
