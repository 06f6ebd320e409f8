package com.keystone.core.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.core.error.AgentCallException;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentHealth;
import com.keystone.core.model.AgentResponse;
import com.keystone.core.model.AgentTask;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpAgentClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private HttpAgentClient client;
    private AgentDescriptor agent;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = "{}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        client = new HttpAgentClient(mapper, clock);
        agent = AgentDescriptor.register("a1", Set.of("build"),
                "http://127.0.0.1:" + server.getAddress().getPort() + "/", 4, clock.instant());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private AgentTask task() {
        return new AgentTask("t1", "build", Map.of("ref", "main"), null);
    }

    @Test
    void successReplyCarriesResult() throws Exception {
        reply = "{\"status\":\"success\",\"result\":{\"passed\":true,\"note\":null}}";

        AgentResponse response = client.call(agent, task(), Duration.ofSeconds(5));

        assertTrue(response.isSuccess());
        assertEquals(true, response.result().get("passed"));
        JsonNode sent = mapper.readTree(lastBody.get());
        assertEquals("build", sent.get("taskType").asText());
        assertEquals("t1", sent.get("taskId").asText());
        assertEquals("main", sent.get("payload").get("ref").asText());
        assertEquals("2025-01-01T00:00:05Z", sent.get("deadline").asText());
    }

    @Test
    void serverErrorIsRetryable() {
        status = 503;
        var ex = assertThrows(AgentCallException.class, () -> client.call(agent, task(), Duration.ofSeconds(5)));
        assertTrue(ex.isRetryable());
    }

    @Test
    void tooManyRequestsIsRetryable() {
        status = 429;
        assertTrue(assertThrows(AgentCallException.class,
                () -> client.call(agent, task(), Duration.ofSeconds(5))).isRetryable());
    }

    @Test
    void clientErrorIsFatal() {
        status = 400;
        assertFalse(assertThrows(AgentCallException.class,
                () -> client.call(agent, task(), Duration.ofSeconds(5))).isRetryable());
    }

    @Test
    void malformedReplyIsFatal() {
        reply = "not json";
        assertFalse(assertThrows(AgentCallException.class,
                () -> client.call(agent, task(), Duration.ofSeconds(5))).isRetryable());
    }

    @Test
    void failureReplyHonoursFatalFlag() {
        reply = "{\"status\":\"failure\",\"error\":\"flaky\"}";
        assertTrue(assertThrows(AgentCallException.class,
                () -> client.call(agent, task(), Duration.ofSeconds(5))).isRetryable());

        reply = "{\"status\":\"failure\",\"error\":\"bad input\",\"fatal\":true}";
        assertFalse(assertThrows(AgentCallException.class,
                () -> client.call(agent, task(), Duration.ofSeconds(5))).isRetryable());
    }

    @Test
    void unreachableAgentIsRetryable() {
        server.stop(0);
        assertTrue(assertThrows(AgentCallException.class,
                () -> client.call(agent, task(), Duration.ofSeconds(2))).isRetryable());
    }

    @Test
    void pingMapsReportedHealth() {
        reply = "{\"status\":\"degraded\"}";
        assertEquals(AgentHealth.DEGRADED, client.ping(agent, Duration.ofSeconds(2)));

        reply = "{}";
        assertEquals(AgentHealth.HEALTHY, client.ping(agent, Duration.ofSeconds(2)));

        status = 500;
        assertEquals(AgentHealth.DEGRADED, client.ping(agent, Duration.ofSeconds(2)));
    }
}
