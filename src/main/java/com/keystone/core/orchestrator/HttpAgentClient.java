package com.keystone.core.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keystone.core.error.AgentCallException;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentHealth;
import com.keystone.core.model.AgentResponse;
import com.keystone.core.model.AgentTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * JSON-over-HTTP transport to worker agents.
 * <p>
 * Tasks are POSTed to {@code {endpoint}/tasks} as {@code {taskType, payload, deadline}};
 * health is read from {@code GET {endpoint}/health}. Timeouts, connection errors,
 * HTTP 5xx and 429 are retryable. Other 4xx, malformed bodies and failure replies
 * flagged {@code "fatal": true} are not.
 */
@Component
public class HttpAgentClient implements AgentClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpAgentClient(ObjectMapper objectMapper, Clock clock) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public AgentResponse call(AgentDescriptor agent, AgentTask task, Duration timeout) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("taskType", task.requiredCapability());
        body.put("taskId", task.id());
        body.set("payload", objectMapper.valueToTree(task.payload()));
        body.put("deadline", clock.instant().plus(timeout).toString());

        var request = HttpRequest.newBuilder(URI.create(trimSlash(agent.endpoint()) + "/tasks"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<String> response = send(agent, request);
        checkStatus(agent, response);
        JsonNode json = parse(agent, response.body());

        String status = json.path("status").asText("");
        if (AgentResponse.SUCCESS.equalsIgnoreCase(status)) {
            @SuppressWarnings("unchecked")
            Map<String, Object> result = json.has("result") && json.get("result").isObject()
                    ? objectMapper.convertValue(json.get("result"), Map.class)
                    : Map.of();
            return AgentResponse.success(result);
        }
        if (AgentResponse.FAILURE.equalsIgnoreCase(status)) {
            String error = json.path("error").asText("agent reported failure");
            boolean fatal = json.path("fatal").asBoolean(false);
            throw new AgentCallException(agent.id(), "Agent " + agent.id() + " failed task: " + error, !fatal);
        }
        throw AgentCallException.fatal(agent.id(), "Agent " + agent.id() + " replied with unknown status '" + status + "'");
    }

    @Override
    public AgentHealth ping(AgentDescriptor agent, Duration timeout) {
        var request = HttpRequest.newBuilder(URI.create(trimSlash(agent.endpoint()) + "/health"))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response = send(agent, request);
        if (response.statusCode() >= 500) {
            return AgentHealth.DEGRADED;
        }
        checkStatus(agent, response);
        String reported = parse(agent, response.body()).path("status").asText("HEALTHY").toUpperCase();
        return switch (reported) {
            case "DEGRADED" -> AgentHealth.DEGRADED;
            case "UNREACHABLE", "DOWN" -> AgentHealth.UNREACHABLE;
            default -> AgentHealth.HEALTHY;
        };
    }

    private HttpResponse<String> send(AgentDescriptor agent, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw AgentCallException.retryable(agent.id(), "Timed out calling agent " + agent.id(), e);
        } catch (IOException e) {
            throw AgentCallException.retryable(agent.id(),
                    "I/O error calling agent " + agent.id() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCallException(agent.id(), "Interrupted calling agent " + agent.id(), false, e);
        }
    }

    private void checkStatus(AgentDescriptor agent, HttpResponse<String> response) {
        int code = response.statusCode();
        if (code >= 200 && code < 300) {
            return;
        }
        boolean retryable = code >= 500 || code == 429;
        log.debug("Agent {} returned HTTP {}", agent.id(), code);
        throw new AgentCallException(agent.id(), "Agent " + agent.id() + " returned HTTP " + code, retryable);
    }

    private JsonNode parse(AgentDescriptor agent, String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new AgentCallException(agent.id(), "Malformed reply from agent " + agent.id(), false, e);
        }
    }

    private static String trimSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
