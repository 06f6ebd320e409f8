package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * Thin HTTP client the CLI uses to talk to a running {@code keystone serve} instance.
 */
@Component
public class KeystoneApiClient {

    /** Status code and parsed JSON body of a server reply. */
    public record ApiResponse(int status, JsonNode body) {
        public boolean ok() {
            return status >= 200 && status < 300;
        }

        public String error() {
            return body.hasNonNull("error") ? body.get("error").asText() : "HTTP " + status;
        }
    }

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public KeystoneApiClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public ApiResponse get(String baseUrl, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    public ApiResponse post(String baseUrl, String path, Object body) throws IOException, InterruptedException {
        String json = body != null ? objectMapper.writeValueAsString(body) : "";
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(request);
    }

    /**
     * Stream server-sent events, passing each (eventType, data) pair to the consumer
     * until the server closes the stream.
     *
     * @return the HTTP status of the stream request
     */
    public int streamEvents(String baseUrl, String path, EventConsumer consumer)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            return response.statusCode();
        }
        final String[] currentEventType = {""};
        response.body().forEach(line -> {
            if (line.startsWith("event:")) {
                currentEventType[0] = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                consumer.accept(eventType, line.substring(5).trim());
                currentEventType[0] = "";
            }
        });
        return response.statusCode();
    }

    @FunctionalInterface
    public interface EventConsumer {
        void accept(String eventType, String data);
    }

    private ApiResponse send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String raw = response.body();
        JsonNode body = raw == null || raw.isBlank() ? NullNode.getInstance() : objectMapper.readTree(raw);
        return new ApiResponse(response.statusCode(), body);
    }
}
