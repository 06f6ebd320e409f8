package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone agents
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List registered worker agents")
@Component
public class AgentsCommand implements Callable<Integer> {

    @Option(names = {"--capability", "-c"}, description = "Only agents able to serve this capability")
    private String capability;

    @Option(names = {"--url"}, description = "Server URL (default: ${DEFAULT-VALUE})",
            defaultValue = "${env:KEYSTONE_URL:-http://localhost:8080}")
    private String url;

    private final KeystoneApiClient client;

    public AgentsCommand(KeystoneApiClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String path = "/api/v1/agents" + (capability != null ? "?capability=" + capability : "");
        try {
            var response = client.get(url, path);
            if (!response.ok()) {
                ConsoleOutput.error(response.error());
                return 1;
            }
            JsonNode agents = response.body();
            if (agents.size() == 0) {
                ConsoleOutput.info("No agents registered.");
                return 0;
            }
            System.out.printf("  %-20s %-12s %-8s %-30s %s%n", "AGENT", "HEALTH", "LOAD", "CAPABILITIES", "ENDPOINT");
            System.out.println("  " + "-".repeat(90));
            for (JsonNode a : agents) {
                List<String> caps = new ArrayList<>();
                a.path("capabilities").forEach(c -> caps.add(c.asText()));
                System.out.printf("  %-20s %-12s %-8s %-30s %s%n",
                        a.path("id").asText(),
                        a.path("health").asText(),
                        a.path("currentLoad").asInt() + "/" + a.path("maxLoad").asInt(),
                        String.join(",", caps),
                        a.path("endpoint").asText());
            }

            var circuits = client.get(url, "/api/v1/agents/circuits");
            if (circuits.ok()) {
                for (JsonNode c : circuits.body()) {
                    if (!"CLOSED".equals(c.path("state").asText())) {
                        ConsoleOutput.warn("Circuit " + c.path("state").asText() + " for " + c.path("agentId").asText());
                    }
                }
            }
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Keystone server at " + url);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
            return 1;
        }
    }
}
