package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone status &lt;submission-id&gt;
 * <p>
 * Shows the submission with its latest report and attempt, or follows its events with {@code --watch}.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show submission status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Submission ID")
    private String submissionId;

    @Option(names = {"--watch", "-w"}, description = "Follow live events via SSE")
    private boolean watch;

    @Option(names = {"--url"}, description = "Server URL (default: ${DEFAULT-VALUE})",
            defaultValue = "${env:KEYSTONE_URL:-http://localhost:8080}")
    private String url;

    private final KeystoneApiClient client;

    public StatusCommand(KeystoneApiClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            return watch ? watch() : show();
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Keystone server at " + url);
            ConsoleOutput.info("Start the server first: keystone serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
            return 1;
        }
    }

    private int show() throws IOException, InterruptedException {
        var response = client.get(url, "/api/v1/submissions/" + submissionId);
        if (response.status() == 404) {
            ConsoleOutput.error("Submission not found: " + submissionId);
            return 1;
        }
        if (!response.ok()) {
            ConsoleOutput.error(response.error());
            return 1;
        }
        JsonNode body = response.body();
        System.out.println();
        System.out.println("SUBMISSION " + body.path("submission_id").asText());
        System.out.println("Project: " + body.path("project_id").asText());

        String status = body.path("status").asText();
        switch (status) {
            case "INTEGRATED", "ACCEPTED" -> ConsoleOutput.success("Status: " + status);
            case "REJECTED", "FAILED" -> ConsoleOutput.error("Status: " + status);
            case "ROLLED_BACK" -> ConsoleOutput.warn("Status: " + status);
            default -> ConsoleOutput.info("Status: " + status);
        }
        if (body.hasNonNull("reason")) {
            System.out.println("Reason: " + body.get("reason").asText());
        }
        if (body.hasNonNull("report")) {
            System.out.println();
            ConsoleOutput.report(body.get("report"));
        }
        if (body.hasNonNull("attempt")) {
            System.out.println();
            ConsoleOutput.attempt(body.get("attempt"));
        }
        return 0;
    }

    private int watch() throws IOException, InterruptedException {
        ConsoleOutput.info("Watching submission " + submissionId + " at " + url + "...");
        System.out.println();
        int status = client.streamEvents(url, "/api/v1/submissions/" + submissionId + "/events",
                ConsoleOutput::watchEvent);
        if (status == 404) {
            ConsoleOutput.error("Submission not found: " + submissionId);
            return 1;
        }
        if (status != 200) {
            ConsoleOutput.error("Server returned HTTP " + status);
            return 1;
        }
        System.out.println();
        ConsoleOutput.info("Stream ended.");
        return 0;
    }
}
