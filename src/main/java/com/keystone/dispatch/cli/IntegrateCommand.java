package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.keystone.core.resilience.Sleeper;
import com.keystone.dispatch.api.IntegrateRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone integrate &lt;submission-id&gt;
 * <p>
 * Starts an integration attempt and, with {@code --wait}, polls until it reaches a terminal state.
 * Exit code is 0 for COMPLETED, 2 for ROLLED_BACK or FAILED, 1 for errors.
 */
@Command(name = "integrate", mixinStandardHelpOptions = true, description = "Integrate an accepted submission")
@Component
public class IntegrateCommand implements Callable<Integer> {

    private static final Set<String> TERMINAL = Set.of("COMPLETED", "ROLLED_BACK", "FAILED");

    @Parameters(index = "0", description = "Submission ID")
    private String submissionId;

    @Option(names = {"--strategy", "-s"}, description = "Strategy hint: HOT_RELOAD, BLUE_GREEN or CANARY")
    private String strategy;

    @Option(names = {"--wait", "-w"}, description = "Wait for the attempt to finish")
    private boolean await;

    @Option(names = {"--timeout"}, description = "Seconds to wait with --wait (default: ${DEFAULT-VALUE})",
            defaultValue = "300")
    private int timeoutSeconds;

    @Option(names = {"--url"}, description = "Server URL (default: ${DEFAULT-VALUE})",
            defaultValue = "${env:KEYSTONE_URL:-http://localhost:8080}")
    private String url;

    private final KeystoneApiClient client;
    private final Sleeper sleeper;

    public IntegrateCommand(KeystoneApiClient client, Sleeper sleeper) {
        this.client = client;
        this.sleeper = sleeper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var response = client.post(url, "/api/v1/submissions/" + submissionId + "/integrate",
                    new IntegrateRequest(strategy));
            if (!response.ok()) {
                ConsoleOutput.error("Integration refused: " + response.error());
                return 1;
            }
            JsonNode attempt = response.body();
            ConsoleOutput.attempt(attempt);
            if (!await) {
                return 0;
            }
            String attemptId = attempt.path("attempt_id").asText();
            long polls = Math.max(1, timeoutSeconds);
            for (long i = 0; i < polls && !TERMINAL.contains(attempt.path("state").asText()); i++) {
                sleeper.sleep(Duration.ofSeconds(1));
                var status = client.get(url, "/api/v1/submissions/" + submissionId);
                if (!status.ok()) {
                    ConsoleOutput.error(status.error());
                    return 1;
                }
                JsonNode latest = status.body().path("attempt");
                if (attemptId.equals(latest.path("attempt_id").asText())) {
                    attempt = latest;
                }
            }
            String state = attempt.path("state").asText();
            if (!TERMINAL.contains(state)) {
                ConsoleOutput.warn("Attempt " + attemptId + " still " + state + " after " + timeoutSeconds + "s");
                return 1;
            }
            ConsoleOutput.attempt(attempt);
            return "COMPLETED".equals(state) ? 0 : 2;
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
