package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.keystone.dispatch.api.SubmissionRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CLI command: keystone submit &lt;project-id&gt; &lt;directory&gt;
 * <p>
 * Uploads every text file under the directory as one artifact. Hidden files and
 * directories are skipped.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit an artifact directory for verification")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Parameters(index = "1", description = "Directory holding the artifact files")
    private Path directory;

    @Option(names = {"--meta"}, description = "Metadata entry key=value (repeatable)")
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Option(names = {"--benchmark"},
            description = "Benchmark figure, e.g. p95LatencyMs=120 or latencyBudgetMs=200 (repeatable)")
    private Map<String, Double> benchmark = new LinkedHashMap<>();

    @Option(names = {"--wait", "-w"}, description = "Wait for the quality report")
    private boolean await;

    @Option(names = {"--url"}, description = "Server URL (default: ${DEFAULT-VALUE})",
            defaultValue = "${env:KEYSTONE_URL:-http://localhost:8080}")
    private String url;

    private final KeystoneApiClient client;

    public SubmitCommand(KeystoneApiClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Map<String, String> files;
        try {
            files = readFiles(directory);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + directory + ": " + e.getMessage());
            return 1;
        }
        if (files.isEmpty()) {
            ConsoleOutput.error("No files found under " + directory);
            return 1;
        }

        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (!benchmark.isEmpty()) {
            meta.put("benchmark", benchmark);
        }

        try {
            var response = client.post(url, "/api/v1/submissions", new SubmissionRequest(projectId, files, meta));
            if (!response.ok()) {
                ConsoleOutput.error("Submission refused: " + response.error());
                return 1;
            }
            String submissionId = response.body().path("submission_id").asText();
            ConsoleOutput.success("Submitted " + files.size() + " file(s) as " + submissionId);
            if (!await) {
                return 0;
            }
            var verify = client.post(url, "/api/v1/submissions/" + submissionId + "/verify", null);
            if (!verify.ok()) {
                ConsoleOutput.error("Verification failed: " + verify.error());
                return 1;
            }
            JsonNode report = verify.body();
            ConsoleOutput.report(report);
            return "ACCEPT".equals(report.path("verdict").asText()) ? 0 : 2;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Keystone server at " + url);
            ConsoleOutput.info("Start the server first: keystone serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
            return 1;
        }
    }

    static Map<String, String> readFiles(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.filter(Files::isRegularFile)
                    .filter(p -> !hidden(root.relativize(p)))
                    .collect(Collectors.toList());
        }
        Map<String, String> files = new TreeMap<>();
        for (Path p : paths) {
            String relative = root.relativize(p).toString().replace('\\', '/');
            try {
                files.put(relative, Files.readString(p));
            } catch (MalformedInputException e) {
                ConsoleOutput.warn("Skipping binary file " + relative);
            }
        }
        return files;
    }

    private static boolean hidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
