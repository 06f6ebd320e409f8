package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Keystone CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) KEYSTONE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [KEYSTONE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    /** Print a report summary as returned by the submissions API. */
    public static void report(JsonNode report) {
        boolean accepted = "ACCEPT".equals(report.path("verdict").asText());
        String verdict = accepted ? "@|fg(green),bold [ACCEPT]|@" : "@|fg(red),bold [REJECT]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + verdict + " score " + report.path("weighted_score").asText()));
        report.path("checker_scores").fields().forEachRemaining(e ->
                System.out.printf("    %-16s %6.1f%n", e.getKey(), e.getValue().asDouble()));
        for (JsonNode issue : report.path("issues")) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    " + severity(issue.path("severity").asText())
                    + " " + issue.path("category").asText()
                    + (issue.hasNonNull("file") ? " " + issue.get("file").asText() : "")
                    + ": " + issue.path("description").asText()));
        }
    }

    /** Print an integration attempt summary. */
    public static void attempt(JsonNode attempt) {
        String state = attempt.path("state").asText();
        String label = "Attempt " + attempt.path("attempt_id").asText() + " " + state
                + " (" + attempt.path("strategy").asText() + ")";
        switch (state) {
            case "COMPLETED" -> success(label);
            case "FAILED" -> error(label);
            case "ROLLED_BACK" -> warn(label);
            default -> info(label);
        }
        if (attempt.hasNonNull("reason")) {
            System.out.println("    " + attempt.get("reason").asText());
        }
        if (attempt.path("rollback_failed").asBoolean(false)) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red),bold ROLLBACK FAILED: target needs manual attention|@"));
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "submission.received" -> "@|fg(cyan) [SUBMISSION]|@";
            case "verification.started", "verification.completed" -> "@|fg(blue) [VERIFY]|@";
            case "integration.started", "integration.state" -> "@|bold,fg(yellow) [INTEGRATE]|@";
            case "integration.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "rollback.started", "rollback.completed" -> "@|fg(magenta) [ROLLBACK]|@";
            case "rollback.failed" -> "@|fg(red),bold [ROLLBACK FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String severity(String severity) {
        return switch (severity) {
            case "CRITICAL" -> "@|fg(red),bold CRITICAL|@";
            case "HIGH" -> "@|fg(red) HIGH|@";
            case "MEDIUM" -> "@|fg(yellow) MEDIUM|@";
            default -> "@|fg(white) " + severity + "|@";
        };
    }
}
