package com.keystone.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: keystone serve
 * <p>
 * The web server itself is switched on by {@link com.keystone.KeystoneApplication#main}
 * when it sees "serve"; {@link CliRunner} then skips picocli. The banner is printed
 * once the embedded server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Keystone HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        String base = "http://localhost:" + port;
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Listening on port " + port);
        System.out.println();
        System.out.printf("  %-12s %s/api/v1/submissions%n", "Submissions", base);
        System.out.printf("  %-12s %s/api/v1/agents%n", "Agents", base);
        System.out.printf("  %-12s %s/api/v1/projects%n", "Projects", base);
        System.out.printf("  %-12s %s/api/v1/health%n", "Health", base);
        System.out.println();
        ConsoleOutput.info("Point the CLI here with --url " + base + " or KEYSTONE_URL.");
    }
}
