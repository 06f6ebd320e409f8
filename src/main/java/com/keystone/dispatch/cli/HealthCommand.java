package com.keystone.dispatch.cli;

import com.keystone.core.health.HealthCheckService;
import com.keystone.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: keystone health
 * <p>
 * Runs the local health checks and exits 1 if any component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check pipeline health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println(ConsoleOutput.RULE);
        switch (HealthStatus.rollUp(checks)) {
            case DOWN -> {
                ConsoleOutput.error("Overall: one or more components down");
                return 1;
            }
            case DEGRADED -> ConsoleOutput.warn("Overall: degraded");
            default -> ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
