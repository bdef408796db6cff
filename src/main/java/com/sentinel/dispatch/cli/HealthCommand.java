package com.sentinel.dispatch.cli;

import com.sentinel.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: sentinel health
 * <p>
 * Runs all health checks and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        boolean anyDown = false;
        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
        } else {
            ConsoleOutput.warn("Overall: running degraded");
        }
        return anyDown ? 1 : 0;
    }
}
