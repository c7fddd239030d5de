package com.docmend.dispatch.cli;

import com.docmend.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: docmend health
 * <p>
 * Runs all health checks and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
        } else {
            ConsoleOutput.success("Overall: ready");
        }
    }
}
