package com.proofline.dispatch.cli;

import com.proofline.core.health.HealthCheckService;
import com.proofline.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: proofline health
 * <p>
 * One line per check (local store, AI providers, task errors). Exits 1 only
 * when a check is DOWN; tasks in {@code error} are reported as degraded.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check the local store, AI providers and task states")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail() + details(check.metadata());
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        HealthStatus.Status overall = HealthStatus.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.warn("Overall: one or more components degraded");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }

    private static String details(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        return new TreeMap<>(metadata).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
