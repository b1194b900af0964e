package com.epiccharts.dispatch.cli;

import com.epiccharts.core.health.HealthCheckService;
import com.epiccharts.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: epic-charts health
 * <p>
 * Prints the feed, vision and renderer checks. Exits 1 when any of them is DOWN, which for
 * feed and vision means {@code run} would refuse to start.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check bot health")
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
        for (var check : checks) {
            String label = check.component() + ": " + check.detail() + describe(check);
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        List<String> down = componentsIn(checks, HealthStatus.Status.DOWN);
        List<String> degraded = componentsIn(checks, HealthStatus.Status.DEGRADED);

        System.out.println("──────────────────────────────────");
        if (!down.isEmpty()) {
            ConsoleOutput.error("Not ready, down: " + String.join(", ", down));
            return 1;
        }
        if (degraded.contains("renderer")) {
            ConsoleOutput.warn("Ready; the renderer relaunches its browser on the next chart");
        } else if (!degraded.isEmpty()) {
            ConsoleOutput.warn("Ready, degraded: " + String.join(", ", degraded));
        } else {
            ConsoleOutput.success("Ready to reply to mentions");
        }
        return 0;
    }

    private static String describe(HealthStatus check) {
        if (check.metadata().isEmpty()) {
            return "";
        }
        return check.metadata().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " [", "]"));
    }

    private static List<String> componentsIn(List<HealthStatus> checks, HealthStatus.Status status) {
        return checks.stream()
                .filter(c -> c.status() == status)
                .map(HealthStatus::component)
                .toList();
    }
}
