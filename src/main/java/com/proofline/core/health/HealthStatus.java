package com.proofline.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of one check run by {@code proofline health}.
 *
 * @param component {@code database}, {@code ai-providers} or {@code tasks}
 * @param metadata  counters or driver details shown next to the detail line
 */
public record HealthStatus(String component, Status status, String detail, Map<String, String> metadata) {

    /** Ordered from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /** Worst status among {@code checks}; UP for none. */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
