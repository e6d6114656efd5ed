package biz.kryukov.dev.healthwatch.uptime;

import biz.kryukov.dev.healthwatch.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * Result of an on-demand run of every enabled probe.
 */
public record UptimeReport(HealthStatus status, List<ProbeResult> probes, Instant timestamp) {

    public UptimeReport {
        probes = List.copyOf(probes);
    }

    /** Unhealthy if any probe is down, otherwise healthy. */
    public static UptimeReport of(List<ProbeResult> probes) {
        boolean anyDown = probes.stream().anyMatch(p -> !p.up());
        return new UptimeReport(anyDown ? HealthStatus.UNHEALTHY : HealthStatus.HEALTHY,
                probes, Instant.now());
    }
}
