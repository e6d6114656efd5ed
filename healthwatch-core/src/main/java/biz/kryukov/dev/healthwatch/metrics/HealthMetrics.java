package biz.kryukov.dev.healthwatch.metrics;

import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.HealthStatus;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exports health check and uptime probe metrics to a Micrometer MeterRegistry.
 *
 * <p>Metrics exported:
 * <ul>
 *   <li>{@code app_health_status} - Gauge, last aggregated status (0/1/2)</li>
 *   <li>{@code app_health_check_status} - Gauge per check (0 healthy, 1 degraded, 2 unhealthy)</li>
 *   <li>{@code app_health_check_latency_seconds} - Histogram per check</li>
 *   <li>{@code app_uptime_probe_up} - Gauge per probe (0/1)</li>
 *   <li>{@code app_uptime_probe_latency_seconds} - Histogram per probe</li>
 *   <li>{@code app_uptime_probe_consecutive_failures} - Gauge per probe</li>
 * </ul>
 */
public final class HealthMetrics {

    static final String HEALTH_STATUS_METRIC = "app_health_status";
    static final String CHECK_STATUS_METRIC = "app_health_check_status";
    static final String CHECK_LATENCY_METRIC = "app_health_check_latency_seconds";
    static final String PROBE_UP_METRIC = "app_uptime_probe_up";
    static final String PROBE_LATENCY_METRIC = "app_uptime_probe_latency_seconds";
    static final String PROBE_FAILURES_METRIC = "app_uptime_probe_consecutive_failures";

    private static final double[] LATENCY_SLOS = {0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0};

    private final MeterRegistry registry;
    private final AtomicReference<Double> overallStatus = new AtomicReference<>(0.0);
    private final ConcurrentHashMap<String, AtomicReference<Double>> checkStatuses =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> checkLatencies =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicReference<Double>> probeUp =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicReference<Double>> probeFailures =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> probeLatencies =
            new ConcurrentHashMap<>();

    public HealthMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(HEALTH_STATUS_METRIC, overallStatus, AtomicReference::get)
                .description("Aggregated health status (0 = healthy, 1 = degraded, 2 = unhealthy)")
                .register(registry);
    }

    /** Records the aggregated status of a full health pass. */
    public void recordSnapshot(HealthStatus status) {
        overallStatus.set(statusValue(status));
    }

    /** Records one check result. */
    public void recordCheck(CheckResult result) {
        String name = result.name();
        AtomicReference<Double> ref = checkStatuses.computeIfAbsent(name, k -> {
            AtomicReference<Double> newRef = new AtomicReference<>(0.0);
            Gauge.builder(CHECK_STATUS_METRIC, newRef, AtomicReference::get)
                    .description("Status of a health check (0 = healthy, 1 = degraded, 2 = unhealthy)")
                    .tags(Tags.of("check", name))
                    .register(registry);
            return newRef;
        });
        ref.set(statusValue(result.status()));

        checkLatencies.computeIfAbsent(name, k -> DistributionSummary.builder(CHECK_LATENCY_METRIC)
                        .description("Latency of a health check in seconds")
                        .tags(Tags.of("check", name))
                        .serviceLevelObjectives(LATENCY_SLOS)
                        .register(registry))
                .record(seconds(result.latency()));
    }

    /** Records one probe firing. */
    public void recordProbe(ProbeConfig probe, boolean up, Duration latency, int consecutiveFailures) {
        String key = probe.name();
        Tags tags = Tags.of("probe", probe.name(), "kind", probe.kind().label());

        probeUp.computeIfAbsent(key, k -> {
            AtomicReference<Double> newRef = new AtomicReference<>(1.0);
            Gauge.builder(PROBE_UP_METRIC, newRef, AtomicReference::get)
                    .description("Uptime probe state (1 = up, 0 = down)")
                    .tags(tags)
                    .register(registry);
            return newRef;
        }).set(up ? 1.0 : 0.0);

        probeFailures.computeIfAbsent(key, k -> {
            AtomicReference<Double> newRef = new AtomicReference<>(0.0);
            Gauge.builder(PROBE_FAILURES_METRIC, newRef, AtomicReference::get)
                    .description("Consecutive failures of an uptime probe")
                    .tags(tags)
                    .register(registry);
            return newRef;
        }).set((double) consecutiveFailures);

        probeLatencies.computeIfAbsent(key, k -> DistributionSummary.builder(PROBE_LATENCY_METRIC)
                        .description("Latency of an uptime probe in seconds")
                        .tags(tags)
                        .serviceLevelObjectives(LATENCY_SLOS)
                        .register(registry))
                .record(seconds(latency));
    }

    private static double statusValue(HealthStatus status) {
        return status.ordinal();
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }
}
