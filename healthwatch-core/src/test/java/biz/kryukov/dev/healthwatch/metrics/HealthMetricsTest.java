package biz.kryukov.dev.healthwatch.metrics;

import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.HealthStatus;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeKind;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthMetricsTest {

    private SimpleMeterRegistry registry;
    private HealthMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HealthMetrics(registry);
    }

    @Test
    void overallStatusGauge() {
        metrics.recordSnapshot(HealthStatus.DEGRADED);

        assertEquals(1.0, registry.get(HealthMetrics.HEALTH_STATUS_METRIC).gauge().value());
    }

    @Test
    void checkStatusAndLatency() {
        metrics.recordCheck(new CheckResult("database", HealthStatus.UNHEALTHY, Duration.ofMillis(250),
                "down", Map.of(), Instant.now()));

        Gauge status = registry.get(HealthMetrics.CHECK_STATUS_METRIC).tag("check", "database").gauge();
        assertEquals(2.0, status.value());

        DistributionSummary latency = registry.get(HealthMetrics.CHECK_LATENCY_METRIC)
                .tag("check", "database").summary();
        assertEquals(1, latency.count());
        assertEquals(0.25, latency.totalAmount(), 0.0001);
    }

    @Test
    void gaugeIsReusedAcrossRecords() {
        CheckResult ok = CheckResult.healthy("auth", Duration.ofMillis(3), "auth is responding");
        metrics.recordCheck(ok);
        metrics.recordCheck(ok);

        assertEquals(1, registry.find(HealthMetrics.CHECK_STATUS_METRIC).gauges().size());
        assertEquals(2, registry.get(HealthMetrics.CHECK_LATENCY_METRIC).summary().count());
    }

    @Test
    void probeMetrics() {
        ProbeConfig probe = ProbeConfig.builder("db", "tcp://db.example.com:5432").kind(ProbeKind.TCP).build();

        metrics.recordProbe(probe, false, Duration.ofMillis(40), 3);

        assertEquals(0.0, registry.get(HealthMetrics.PROBE_UP_METRIC)
                .tags("probe", "db", "kind", "tcp").gauge().value());
        assertEquals(3.0, registry.get(HealthMetrics.PROBE_FAILURES_METRIC).tag("probe", "db").gauge().value());
        assertEquals(1, registry.get(HealthMetrics.PROBE_LATENCY_METRIC).summary().count());
    }
}
