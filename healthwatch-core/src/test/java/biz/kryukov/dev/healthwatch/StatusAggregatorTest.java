package biz.kryukov.dev.healthwatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusAggregatorTest {

    private static CheckResult result(String name, HealthStatus status) {
        return new CheckResult(name, status, Duration.ofMillis(5), null, Map.of(), Instant.now());
    }

    @Test
    void emptyIsHealthy() {
        assertEquals(HealthStatus.HEALTHY, StatusAggregator.aggregate(List.of()));
    }

    @Test
    void allHealthy() {
        assertEquals(HealthStatus.HEALTHY, StatusAggregator.aggregate(List.of(
                result("a", HealthStatus.HEALTHY),
                result("b", HealthStatus.HEALTHY))));
    }

    @Test
    void degradedWinsOverHealthy() {
        assertEquals(HealthStatus.DEGRADED, StatusAggregator.aggregate(List.of(
                result("a", HealthStatus.HEALTHY),
                result("b", HealthStatus.DEGRADED),
                result("c", HealthStatus.HEALTHY))));
    }

    @Test
    void singleUnhealthyForcesUnhealthy() {
        assertEquals(HealthStatus.UNHEALTHY, StatusAggregator.aggregate(List.of(
                result("a", HealthStatus.HEALTHY),
                result("b", HealthStatus.HEALTHY),
                result("c", HealthStatus.HEALTHY),
                result("d", HealthStatus.DEGRADED),
                result("e", HealthStatus.UNHEALTHY))));
    }

    @Test
    void precedenceHoldsForEveryPair() {
        for (HealthStatus a : HealthStatus.values()) {
            for (HealthStatus b : HealthStatus.values()) {
                HealthStatus expected = a.ordinal() >= b.ordinal() ? a : b;
                assertEquals(expected, StatusAggregator.aggregate(List.of(result("a", a), result("b", b))),
                        a + " + " + b);
                assertEquals(expected, a.worst(b));
            }
        }
    }

    @Test
    void snapshotStatusIsDerivedFromChecks() {
        HealthSnapshot snapshot = new HealthSnapshot(
                List.of(result("db", HealthStatus.HEALTHY), result("auth", HealthStatus.DEGRADED)),
                BuildInfo.defaults(), Duration.ofSeconds(3), true);
        assertEquals(HealthStatus.DEGRADED, snapshot.status());
        assertTrue(snapshot.isServing());
        assertEquals(3000, snapshot.uptimeMillis());
    }

    @Test
    void labels() {
        assertEquals("healthy", HealthStatus.HEALTHY.label());
        assertEquals(HealthStatus.UNHEALTHY, HealthStatus.fromLabel("unhealthy"));
    }
}
