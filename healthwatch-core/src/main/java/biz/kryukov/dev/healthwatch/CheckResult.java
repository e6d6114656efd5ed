package biz.kryukov.dev.healthwatch;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one health check run. Immutable.
 *
 * @param name      check name
 * @param status    check status
 * @param latency   measured latency; for a timed-out check, the configured timeout
 * @param message   human-readable message, may be {@code null}
 * @param details   additional check-specific values (unmodifiable, never {@code null})
 * @param timestamp when the result was produced
 */
public record CheckResult(String name, HealthStatus status, Duration latency, String message,
                          Map<String, Object> details, Instant timestamp) {

    public CheckResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(latency, "latency");
        Objects.requireNonNull(timestamp, "timestamp");
        if (latency.isNegative()) {
            latency = Duration.ZERO;
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static CheckResult healthy(String name, Duration latency, String message) {
        return new CheckResult(name, HealthStatus.HEALTHY, latency, message, Map.of(), Instant.now());
    }

    public static CheckResult unhealthy(String name, Duration latency, String message) {
        return new CheckResult(name, HealthStatus.UNHEALTHY, latency, message, Map.of(), Instant.now());
    }

    /** Latency in milliseconds as a floating-point value. */
    public double latencyMillis() {
        return latency.toNanos() / 1_000_000.0;
    }
}
