package biz.kryukov.dev.healthwatch.uptime;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one probe execution.
 *
 * @param name       probe name
 * @param kind       probe kind
 * @param up         whether the response met expectations
 * @param statusCode observed HTTP status, 0 if unreachable or not HTTP
 * @param latency    measured latency; the timeout for a timed-out probe
 * @param message    human-readable outcome
 * @param category   error category, {@code null} when up
 * @param error      causing exception, {@code null} if none
 * @param timestamp  completion time
 */
public record ProbeResult(String name, ProbeKind kind, boolean up, int statusCode, Duration latency,
                          String message, String category, @JsonIgnore Throwable error,
                          Instant timestamp) {

    public ProbeResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(latency, "latency");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public double latencyMillis() {
        return latency.toNanos() / 1_000_000.0;
    }
}
