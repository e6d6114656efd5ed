package biz.kryukov.dev.healthwatch;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one orchestrator pass. Immutable.
 *
 * <p>The status is always derived from the checks via {@link StatusAggregator};
 * it cannot be set independently.</p>
 */
public final class HealthSnapshot {

    private final HealthStatus status;
    private final String version;
    private final Duration uptime;
    private final Instant timestamp;
    private final List<CheckResult> checks;
    private final String environment;
    private final BuildInfo buildInfo;

    /**
     * @param checks    check results in configuration order
     * @param buildInfo build metadata
     * @param uptime    process uptime at snapshot time
     * @param withVcs   whether to expose commit/branch/buildTime (readiness omits them)
     */
    public HealthSnapshot(List<CheckResult> checks, BuildInfo buildInfo, Duration uptime,
                          boolean withVcs) {
        this.checks = List.copyOf(checks);
        this.status = StatusAggregator.aggregate(this.checks);
        this.version = Objects.requireNonNull(buildInfo, "buildInfo").version();
        this.environment = buildInfo.environment();
        this.buildInfo = withVcs ? buildInfo : null;
        this.uptime = Objects.requireNonNull(uptime, "uptime");
        this.timestamp = Instant.now();
    }

    public HealthStatus status() {
        return status;
    }

    public String version() {
        return version;
    }

    public Duration uptime() {
        return uptime;
    }

    public long uptimeMillis() {
        return uptime.toMillis();
    }

    public Instant timestamp() {
        return timestamp;
    }

    /** Check results in configuration order (unmodifiable). */
    public List<CheckResult> checks() {
        return checks;
    }

    public String environment() {
        return environment;
    }

    /** Build metadata, or {@code null} for reduced (readiness) snapshots. */
    public BuildInfo buildInfo() {
        return buildInfo;
    }

    /** Whether the snapshot should be served with a success HTTP status. */
    public boolean isServing() {
        return status != HealthStatus.UNHEALTHY;
    }
}
