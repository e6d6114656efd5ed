package biz.kryukov.dev.healthwatch.checks;

import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.HealthStatus;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-process heap usage check. Synchronous, no I/O, no timeout.
 *
 * <p>Heap usage above 90% of the limit is unhealthy, above 75% degraded. When
 * the JVM reports no heap limit the check is healthy with an explanatory message.</p>
 */
public final class MemoryHealthCheck {

    public static final String NAME = "memory";

    static final double UNHEALTHY_PERCENT = 90.0;
    static final double DEGRADED_PERCENT = 75.0;
    private static final long MB = 1024L * 1024L;

    private final Supplier<MemoryUsage> heapUsage;

    public MemoryHealthCheck() {
        this(() -> ManagementFactory.getMemoryMXBean().getHeapMemoryUsage());
    }

    /**
     * @param heapUsage source of heap statistics; may return {@code null} when unavailable
     */
    public MemoryHealthCheck(Supplier<MemoryUsage> heapUsage) {
        this.heapUsage = heapUsage;
    }

    public CheckResult evaluate() {
        MemoryUsage usage = heapUsage.get();
        if (usage == null || usage.getMax() <= 0) {
            return CheckResult.healthy(NAME, Duration.ZERO, "Heap limit not available in this runtime");
        }

        long used = usage.getUsed();
        long max = usage.getMax();
        double usagePercent = used * 100.0 / max;
        String pct = String.format(Locale.ROOT, "%.1f", usagePercent);

        HealthStatus status;
        String message;
        if (usagePercent > UNHEALTHY_PERCENT) {
            status = HealthStatus.UNHEALTHY;
            message = "Critical memory usage: " + pct + "%";
        } else if (usagePercent > DEGRADED_PERCENT) {
            status = HealthStatus.DEGRADED;
            message = "High memory usage: " + pct + "%";
        } else {
            status = HealthStatus.HEALTHY;
            message = "Memory usage: " + (used / MB) + "MB / " + (max / MB) + "MB (" + pct + "%)";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("usedHeap", used);
        details.put("committedHeap", usage.getCommitted());
        details.put("heapLimit", max);
        details.put("usagePercent", usagePercent);
        return new CheckResult(NAME, status, Duration.ZERO, message, details, Instant.now());
    }
}
