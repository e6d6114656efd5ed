package biz.kryukov.dev.healthwatch;

import java.util.Collection;

/**
 * Collapses check results into one status: {@code UNHEALTHY > DEGRADED > HEALTHY}.
 *
 * <p>No weighting and no quorum. An empty collection is {@code HEALTHY}.</p>
 */
public final class StatusAggregator {

    private StatusAggregator() {}

    public static HealthStatus aggregate(Collection<CheckResult> results) {
        HealthStatus status = HealthStatus.HEALTHY;
        for (CheckResult result : results) {
            status = status.worst(result.status());
            if (status == HealthStatus.UNHEALTHY) {
                break;
            }
        }
        return status;
    }
}
