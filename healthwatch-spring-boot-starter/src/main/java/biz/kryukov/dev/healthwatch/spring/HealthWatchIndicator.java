package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.HealthSnapshot;
import biz.kryukov.dev.healthwatch.HealthStatus;
import biz.kryukov.dev.healthwatch.HealthWatch;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot Actuator HealthIndicator: exposes the cached health pass at /actuator/health.
 * Degraded checks keep the indicator UP; any unhealthy check makes it DOWN.
 * Per-check statuses are nested under the {@code checks} detail.
 */
public class HealthWatchIndicator implements HealthIndicator {

    private final HealthWatch healthWatch;

    /**
     * @param healthWatch the HealthWatch instance to report
     */
    public HealthWatchIndicator(HealthWatch healthWatch) {
        this.healthWatch = healthWatch;
    }

    @Override
    public Health health() {
        HealthSnapshot snapshot = healthWatch.checkHealth();

        Health.Builder builder = snapshot.status() == HealthStatus.UNHEALTHY
                ? Health.down()
                : Health.up();
        builder.withDetail("status", snapshot.status().label())
                .withDetail("version", snapshot.version())
                .withDetail("environment", snapshot.environment());

        Map<String, String> checks = new LinkedHashMap<>();
        for (CheckResult check : snapshot.checks()) {
            checks.put(check.name(), check.status().label());
        }
        return builder.withDetail("checks", checks).build();
    }
}
