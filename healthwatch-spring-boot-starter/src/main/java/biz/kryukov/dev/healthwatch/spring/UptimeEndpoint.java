package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.HealthWatch;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

import java.util.Map;

/**
 * Actuator endpoint /actuator/uptime: runs every enabled probe once.
 * {@code /actuator/uptime/{provider}} renders the monitoring configuration for a provider.
 */
@Endpoint(id = "uptime")
public class UptimeEndpoint {

    private final HealthWatch healthWatch;

    public UptimeEndpoint(HealthWatch healthWatch) {
        this.healthWatch = healthWatch;
    }

    @ReadOperation
    public Map<String, Object> uptime() {
        return HealthResponses.uptime(healthWatch.checkUptimeNow());
    }

    @ReadOperation
    public String export(@Selector String provider) {
        return healthWatch.exportConfig(provider);
    }
}
