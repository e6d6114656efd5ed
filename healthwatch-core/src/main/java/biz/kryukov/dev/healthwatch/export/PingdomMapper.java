package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pingdom {@code checks[]}. Pingdom addresses checks by host and schedules them in
 * whole minutes; sub-minute intervals are rounded up to one minute.
 */
public final class PingdomMapper implements ProviderMapper {

    private final ProviderCodeTable codes;

    public PingdomMapper(ProviderCodeTable codes) {
        this.codes = codes;
    }

    @Override
    public Provider provider() {
        return Provider.PINGDOM;
    }

    @Override
    public Document map(MonitoringConfig config) {
        return new Document(config.enabledProbes().stream().map(this::check).toList());
    }

    private Check check(ProbeConfig probe) {
        return new Check(
                probe.name(),
                probe.uri().getHost(),
                codes.code(probe.kind(), Provider.PINGDOM),
                resolutionMinutes(probe),
                probe.alertPolicy().failureThreshold());
    }

    static long resolutionMinutes(ProbeConfig probe) {
        return Math.max(1, probe.interval().toMinutes());
    }

    /** Root document. */
    public record Document(@JsonProperty("checks") List<Check> checks) {}

    /** One Pingdom check. */
    public record Check(
            @JsonProperty("name") String name,
            @JsonProperty("host") String host,
            @JsonProperty("type") Object type,
            @JsonProperty("resolution") long resolution,
            @JsonProperty("sendnotificationwhendown") int sendNotificationWhenDown) {}
}
