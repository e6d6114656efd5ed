package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.AlertChannel;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * UptimeRobot {@code monitors[]}. Interval and timeout are in seconds.
 */
public final class UptimeRobotMapper implements ProviderMapper {

    static final int HTTP_METHOD_GET = 1;

    private final ProviderCodeTable codes;

    public UptimeRobotMapper(ProviderCodeTable codes) {
        this.codes = codes;
    }

    @Override
    public Provider provider() {
        return Provider.UPTIMEROBOT;
    }

    @Override
    public Document map(MonitoringConfig config) {
        return new Document(config.enabledProbes().stream().map(this::monitor).toList());
    }

    private Monitor monitor(ProbeConfig probe) {
        return new Monitor(
                probe.name(),
                probe.url(),
                codes.code(probe.kind(), Provider.UPTIMEROBOT),
                probe.interval().toSeconds(),
                probe.timeout().toSeconds(),
                HTTP_METHOD_GET,
                probe.alertPolicy().channels().stream()
                        .map(AlertChannel::label)
                        .collect(Collectors.joining(",")));
    }

    /** Root document. */
    public record Document(@JsonProperty("monitors") List<Monitor> monitors) {}

    /** One UptimeRobot monitor. */
    public record Monitor(
            @JsonProperty("friendly_name") String friendlyName,
            @JsonProperty("url") String url,
            @JsonProperty("type") Object type,
            @JsonProperty("interval") long interval,
            @JsonProperty("timeout") long timeout,
            @JsonProperty("http_method") int httpMethod,
            @JsonProperty("alert_contacts") String alertContacts) {}
}
