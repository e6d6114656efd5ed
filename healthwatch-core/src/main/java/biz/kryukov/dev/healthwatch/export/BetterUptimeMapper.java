package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Better Uptime {@code monitors[]}. The confirmation period is the time the failure
 * threshold takes to accumulate: {@code threshold * interval} seconds.
 */
public final class BetterUptimeMapper implements ProviderMapper {

    static final String MATCH_CONTAINS = "contains";

    private final ProviderCodeTable codes;

    public BetterUptimeMapper(ProviderCodeTable codes) {
        this.codes = codes;
    }

    @Override
    public Provider provider() {
        return Provider.BETTERUPTIME;
    }

    @Override
    public Document map(MonitoringConfig config) {
        return new Document(config.enabledProbes().stream().map(this::monitor).toList());
    }

    private Monitor monitor(ProbeConfig probe) {
        long intervalSeconds = probe.interval().toSeconds();
        String keyword = probe.expectedBodySubstring();
        return new Monitor(
                codes.code(probe.kind(), Provider.BETTERUPTIME),
                probe.url(),
                probe.name(),
                intervalSeconds,
                probe.timeout().toSeconds(),
                probe.alertPolicy().failureThreshold() * intervalSeconds,
                probe.regions(),
                probe.expectedStatusCodes(),
                keyword != null ? MATCH_CONTAINS : null,
                keyword);
    }

    /** Root document. */
    public record Document(@JsonProperty("monitors") List<Monitor> monitors) {}

    /** One Better Uptime monitor. Keyword fields are omitted when no body match is set. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Monitor(
            @JsonProperty("monitor_type") Object monitorType,
            @JsonProperty("url") String url,
            @JsonProperty("pronounceable_name") String pronounceableName,
            @JsonProperty("check_frequency") long checkFrequency,
            @JsonProperty("request_timeout") long requestTimeout,
            @JsonProperty("confirmation_period") long confirmationPeriod,
            @JsonProperty("regions") List<String> regions,
            @JsonProperty("expected_status_codes") List<Integer> expectedStatusCodes,
            @JsonProperty("match_type") String matchType,
            @JsonProperty("required_keyword") String requiredKeyword) {}
}
