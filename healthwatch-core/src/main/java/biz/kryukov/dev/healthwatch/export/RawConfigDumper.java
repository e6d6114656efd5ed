package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.AlertChannel;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.SslPolicy;
import biz.kryukov.dev.healthwatch.uptime.StatusPage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dumps the whole monitoring model, disabled probes included. Used for providers
 * without a dedicated mapper.
 */
public final class RawConfigDumper implements ProviderMapper {

    private final Provider provider;

    public RawConfigDumper(Provider provider) {
        this.provider = provider;
    }

    @Override
    public Provider provider() {
        return provider;
    }

    @Override
    public Map<String, Object> map(MonitoringConfig config) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("enabled", config.enabled());
        root.put("provider", config.provider().label());
        root.put("checks", config.probes().stream().map(RawConfigDumper::probe).toList());

        StatusPage page = config.statusPage();
        if (page != null) {
            Map<String, Object> statusPage = new LinkedHashMap<>();
            statusPage.put("enabled", page.enabled());
            statusPage.put("url", page.url());
            statusPage.put("publicMetrics", page.publicMetrics());
            root.put("statusPage", statusPage);
        }

        Map<String, Object> maintenance = new LinkedHashMap<>();
        maintenance.put("enabled", config.maintenance().enabled());
        if (config.maintenance().schedule() != null) {
            maintenance.put("schedule", config.maintenance().schedule());
        }
        root.put("maintenanceMode", maintenance);
        return root;
    }

    private static Map<String, Object> probe(ProbeConfig probe) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", probe.name());
        m.put("url", probe.url());
        m.put("type", probe.kind().label());
        m.put("interval", probe.interval().toSeconds());
        m.put("timeout", probe.timeout().toSeconds());
        m.put("enabled", probe.enabled());
        m.put("regions", probe.regions());
        m.put("expectedStatus", probe.expectedStatusCodes());
        if (probe.expectedBodySubstring() != null) {
            m.put("expectedResponse", probe.expectedBodySubstring());
        }
        if (!probe.headers().isEmpty()) {
            m.put("headers", probe.headers());
        }

        Map<String, Object> alerts = new LinkedHashMap<>();
        List<String> channels = probe.alertPolicy().channels().stream().map(AlertChannel::label).toList();
        alerts.put("channels", channels);
        alerts.put("threshold", probe.alertPolicy().failureThreshold());
        alerts.put("escalation", probe.alertPolicy().escalate());
        m.put("alerts", alerts);

        SslPolicy ssl = probe.sslPolicy();
        if (ssl != null) {
            Map<String, Object> sslMap = new LinkedHashMap<>();
            sslMap.put("checkCertificate", ssl.checkCertificate());
            sslMap.put("warnDaysBeforeExpiry", ssl.warnDaysBeforeExpiry());
            m.put("ssl", sslMap);
        }
        return m;
    }
}
