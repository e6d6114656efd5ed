package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.BuildInfo;
import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.HealthSnapshot;
import biz.kryukov.dev.healthwatch.Liveness;
import biz.kryukov.dev.healthwatch.uptime.ProbeResult;
import biz.kryukov.dev.healthwatch.uptime.UptimeReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON bodies for the health and uptime endpoints. Field names follow the wire shape
 * consumers of {@code /health} expect ({@code latency} and {@code uptime} in milliseconds).
 */
final class HealthResponses {

    private HealthResponses() {}

    static Map<String, Object> snapshot(HealthSnapshot snapshot) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", snapshot.status().label());
        body.put("version", snapshot.version());
        body.put("uptime", snapshot.uptimeMillis());
        body.put("timestamp", snapshot.timestamp().toString());
        body.put("environment", snapshot.environment());
        body.put("checks", snapshot.checks().stream().map(HealthResponses::check).toList());

        BuildInfo info = snapshot.buildInfo();
        if (info != null && info.hasVcsMetadata()) {
            Map<String, Object> build = new LinkedHashMap<>();
            putIfPresent(build, "commit", info.commit());
            putIfPresent(build, "branch", info.branch());
            putIfPresent(build, "buildTime", info.buildTime());
            body.put("buildInfo", build);
        }
        return body;
    }

    static Map<String, Object> check(CheckResult result) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", result.name());
        m.put("status", result.status().label());
        m.put("latency", result.latency().toMillis());
        putIfPresent(m, "message", result.message());
        if (!result.details().isEmpty()) {
            m.put("details", result.details());
        }
        m.put("timestamp", result.timestamp().toString());
        return m;
    }

    static Map<String, Object> liveness(Liveness liveness) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", liveness.status());
        m.put("timestamp", liveness.timestamp().toString());
        return m;
    }

    static Map<String, Object> uptime(UptimeReport report) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", report.status().label());
        List<Map<String, Object>> probes = report.probes().stream().map(HealthResponses::probe).toList();
        m.put("checks", probes);
        m.put("timestamp", report.timestamp().toString());
        return m;
    }

    private static Map<String, Object> probe(ProbeResult result) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", result.name());
        m.put("type", result.kind().label());
        m.put("status", result.up() ? "up" : "down");
        m.put("statusCode", result.statusCode());
        m.put("latency", result.latency().toMillis());
        putIfPresent(m, "message", result.message());
        putIfPresent(m, "category", result.category());
        return m;
    }

    private static void putIfPresent(Map<String, Object> m, String key, Object value) {
        if (value != null) {
            m.put(key, value);
        }
    }
}
