package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.AlertChannel;
import biz.kryukov.dev.healthwatch.uptime.AlertPolicy;
import biz.kryukov.dev.healthwatch.uptime.MaintenanceWindow;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeKind;
import biz.kryukov.dev.healthwatch.uptime.StatusPage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderConfigExporterTest {

    private final ObjectMapper json = new ObjectMapper();
    private final ProviderConfigExporter exporter = new ProviderConfigExporter();

    private static MonitoringConfig config() {
        return MonitoringConfig.builder()
                .provider(Provider.UPTIMEROBOT)
                .probe(ProbeConfig.builder("api", "https://api.example.com/health")
                        .intervalSeconds(300)
                        .timeoutSeconds(10)
                        .regions(List.of("us-east", "eu-west"))
                        .expectedStatusCodes(200, 204)
                        .expectedBodySubstring("\"status\":\"healthy\"")
                        .alertPolicy(new AlertPolicy(List.of(AlertChannel.EMAIL, AlertChannel.SLACK), 2, true))
                        .build())
                .probe(ProbeConfig.builder("staging", "https://staging.example.com")
                        .enabled(false)
                        .build())
                .statusPage(new StatusPage(true, "https://status.example.com", false))
                .maintenance(new MaintenanceWindow(false, null))
                .build();
    }

    @Test
    void uptimeRobotExportsEnabledProbesOnly() throws Exception {
        JsonNode root = json.readTree(exporter.exportConfig(config(), "uptimerobot"));

        JsonNode monitors = root.get("monitors");
        assertEquals(1, monitors.size());
        JsonNode api = monitors.get(0);
        assertEquals("api", api.get("friendly_name").asText());
        assertEquals("https://api.example.com/health", api.get("url").asText());
        assertEquals(1, api.get("type").asInt());
        assertEquals(300, api.get("interval").asInt());
        assertEquals(10, api.get("timeout").asInt());
        assertEquals(1, api.get("http_method").asInt());
        assertEquals("email,slack", api.get("alert_contacts").asText());
    }

    @Test
    void outputIsPrettyPrinted() {
        assertTrue(exporter.exportConfig(config(), Provider.UPTIMEROBOT).contains("\n"));
    }

    @Test
    void pingdomUsesHostAndMinutes() throws Exception {
        JsonNode check = json.readTree(exporter.exportConfig(config(), "pingdom")).get("checks").get(0);

        assertEquals("api", check.get("name").asText());
        assertEquals("api.example.com", check.get("host").asText());
        assertEquals("http", check.get("type").asText());
        assertEquals(5, check.get("resolution").asInt());
        assertEquals(2, check.get("sendnotificationwhendown").asInt());
    }

    @Test
    void pingdomRoundsSubMinuteIntervalsUp() throws Exception {
        MonitoringConfig config = MonitoringConfig.builder()
                .probe(ProbeConfig.builder("fast", "https://fast.example.com").intervalSeconds(30).build())
                .build();

        JsonNode check = json.readTree(exporter.exportConfig(config, Provider.PINGDOM)).get("checks").get(0);

        assertEquals(1, check.get("resolution").asInt());
    }

    @Test
    void betterUptimeCarriesKeywordAndConfirmationPeriod() throws Exception {
        JsonNode monitor = json.readTree(exporter.exportConfig(config(), "betteruptime"))
                .get("monitors").get(0);

        assertEquals("status", monitor.get("monitor_type").asText());
        assertEquals("api", monitor.get("pronounceable_name").asText());
        assertEquals(300, monitor.get("check_frequency").asInt());
        assertEquals(10, monitor.get("request_timeout").asInt());
        assertEquals(600, monitor.get("confirmation_period").asInt());
        assertEquals(2, monitor.get("regions").size());
        assertEquals(204, monitor.get("expected_status_codes").get(1).asInt());
        assertEquals("contains", monitor.get("match_type").asText());
        assertEquals("\"status\":\"healthy\"", monitor.get("required_keyword").asText());
    }

    @Test
    void betterUptimeOmitsKeywordFieldsWhenUnset() throws Exception {
        MonitoringConfig config = MonitoringConfig.builder()
                .probe(ProbeConfig.builder("web", "https://www.example.com").build())
                .build();

        JsonNode monitor = json.readTree(exporter.exportConfig(config, Provider.BETTERUPTIME))
                .get("monitors").get(0);

        assertFalse(monitor.has("match_type"));
        assertFalse(monitor.has("required_keyword"));
    }

    @Test
    void probeKindsMapToProviderCodes() throws Exception {
        MonitoringConfig config = MonitoringConfig.builder()
                .probe(ProbeConfig.builder("db", "tcp://db.example.com:5432").kind(ProbeKind.TCP).build())
                .probe(ProbeConfig.builder("cert", "https://www.example.com").kind(ProbeKind.SSL).build())
                .probe(ProbeConfig.builder("ns", "dns://example.com").kind(ProbeKind.DNS).build())
                .build();

        JsonNode robot = json.readTree(exporter.exportConfig(config, Provider.UPTIMEROBOT)).get("monitors");
        assertEquals(4, robot.get(0).get("type").asInt());
        assertEquals(1, robot.get(1).get("type").asInt());
        assertEquals(5, robot.get(2).get("type").asInt());

        JsonNode pingdom = json.readTree(exporter.exportConfig(config, Provider.PINGDOM)).get("checks");
        assertEquals("tcp", pingdom.get(0).get("type").asText());
        assertEquals("http", pingdom.get(1).get("type").asText());
        assertEquals("db.example.com", pingdom.get(0).get("host").asText());

        JsonNode better = json.readTree(exporter.exportConfig(config, Provider.BETTERUPTIME)).get("monitors");
        assertEquals("ssl", better.get(1).get("monitor_type").asText());
    }

    @Test
    void unknownProviderFallsBackToRawDump() throws Exception {
        JsonNode root = json.readTree(exporter.exportConfig(config(), "nagios"));

        assertTrue(root.get("enabled").asBoolean());
        assertEquals("uptimerobot", root.get("provider").asText());
        assertEquals(2, root.get("checks").size());
        assertFalse(root.get("checks").get(1).get("enabled").asBoolean());
        assertEquals("https://status.example.com", root.get("statusPage").get("url").asText());
        assertFalse(root.get("maintenanceMode").get("enabled").asBoolean());
    }

    @Test
    void providersWithoutMapperGetRawDump() throws Exception {
        JsonNode statusCake = json.readTree(exporter.exportConfig(config(), Provider.STATUSCAKE));
        JsonNode custom = json.readTree(exporter.exportConfig(config(), "custom"));

        assertEquals(2, statusCake.get("checks").size());
        assertEquals(statusCake, custom);
    }

    @Test
    void missingCodeFallsBackToKindLabel() {
        Map<ProbeKind, Map<Provider, Object>> partial = new EnumMap<>(ProbeKind.class);
        partial.put(ProbeKind.HTTP, Map.of(Provider.UPTIMEROBOT, 1));
        ProviderCodeTable table = new ProviderCodeTable(partial);

        assertEquals(1, table.code(ProbeKind.HTTP, Provider.UPTIMEROBOT));
        assertEquals("http", table.code(ProbeKind.HTTP, Provider.PINGDOM));
        assertEquals("ping", table.code(ProbeKind.PING, Provider.UPTIMEROBOT));
    }

    @Test
    void standardTableIsComplete() {
        ProviderCodeTable table = ProviderCodeTable.standard();

        assertEquals(3, table.code(ProbeKind.PING, Provider.UPTIMEROBOT));
        assertEquals("status", table.code(ProbeKind.HTTP, Provider.BETTERUPTIME));
        assertEquals("http", table.code(ProbeKind.SSL, Provider.PINGDOM));
    }

    @Test
    void providerLabels() {
        assertEquals(Provider.BETTERUPTIME, Provider.fromLabel("better-uptime"));
        assertEquals(Provider.UPTIMEROBOT, Provider.fromLabel("UptimeRobot"));
        assertThrows(IllegalArgumentException.class, () -> Provider.fromLabel("nagios"));
    }
}
