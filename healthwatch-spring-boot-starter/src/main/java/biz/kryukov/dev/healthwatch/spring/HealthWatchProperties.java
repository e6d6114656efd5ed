package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.BuildInfo;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for healthwatch via application.yml / application.properties.
 *
 * <pre>
 * healthwatch:
 *   health:
 *     timeout: 5s
 *     cache-ttl: 10s
 *     enabled-checks: [database, storage, auth]
 *   build:
 *     version: 2.3.1
 *     environment: production
 *     commit: 4f2a9c1
 *   checks:
 *     storage-url: https://storage.example.com/health
 *     auth-url: https://auth.example.com/health
 *   uptime:
 *     enabled: true
 *     provider: uptimerobot
 *     probes:
 *       api:
 *         url: https://api.example.com/health
 *         interval: 60s
 *         expected-status: [200]
 *         alerts:
 *           channels: [email, slack]
 *           threshold: 3
 * </pre>
 */
@ConfigurationProperties(prefix = "healthwatch")
public class HealthWatchProperties {

    private Health health = new Health();
    private Build build = new Build();
    private Checks checks = new Checks();
    private Uptime uptime = new Uptime();
    private Web web = new Web();

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Build getBuild() {
        return build;
    }

    public void setBuild(Build build) {
        this.build = build;
    }

    public Checks getChecks() {
        return checks;
    }

    public void setChecks(Checks checks) {
        this.checks = checks;
    }

    public Uptime getUptime() {
        return uptime;
    }

    public void setUptime(Uptime uptime) {
        this.uptime = uptime;
    }

    public Web getWeb() {
        return web;
    }

    public void setWeb(Web web) {
        this.web = web;
    }

    public static class Health {
        private Duration timeout;
        private Duration cacheTtl;
        private List<String> enabledChecks;
        private Integer maxInFlight;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public List<String> getEnabledChecks() {
            return enabledChecks;
        }

        public void setEnabledChecks(List<String> enabledChecks) {
            this.enabledChecks = enabledChecks;
        }

        public Integer getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(Integer maxInFlight) {
            this.maxInFlight = maxInFlight;
        }
    }

    public static class Build {
        private String version = BuildInfo.DEFAULT_VERSION;
        private String environment = BuildInfo.DEFAULT_ENVIRONMENT;
        private String commit;
        private String branch;
        private String buildTime;

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getEnvironment() {
            return environment;
        }

        public void setEnvironment(String environment) {
            this.environment = environment;
        }

        public String getCommit() {
            return commit;
        }

        public void setCommit(String commit) {
            this.commit = commit;
        }

        public String getBranch() {
            return branch;
        }

        public void setBranch(String branch) {
            this.branch = branch;
        }

        public String getBuildTime() {
            return buildTime;
        }

        public void setBuildTime(String buildTime) {
            this.buildTime = buildTime;
        }
    }

    /** Endpoints of the built-in checks. The database check uses the context DataSource. */
    public static class Checks {
        private String databaseQuery;
        private String storageUrl;
        private String authUrl;
        private String edgeFunctionsUrl;
        private Map<String, String> httpHeaders = new LinkedHashMap<>();

        public String getDatabaseQuery() {
            return databaseQuery;
        }

        public void setDatabaseQuery(String databaseQuery) {
            this.databaseQuery = databaseQuery;
        }

        public String getStorageUrl() {
            return storageUrl;
        }

        public void setStorageUrl(String storageUrl) {
            this.storageUrl = storageUrl;
        }

        public String getAuthUrl() {
            return authUrl;
        }

        public void setAuthUrl(String authUrl) {
            this.authUrl = authUrl;
        }

        public String getEdgeFunctionsUrl() {
            return edgeFunctionsUrl;
        }

        public void setEdgeFunctionsUrl(String edgeFunctionsUrl) {
            this.edgeFunctionsUrl = edgeFunctionsUrl;
        }

        public Map<String, String> getHttpHeaders() {
            return httpHeaders;
        }

        public void setHttpHeaders(Map<String, String> httpHeaders) {
            this.httpHeaders = httpHeaders;
        }
    }

    public static class Uptime {
        private boolean enabled;
        private String provider = "custom";
        private Map<String, ProbeProperties> probes = new LinkedHashMap<>();
        private StatusPageProperties statusPage;
        private MaintenanceProperties maintenance = new MaintenanceProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public Map<String, ProbeProperties> getProbes() {
            return probes;
        }

        public void setProbes(Map<String, ProbeProperties> probes) {
            this.probes = probes;
        }

        public StatusPageProperties getStatusPage() {
            return statusPage;
        }

        public void setStatusPage(StatusPageProperties statusPage) {
            this.statusPage = statusPage;
        }

        public MaintenanceProperties getMaintenance() {
            return maintenance;
        }

        public void setMaintenance(MaintenanceProperties maintenance) {
            this.maintenance = maintenance;
        }
    }

    public static class ProbeProperties {
        private String url;
        private String type = "http";
        private Duration interval;
        private Duration timeout;
        private Boolean enabled;
        private List<String> regions = new ArrayList<>();
        private List<Integer> expectedStatus;
        private String expectedResponse;
        private Map<String, String> headers = new LinkedHashMap<>();
        private AlertProperties alerts = new AlertProperties();
        private SslProperties ssl;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getRegions() {
            return regions;
        }

        public void setRegions(List<String> regions) {
            this.regions = regions;
        }

        public List<Integer> getExpectedStatus() {
            return expectedStatus;
        }

        public void setExpectedStatus(List<Integer> expectedStatus) {
            this.expectedStatus = expectedStatus;
        }

        public String getExpectedResponse() {
            return expectedResponse;
        }

        public void setExpectedResponse(String expectedResponse) {
            this.expectedResponse = expectedResponse;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public AlertProperties getAlerts() {
            return alerts;
        }

        public void setAlerts(AlertProperties alerts) {
            this.alerts = alerts;
        }

        public SslProperties getSsl() {
            return ssl;
        }

        public void setSsl(SslProperties ssl) {
            this.ssl = ssl;
        }
    }

    public static class AlertProperties {
        private List<String> channels;
        private Integer threshold;
        private boolean escalation;

        public List<String> getChannels() {
            return channels;
        }

        public void setChannels(List<String> channels) {
            this.channels = channels;
        }

        public Integer getThreshold() {
            return threshold;
        }

        public void setThreshold(Integer threshold) {
            this.threshold = threshold;
        }

        public boolean isEscalation() {
            return escalation;
        }

        public void setEscalation(boolean escalation) {
            this.escalation = escalation;
        }
    }

    public static class SslProperties {
        private boolean checkCertificate = true;
        private int warnDaysBeforeExpiry = 14;

        public boolean isCheckCertificate() {
            return checkCertificate;
        }

        public void setCheckCertificate(boolean checkCertificate) {
            this.checkCertificate = checkCertificate;
        }

        public int getWarnDaysBeforeExpiry() {
            return warnDaysBeforeExpiry;
        }

        public void setWarnDaysBeforeExpiry(int warnDaysBeforeExpiry) {
            this.warnDaysBeforeExpiry = warnDaysBeforeExpiry;
        }
    }

    public static class StatusPageProperties {
        private boolean enabled;
        private String url;
        private boolean publicMetrics;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isPublicMetrics() {
            return publicMetrics;
        }

        public void setPublicMetrics(boolean publicMetrics) {
            this.publicMetrics = publicMetrics;
        }
    }

    public static class MaintenanceProperties {
        private boolean enabled;
        private String schedule;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }
    }

    /** The {@code /health} REST endpoints. */
    public static class Web {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
