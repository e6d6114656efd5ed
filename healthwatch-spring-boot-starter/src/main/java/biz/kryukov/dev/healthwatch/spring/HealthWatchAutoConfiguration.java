package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.BuildInfo;
import biz.kryukov.dev.healthwatch.CheckKind;
import biz.kryukov.dev.healthwatch.HealthCheck;
import biz.kryukov.dev.healthwatch.HealthConfig;
import biz.kryukov.dev.healthwatch.HealthWatch;
import biz.kryukov.dev.healthwatch.checks.DatabaseHealthCheck;
import biz.kryukov.dev.healthwatch.checks.HttpHealthCheck;
import biz.kryukov.dev.healthwatch.export.Provider;
import biz.kryukov.dev.healthwatch.scheduler.AlertNotifier;
import biz.kryukov.dev.healthwatch.uptime.AlertChannel;
import biz.kryukov.dev.healthwatch.uptime.AlertPolicy;
import biz.kryukov.dev.healthwatch.uptime.MaintenanceWindow;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeKind;
import biz.kryukov.dev.healthwatch.uptime.StatusPage;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

/**
 * Auto-configuration for healthwatch: creates a HealthWatch bean from application.yml properties.
 *
 * <p>The database check is registered when the context has a {@link DataSource}; storage,
 * auth and edge-function checks when their URLs are configured. Any {@link HealthCheck}
 * beans are registered as custom checks.</p>
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnClass(HealthWatch.class)
@EnableConfigurationProperties(HealthWatchProperties.class)
public class HealthWatchAutoConfiguration {

    /**
     * Creates a {@link HealthWatch} bean configured from application properties.
     *
     * @param properties    healthwatch configuration properties
     * @param meterRegistry Micrometer meter registry, if any
     * @param dataSource    data source for the database check, if any
     * @param notifier      alert transport, if any
     * @param customChecks  custom checks declared as beans
     * @return configured HealthWatch instance
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HealthWatch healthWatch(HealthWatchProperties properties,
                                   ObjectProvider<MeterRegistry> meterRegistry,
                                   ObjectProvider<DataSource> dataSource,
                                   ObjectProvider<AlertNotifier> notifier,
                                   ObjectProvider<HealthCheck> customChecks) {
        HealthWatch.Builder builder = HealthWatch.builder(meterRegistry.getIfAvailable());

        Map<CheckKind, HealthCheck> builtIns = builtInChecks(properties.getChecks(),
                dataSource.getIfAvailable());
        builtIns.forEach(builder::builtIn);
        customChecks.orderedStream().forEach(builder::customCheck);

        builder.healthConfig(healthConfig(properties.getHealth(), builtIns));
        builder.buildInfo(buildInfo(properties.getBuild()));
        if (properties.getHealth().getMaxInFlight() != null) {
            builder.maxInFlight(properties.getHealth().getMaxInFlight());
        }
        builder.monitoring(monitoringConfig(properties.getUptime()));
        notifier.ifAvailable(builder::alertNotifier);

        return builder.build();
    }

    /** Creates a lifecycle bean for automatic start/stop of uptime probes. */
    @Bean
    @ConditionalOnMissingBean
    public HealthWatchLifecycle healthWatchLifecycle(HealthWatch healthWatch) {
        return new HealthWatchLifecycle(healthWatch);
    }

    /** Creates a Spring Boot Actuator HealthIndicator backed by the health pass. */
    @Bean
    @ConditionalOnMissingBean
    public HealthWatchIndicator healthWatchIndicator(HealthWatch healthWatch) {
        return new HealthWatchIndicator(healthWatch);
    }

    /** Creates an Actuator endpoint at {@code /actuator/uptime}. */
    @Bean
    @ConditionalOnMissingBean
    public UptimeEndpoint uptimeEndpoint(HealthWatch healthWatch) {
        return new UptimeEndpoint(healthWatch);
    }

    /** Serves {@code /health}, {@code /health/live} and {@code /health/ready}. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.bind.annotation.RestController")
    @ConditionalOnProperty(prefix = "healthwatch.web", name = "enabled", matchIfMissing = true)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        HealthController healthController(HealthWatch healthWatch) {
            return new HealthController(healthWatch);
        }
    }

    static Map<CheckKind, HealthCheck> builtInChecks(HealthWatchProperties.Checks props,
                                                     DataSource dataSource) {
        Map<CheckKind, HealthCheck> checks = new EnumMap<>(CheckKind.class);
        if (dataSource != null) {
            DatabaseHealthCheck.Builder db = DatabaseHealthCheck.builder(dataSource);
            if (props.getDatabaseQuery() != null) {
                db.query(props.getDatabaseQuery());
            }
            checks.put(CheckKind.DATABASE, db.build());
        }
        putHttp(checks, CheckKind.STORAGE, props.getStorageUrl(), props);
        putHttp(checks, CheckKind.AUTH, props.getAuthUrl(), props);
        putHttp(checks, CheckKind.EDGE_FUNCTIONS, props.getEdgeFunctionsUrl(), props);
        return checks;
    }

    private static void putHttp(Map<CheckKind, HealthCheck> checks, CheckKind kind, String url,
                                HealthWatchProperties.Checks props) {
        if (url == null || url.isBlank()) {
            return;
        }
        checks.put(kind, HttpHealthCheck.builder(kind, url)
                .headers(props.getHttpHeaders())
                .build());
    }

    static HealthConfig healthConfig(HealthWatchProperties.Health props,
                                     Map<CheckKind, HealthCheck> builtIns) {
        HealthConfig.Builder b = HealthConfig.builder();
        if (props.getTimeout() != null) {
            b.timeout(props.getTimeout());
        }
        if (props.getCacheTtl() != null) {
            b.cacheTtl(props.getCacheTtl());
        }
        List<CheckKind> enabled = new ArrayList<>();
        if (props.getEnabledChecks() != null) {
            for (String label : props.getEnabledChecks()) {
                enabled.add(CheckKind.fromLabel(label));
            }
        } else {
            // defaults, as far as implementations are available
            enabled.addAll(HealthConfig.defaults().enabledChecks());
            enabled.retainAll(builtIns.keySet());
        }
        return b.enabledChecks(enabled).build();
    }

    static BuildInfo buildInfo(HealthWatchProperties.Build props) {
        return new BuildInfo(props.getVersion(), props.getEnvironment(), props.getCommit(),
                props.getBranch(), props.getBuildTime());
    }

    static MonitoringConfig monitoringConfig(HealthWatchProperties.Uptime props) {
        MonitoringConfig.Builder b = MonitoringConfig.builder()
                .enabled(props.isEnabled())
                .provider(Provider.fromLabel(props.getProvider()))
                .maintenance(new MaintenanceWindow(props.getMaintenance().isEnabled(),
                        props.getMaintenance().getSchedule()));
        if (props.getStatusPage() != null) {
            HealthWatchProperties.StatusPageProperties page = props.getStatusPage();
            b.statusPage(new StatusPage(page.isEnabled(), page.getUrl(), page.isPublicMetrics()));
        }
        props.getProbes().forEach((name, probe) -> b.probe(probeConfig(name, probe)));
        return b.build();
    }

    static ProbeConfig probeConfig(String name, HealthWatchProperties.ProbeProperties props) {
        ProbeConfig.Builder b = ProbeConfig.builder(name, props.getUrl())
                .kind(ProbeKind.fromLabel(props.getType()))
                .regions(props.getRegions())
                .headers(props.getHeaders())
                .expectedBodySubstring(props.getExpectedResponse());
        if (props.getInterval() != null) {
            b.interval(props.getInterval());
        }
        if (props.getTimeout() != null) {
            b.timeout(props.getTimeout());
        }
        if (props.getEnabled() != null) {
            b.enabled(props.getEnabled());
        }
        if (props.getExpectedStatus() != null) {
            b.expectedStatusCodes(props.getExpectedStatus());
        }

        HealthWatchProperties.AlertProperties alerts = props.getAlerts();
        AlertPolicy defaults = AlertPolicy.defaults();
        List<AlertChannel> channels = defaults.channels();
        if (alerts.getChannels() != null) {
            channels = alerts.getChannels().stream().map(AlertChannel::fromLabel).toList();
        }
        int threshold = alerts.getThreshold() != null ? alerts.getThreshold() : defaults.failureThreshold();
        b.alertPolicy(new AlertPolicy(channels, threshold, alerts.isEscalation()));

        if (props.getSsl() != null) {
            b.sslPolicy(props.getSsl().isCheckCertificate(), props.getSsl().getWarnDaysBeforeExpiry());
        }
        return b.build();
    }
}
