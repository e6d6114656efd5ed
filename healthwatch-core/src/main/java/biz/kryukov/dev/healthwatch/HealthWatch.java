package biz.kryukov.dev.healthwatch;

import biz.kryukov.dev.healthwatch.checks.MemoryHealthCheck;
import biz.kryukov.dev.healthwatch.export.ProviderConfigExporter;
import biz.kryukov.dev.healthwatch.metrics.HealthMetrics;
import biz.kryukov.dev.healthwatch.orchestrator.HealthOrchestrator;
import biz.kryukov.dev.healthwatch.scheduler.AlertNotifier;
import biz.kryukov.dev.healthwatch.scheduler.LoggingAlertNotifier;
import biz.kryukov.dev.healthwatch.scheduler.ProbeFailureHandler;
import biz.kryukov.dev.healthwatch.scheduler.UptimeScheduler;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.UptimeReport;
import biz.kryukov.dev.healthwatch.uptime.probe.ProbeExecutor;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.function.Consumer;

/**
 * Entry point of the healthwatch library: on-demand health checks plus scheduled
 * uptime probes.
 *
 * <p>Usage:
 * <pre>{@code
 * HealthWatch healthWatch = HealthWatch.builder(meterRegistry)
 *     .builtIn(CheckKind.DATABASE, DatabaseHealthCheck.builder(dataSource).build())
 *     .builtIn(CheckKind.AUTH, HttpHealthCheck.builder(CheckKind.AUTH, authUrl).build())
 *     .customCheck(HealthCheck.of("queue-depth", timeout -> queue.ping()))
 *     .monitoring(MonitoringConfig.builder()
 *         .probe(ProbeConfig.builder("api", "https://api.example.com/health").build())
 *         .build())
 *     .build();
 *
 * healthWatch.start();
 * HealthSnapshot snapshot = healthWatch.checkHealth();
 * // ...
 * healthWatch.close();
 * }</pre>
 */
public final class HealthWatch implements AutoCloseable {

    private final HealthOrchestrator orchestrator;
    private final UptimeScheduler scheduler;
    private final ProviderConfigExporter exporter;
    private final ProbeExecutor ownedProbeExecutor;

    private HealthWatch(HealthOrchestrator orchestrator, UptimeScheduler scheduler,
                        ProviderConfigExporter exporter, ProbeExecutor ownedProbeExecutor) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.exporter = exporter;
        this.ownedProbeExecutor = ownedProbeExecutor;
    }

    /** Starts the uptime probe timers. */
    public void start() {
        scheduler.start();
    }

    /** Stops the uptime probe timers. Health checks stay available. */
    public void stop() {
        scheduler.stop();
    }

    public HealthSnapshot checkHealth() {
        return orchestrator.checkHealth();
    }

    public HealthSnapshot checkHealth(boolean force) {
        return orchestrator.checkHealth(force);
    }

    public Liveness checkLiveness() {
        return orchestrator.checkLiveness();
    }

    public HealthSnapshot checkReadiness() {
        return orchestrator.checkReadiness();
    }

    public void addCheck(HealthCheck check) {
        orchestrator.addCheck(check);
    }

    public void removeCheck(String name) {
        orchestrator.removeCheck(name);
    }

    public void configure(Consumer<HealthConfig.Builder> updater) {
        orchestrator.configure(updater);
    }

    public void clearCache() {
        orchestrator.clearCache();
    }

    public void addProbe(ProbeConfig probe) {
        scheduler.addProbe(probe);
    }

    public void removeProbe(String name) {
        scheduler.removeProbe(name);
    }

    /** Runs every enabled probe once without affecting alerting state. */
    public UptimeReport checkUptimeNow() {
        return scheduler.checkNow();
    }

    /** Exports the current monitoring configuration for a provider label. */
    public String exportConfig(String provider) {
        return exporter.exportConfig(scheduler.config(), provider);
    }

    /** Exports for the provider set in the monitoring configuration. */
    public String exportConfig() {
        MonitoringConfig config = scheduler.config();
        return exporter.exportConfig(config, config.provider());
    }

    public HealthOrchestrator orchestrator() {
        return orchestrator;
    }

    public UptimeScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        scheduler.close();
        orchestrator.close();
        if (ownedProbeExecutor != null) {
            ownedProbeExecutor.close();
        }
    }

    /** Builder without metrics. */
    public static Builder builder() {
        return new Builder(null);
    }

    public static Builder builder(MeterRegistry meterRegistry) {
        return new Builder(meterRegistry);
    }

    /** Builder for {@link HealthWatch}. */
    public static final class Builder {
        private final MeterRegistry meterRegistry;
        private final HealthOrchestrator.Builder orchestrator = HealthOrchestrator.builder();
        private MonitoringConfig monitoring = MonitoringConfig.builder().enabled(false).build();
        private AlertNotifier alertNotifier = new LoggingAlertNotifier();
        private ProbeExecutor probeExecutor;

        private Builder(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        public Builder builtIn(CheckKind kind, HealthCheck check) {
            orchestrator.builtIn(kind, check);
            return this;
        }

        public Builder builtIn(CheckKind kind, HealthCheck.Body body) {
            orchestrator.builtIn(kind, body);
            return this;
        }

        public Builder customCheck(HealthCheck check) {
            orchestrator.customCheck(check);
            return this;
        }

        public Builder healthConfig(HealthConfig config) {
            orchestrator.config(config);
            return this;
        }

        public Builder buildInfo(BuildInfo buildInfo) {
            orchestrator.buildInfo(buildInfo);
            return this;
        }

        public Builder maxInFlight(int maxInFlight) {
            orchestrator.maxInFlight(maxInFlight);
            return this;
        }

        public Builder memoryCheck(MemoryHealthCheck memoryCheck) {
            orchestrator.memoryCheck(memoryCheck);
            return this;
        }

        public Builder monitoring(MonitoringConfig monitoring) {
            this.monitoring = monitoring;
            return this;
        }

        public Builder alertNotifier(AlertNotifier alertNotifier) {
            this.alertNotifier = alertNotifier;
            return this;
        }

        public Builder probeExecutor(ProbeExecutor probeExecutor) {
            this.probeExecutor = probeExecutor;
            return this;
        }

        public HealthWatch build() {
            if (monitoring == null) {
                throw new ConfigurationException("monitoring configuration must not be null");
            }
            if (alertNotifier == null) {
                throw new ConfigurationException("alertNotifier must not be null");
            }
            HealthMetrics metrics = meterRegistry != null ? new HealthMetrics(meterRegistry) : null;
            orchestrator.metrics(metrics);
            // an executor passed in by the caller stays open on close()
            ProbeExecutor owned = probeExecutor == null ? new ProbeExecutor() : null;
            UptimeScheduler scheduler = new UptimeScheduler(monitoring,
                    owned != null ? owned : probeExecutor,
                    new ProbeFailureHandler(alertNotifier), metrics);
            return new HealthWatch(orchestrator.build(), scheduler, new ProviderConfigExporter(), owned);
        }
    }
}
