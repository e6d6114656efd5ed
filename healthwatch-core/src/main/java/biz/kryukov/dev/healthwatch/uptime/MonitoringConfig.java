package biz.kryukov.dev.healthwatch.uptime;

import biz.kryukov.dev.healthwatch.ValidationException;
import biz.kryukov.dev.healthwatch.export.Provider;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Uptime monitoring root: global switch, export provider, probes, status page and
 * maintenance settings. Immutable; mutations return a copy.
 */
public final class MonitoringConfig {

    private final boolean enabled;
    private final Provider provider;
    private final List<ProbeConfig> probes;
    private final StatusPage statusPage;
    private final MaintenanceWindow maintenance;

    private MonitoringConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.provider = builder.provider;
        this.probes = List.copyOf(builder.probes);
        this.statusPage = builder.statusPage;
        this.maintenance = builder.maintenance;
    }

    public boolean enabled() {
        return enabled;
    }

    public Provider provider() {
        return provider;
    }

    /** All probes in configuration order. */
    public List<ProbeConfig> probes() {
        return probes;
    }

    /** Enabled probes in configuration order. */
    public List<ProbeConfig> enabledProbes() {
        return probes.stream().filter(ProbeConfig::enabled).toList();
    }

    /** Status page settings, or {@code null}. */
    public StatusPage statusPage() {
        return statusPage;
    }

    public MaintenanceWindow maintenance() {
        return maintenance;
    }

    public boolean inMaintenance() {
        return maintenance != null && maintenance.enabled();
    }

    /** Returns a copy with the probe added, replacing any probe of the same name in place. */
    public MonitoringConfig withProbe(ProbeConfig probe) {
        Objects.requireNonNull(probe, "probe");
        List<ProbeConfig> updated = new ArrayList<>(probes);
        boolean replaced = false;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(probe.name())) {
                updated.set(i, probe);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            updated.add(probe);
        }
        return toBuilder().probes(updated).build();
    }

    /** Returns a copy without the named probe. */
    public MonitoringConfig withoutProbe(String name) {
        List<ProbeConfig> updated = new ArrayList<>(probes);
        updated.removeIf(p -> p.name().equals(name));
        return toBuilder().probes(updated).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .provider(provider)
                .probes(probes)
                .statusPage(statusPage)
                .maintenance(maintenance);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link MonitoringConfig}. */
    public static final class Builder {
        private boolean enabled = true;
        private Provider provider = Provider.CUSTOM;
        private List<ProbeConfig> probes = new ArrayList<>();
        private StatusPage statusPage;
        private MaintenanceWindow maintenance = MaintenanceWindow.off();

        private Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder provider(Provider provider) {
            this.provider = provider;
            return this;
        }

        public Builder probes(List<ProbeConfig> probes) {
            this.probes = new ArrayList<>(probes);
            return this;
        }

        public Builder probe(ProbeConfig probe) {
            this.probes.add(probe);
            return this;
        }

        public Builder statusPage(StatusPage statusPage) {
            this.statusPage = statusPage;
            return this;
        }

        public Builder maintenance(MaintenanceWindow maintenance) {
            this.maintenance = maintenance == null ? MaintenanceWindow.off() : maintenance;
            return this;
        }

        public MonitoringConfig build() {
            Set<String> names = new HashSet<>();
            for (ProbeConfig p : probes) {
                if (!names.add(p.name())) {
                    throw new ValidationException("duplicate probe name: " + p.name());
                }
            }
            if (provider == null) {
                provider = Provider.CUSTOM;
            }
            return new MonitoringConfig(this);
        }
    }
}
