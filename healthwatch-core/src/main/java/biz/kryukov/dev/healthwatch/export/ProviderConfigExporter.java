package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.HealthWatchException;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Renders a {@link MonitoringConfig} as pretty-printed JSON for an external provider.
 */
public final class ProviderConfigExporter {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderConfigExporter.class);

    private final ObjectMapper mapper;
    private final Map<Provider, ProviderMapper> mappers = new EnumMap<>(Provider.class);

    public ProviderConfigExporter() {
        this(ProviderCodeTable.standard());
    }

    public ProviderConfigExporter(ProviderCodeTable codes) {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        register(new UptimeRobotMapper(codes));
        register(new PingdomMapper(codes));
        register(new BetterUptimeMapper(codes));
    }

    private void register(ProviderMapper m) {
        mappers.put(m.provider(), m);
    }

    /**
     * Exports for a provider given by label. An unknown label is logged and exported
     * as the raw model.
     */
    public String exportConfig(MonitoringConfig config, String providerLabel) {
        Provider provider;
        try {
            provider = Provider.fromLabel(providerLabel);
        } catch (IllegalArgumentException e) {
            LOG.warn("healthwatch: unknown export provider '{}', exporting raw configuration",
                    providerLabel);
            provider = Provider.CUSTOM;
        }
        return exportConfig(config, provider);
    }

    /** Exports for a provider; providers without a mapper get the raw model. */
    public String exportConfig(MonitoringConfig config, Provider provider) {
        ProviderMapper m = mappers.getOrDefault(provider, new RawConfigDumper(provider));
        try {
            return mapper.writeValueAsString(m.map(config));
        } catch (JsonProcessingException e) {
            throw new HealthWatchException("failed to export configuration for " + provider.label(), e);
        }
    }
}
