package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;

/**
 * Maps the monitoring model onto one provider's configuration schema. Pure, no I/O.
 */
public interface ProviderMapper {

    Provider provider();

    /**
     * Builds the provider document for the enabled probes of {@code config}.
     *
     * @return a Jackson-serializable object
     */
    Object map(MonitoringConfig config);
}
