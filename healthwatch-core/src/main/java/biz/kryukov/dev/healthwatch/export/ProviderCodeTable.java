package biz.kryukov.dev.healthwatch.export;

import biz.kryukov.dev.healthwatch.uptime.ProbeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Probe kind to provider check-type codes.
 *
 * <p>A kind with no entry for a provider maps to its own label. Such gaps are reported
 * once, when the table is built.</p>
 */
public final class ProviderCodeTable {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderCodeTable.class);

    static final Provider[] MAPPED_PROVIDERS = {
            Provider.UPTIMEROBOT, Provider.PINGDOM, Provider.BETTERUPTIME
    };

    private static final ProviderCodeTable STANDARD = new ProviderCodeTable(standardCodes());

    private final Map<ProbeKind, Map<Provider, Object>> codes;

    ProviderCodeTable(Map<ProbeKind, Map<Provider, Object>> codes) {
        EnumMap<ProbeKind, Map<Provider, Object>> copy = new EnumMap<>(ProbeKind.class);
        for (Map.Entry<ProbeKind, Map<Provider, Object>> e : codes.entrySet()) {
            copy.put(e.getKey(), new EnumMap<>(e.getValue()));
        }
        this.codes = copy;
        for (ProbeKind kind : ProbeKind.values()) {
            for (Provider provider : MAPPED_PROVIDERS) {
                if (lookup(kind, provider) == null) {
                    LOG.warn("healthwatch: no {} check type for probe kind '{}', exporting it as-is",
                            provider.label(), kind.label());
                }
            }
        }
    }

    /** The built-in table. */
    public static ProviderCodeTable standard() {
        return STANDARD;
    }

    /**
     * Returns the provider's code for a probe kind: an Integer or a String. Falls back
     * to {@link ProbeKind#label()}.
     */
    public Object code(ProbeKind kind, Provider provider) {
        Object code = lookup(kind, provider);
        return code != null ? code : kind.label();
    }

    private Object lookup(ProbeKind kind, Provider provider) {
        Map<Provider, Object> byProvider = codes.get(kind);
        return byProvider == null ? null : byProvider.get(provider);
    }

    private static Map<ProbeKind, Map<Provider, Object>> standardCodes() {
        Map<ProbeKind, Map<Provider, Object>> table = new EnumMap<>(ProbeKind.class);
        table.put(ProbeKind.HTTP, codes(1, "http", "status"));
        table.put(ProbeKind.TCP, codes(4, "tcp", "tcp"));
        table.put(ProbeKind.PING, codes(3, "ping", "ping"));
        table.put(ProbeKind.DNS, codes(5, "dns", "dns"));
        // UptimeRobot and Pingdom have no dedicated certificate check, SSL runs as HTTP there
        table.put(ProbeKind.SSL, codes(1, "http", "ssl"));
        return table;
    }

    private static Map<Provider, Object> codes(int uptimeRobot, String pingdom, String betterUptime) {
        Map<Provider, Object> m = new EnumMap<>(Provider.class);
        m.put(Provider.UPTIMEROBOT, uptimeRobot);
        m.put(Provider.PINGDOM, pingdom);
        m.put(Provider.BETTERUPTIME, betterUptime);
        return m;
    }
}
