package biz.kryukov.dev.healthwatch.uptime;

/**
 * Public status page settings, carried through to exported configuration.
 */
public record StatusPage(boolean enabled, String url, boolean publicMetrics) {
}
