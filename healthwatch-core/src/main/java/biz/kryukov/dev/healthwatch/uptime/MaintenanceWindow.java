package biz.kryukov.dev.healthwatch.uptime;

/**
 * Maintenance mode. While enabled, failing probes are still recorded but alerts
 * are not dispatched.
 *
 * @param enabled  whether maintenance is in effect
 * @param schedule cron expression describing recurring windows, informational, may be {@code null}
 */
public record MaintenanceWindow(boolean enabled, String schedule) {

    public static MaintenanceWindow off() {
        return new MaintenanceWindow(false, null);
    }
}
