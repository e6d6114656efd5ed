package biz.kryukov.dev.healthwatch;

/**
 * Health status of a single check or of an aggregated snapshot.
 *
 * <p>Declaration order is the precedence order: a later constant always wins
 * when statuses are combined.</p>
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    /** Returns the wire representation ({@code healthy}, {@code degraded}, {@code unhealthy}). */
    public String label() {
        return label;
    }

    /** Returns the status with the higher precedence. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    /** Finds a status by its label (case-insensitive). */
    public static HealthStatus fromLabel(String label) {
        for (HealthStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + label);
    }
}
