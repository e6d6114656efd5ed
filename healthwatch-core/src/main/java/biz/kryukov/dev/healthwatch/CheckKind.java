package biz.kryukov.dev.healthwatch;

import java.time.Duration;

/**
 * Built-in dependency checks with their fixed names and latency thresholds.
 */
public enum CheckKind {
    DATABASE("database", Duration.ofMillis(2000), true),
    STORAGE("storage", Duration.ofMillis(2000), false),
    AUTH("auth", Duration.ofMillis(1000), true),
    EDGE_FUNCTIONS("edge_functions", Duration.ofMillis(3000), false);

    private final String label;
    private final Duration degradedThreshold;
    private final boolean readiness;

    CheckKind(String label, Duration degradedThreshold, boolean readiness) {
        this.label = label;
        this.degradedThreshold = degradedThreshold;
        this.readiness = readiness;
    }

    /** Returns the check name reported in results. */
    public String label() {
        return label;
    }

    /** Latency above which a successful run is degraded. */
    public Duration degradedThreshold() {
        return degradedThreshold;
    }

    /** Whether the check gates readiness (load-bearing for serving traffic). */
    public boolean readiness() {
        return readiness;
    }

    /** Finds a kind by label, accepting {@code edge-functions} as well as {@code edge_functions}. */
    public static CheckKind fromLabel(String label) {
        String normalized = label.trim().replace('-', '_');
        for (CheckKind k : values()) {
            if (k.label.equalsIgnoreCase(normalized)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown check kind: " + label);
    }
}
