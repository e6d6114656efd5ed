package biz.kryukov.dev.healthwatch.export;

/**
 * External uptime monitoring services a configuration can be exported for.
 */
public enum Provider {
    UPTIMEROBOT("uptimerobot"),
    PINGDOM("pingdom"),
    BETTERUPTIME("betteruptime"),
    STATUSCAKE("statuscake"),
    CUSTOM("custom");

    private final String label;

    Provider(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @throws IllegalArgumentException for an unknown label
     */
    public static Provider fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().replace("-", "").replace("_", "");
            for (Provider p : values()) {
                if (p.label.equalsIgnoreCase(normalized)) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + label);
    }
}
