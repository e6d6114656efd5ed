package biz.kryukov.dev.healthwatch.uptime;

/**
 * Protocol an uptime probe speaks.
 */
public enum ProbeKind {
    HTTP("http"),
    TCP("tcp"),
    PING("ping"),
    DNS("dns"),
    SSL("ssl");

    private final String label;

    ProbeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Whether the probe issues an HTTP request and classifies its response. */
    public boolean isHttp() {
        return this == HTTP || this == SSL;
    }

    public static ProbeKind fromLabel(String label) {
        for (ProbeKind k : values()) {
            if (k.label.equalsIgnoreCase(label)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown probe kind: " + label);
    }
}
