package biz.kryukov.dev.healthwatch.uptime;

/**
 * Channel an alert is addressed to. Delivery itself is external.
 */
public enum AlertChannel {
    EMAIL("email"),
    SLACK("slack"),
    PAGERDUTY("pagerduty"),
    WEBHOOK("webhook"),
    SMS("sms");

    private final String label;

    AlertChannel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AlertChannel fromLabel(String label) {
        for (AlertChannel c : values()) {
            if (c.label.equalsIgnoreCase(label)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown alert channel: " + label);
    }
}
