package biz.kryukov.dev.healthwatch.uptime;

import biz.kryukov.dev.healthwatch.ValidationException;

import java.util.List;

/**
 * When and where to alert for a failing probe.
 *
 * @param channels         channels to address
 * @param failureThreshold consecutive failures before the policy triggers
 * @param escalate         whether a triggered alert escalates
 */
public record AlertPolicy(List<AlertChannel> channels, int failureThreshold, boolean escalate) {

    public static final int MIN_THRESHOLD = 1;
    public static final int MAX_THRESHOLD = 100;

    public AlertPolicy {
        channels = channels == null ? List.of() : List.copyOf(channels);
        if (failureThreshold < MIN_THRESHOLD || failureThreshold > MAX_THRESHOLD) {
            throw new ValidationException("failureThreshold must be between " + MIN_THRESHOLD
                    + " and " + MAX_THRESHOLD + ", got " + failureThreshold);
        }
    }

    /** Email only, alert on the third consecutive failure, no escalation. */
    public static AlertPolicy defaults() {
        return new AlertPolicy(List.of(AlertChannel.EMAIL), 3, false);
    }
}
