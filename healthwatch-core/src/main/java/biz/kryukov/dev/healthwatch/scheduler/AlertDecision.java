package biz.kryukov.dev.healthwatch.scheduler;

import biz.kryukov.dev.healthwatch.uptime.AlertChannel;

import java.time.Duration;
import java.util.List;

/**
 * What the failure handler decided for one failed probe firing.
 *
 * @param probe               probe name
 * @param url                 probe URL
 * @param statusCode          observed status, 0 if unreachable
 * @param latency             observed latency
 * @param error               failure description, may be {@code null}
 * @param consecutiveFailures failures in the current streak, this one included
 * @param failureThreshold    the policy threshold
 * @param triggered           the streak has reached the threshold
 * @param dispatch            an alert should be sent now (first crossing, outside maintenance)
 * @param escalate            the triggered alert escalates
 * @param channels            channels the alert is addressed to
 * @param suppressed          a dispatch was withheld because of maintenance
 */
public record AlertDecision(String probe, String url, int statusCode, Duration latency, String error,
                            int consecutiveFailures, int failureThreshold, boolean triggered,
                            boolean dispatch, boolean escalate, List<AlertChannel> channels,
                            boolean suppressed) {

    public AlertDecision {
        channels = List.copyOf(channels);
    }
}
