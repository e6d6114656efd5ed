package biz.kryukov.dev.healthwatch.scheduler;

import biz.kryukov.dev.healthwatch.uptime.AlertPolicy;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what a failed probe firing means for alerting, and dispatches.
 *
 * <p>Every failure is logged with the probe's channels. The policy triggers once the
 * streak reaches {@code failureThreshold}; the alert is dispatched exactly once per
 * streak, at the crossing. During maintenance the crossing is recorded but not sent.</p>
 */
public final class ProbeFailureHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeFailureHandler.class);

    private final AlertNotifier notifier;
    private final Logger logger;

    public ProbeFailureHandler(AlertNotifier notifier) {
        this(notifier, LOG);
    }

    public ProbeFailureHandler(AlertNotifier notifier, Logger logger) {
        this.notifier = notifier;
        this.logger = logger;
    }

    /**
     * Handles one failed firing.
     *
     * @param probe               the probe
     * @param result              the failed result
     * @param consecutiveFailures streak length including this failure
     * @param maintenance         whether maintenance mode is on
     * @return the decision taken
     */
    public AlertDecision handle(ProbeConfig probe, ProbeResult result, int consecutiveFailures,
                                boolean maintenance) {
        AlertPolicy policy = probe.alertPolicy();
        boolean triggered = consecutiveFailures >= policy.failureThreshold();
        boolean crossing = consecutiveFailures == policy.failureThreshold();
        boolean dispatch = crossing && !maintenance;

        AlertDecision decision = new AlertDecision(
                probe.name(), probe.url(), result.statusCode(), result.latency(), result.message(),
                consecutiveFailures, policy.failureThreshold(), triggered, dispatch,
                triggered && policy.escalate(), policy.channels(), crossing && maintenance);

        logger.warn("healthwatch: service degradation detected: {} ({}) status={} latency={}ms "
                        + "failures={}/{} channels={} error={}",
                probe.name(), probe.url(), result.statusCode(), result.latency().toMillis(),
                consecutiveFailures, policy.failureThreshold(), policy.channels(), result.message());

        if (decision.suppressed()) {
            logger.warn("healthwatch: alert for {} suppressed during maintenance", probe.name());
        }
        if (dispatch) {
            logger.error("healthwatch: {} reached failure threshold {}, alerting {}{}",
                    probe.name(), policy.failureThreshold(), policy.channels(),
                    decision.escalate() ? " with escalation" : "");
            try {
                notifier.send(decision);
            } catch (Exception e) {
                logger.error("healthwatch: alert delivery for {} failed", probe.name(), e);
            }
        }
        return decision;
    }
}
