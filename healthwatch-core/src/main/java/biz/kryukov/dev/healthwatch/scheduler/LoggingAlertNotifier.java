package biz.kryukov.dev.healthwatch.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes the alert to the log.
 */
public final class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public void send(AlertDecision decision) {
        LOG.error("healthwatch: ALERT {} down after {} consecutive failures, channels={}, escalate={}: {}",
                decision.probe(), decision.consecutiveFailures(), decision.channels(),
                decision.escalate(), decision.error());
    }
}
