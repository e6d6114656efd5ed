package biz.kryukov.dev.healthwatch.scheduler;

/**
 * Delivers alerts (email, Slack, PagerDuty...). Transport is external to this library.
 */
@FunctionalInterface
public interface AlertNotifier {

    /**
     * Sends an alert for a decision with {@link AlertDecision#dispatch()} set.
     *
     * @param decision the alert to deliver
     * @throws Exception if delivery failed; the failure is logged, never propagated
     */
    void send(AlertDecision decision) throws Exception;
}
