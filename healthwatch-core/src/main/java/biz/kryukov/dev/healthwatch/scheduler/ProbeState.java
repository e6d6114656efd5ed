package biz.kryukov.dev.healthwatch.scheduler;

import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeResult;

import java.util.concurrent.ScheduledFuture;

/**
 * Thread-safe per-probe state: the live timer, the consecutive-failure counter
 * and the last result.
 */
public final class ProbeState {

    private final ProbeConfig probe;
    private int consecutiveFailures;
    private boolean alerting;
    private ProbeResult lastResult;
    private ScheduledFuture<?> future;

    ProbeState(ProbeConfig probe) {
        this.probe = probe;
    }

    public ProbeConfig probe() {
        return probe;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    /** Whether the failure threshold was reached and no success has been seen since. */
    public synchronized boolean alerting() {
        return alerting;
    }

    /** Last result, or {@code null} before the first firing. */
    public synchronized ProbeResult lastResult() {
        return lastResult;
    }

    /**
     * Records a success: the counter resets to zero.
     *
     * @return whether the probe was alerting before this success
     */
    synchronized boolean recordSuccess(ProbeResult result) {
        boolean wasAlerting = alerting;
        consecutiveFailures = 0;
        alerting = false;
        lastResult = result;
        return wasAlerting;
    }

    /**
     * Records a failure.
     *
     * @return the consecutive-failure count including this failure
     */
    synchronized int recordFailure(ProbeResult result, int failureThreshold) {
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
            alerting = true;
        }
        lastResult = result;
        return consecutiveFailures;
    }

    synchronized ScheduledFuture<?> future() {
        return future;
    }

    synchronized void setFuture(ScheduledFuture<?> future) {
        this.future = future;
    }

    /** Cancels the timer, if any. */
    synchronized void cancel() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    synchronized boolean hasLiveTimer() {
        return future != null && !future.isDone();
    }
}
