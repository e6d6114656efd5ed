package biz.kryukov.dev.healthwatch;

/**
 * Check exceeded its time budget.
 */
public class CheckTimeoutException extends CheckException {

    public CheckTimeoutException(String message) {
        super(message, HealthStatus.UNHEALTHY, ErrorCategory.TIMEOUT);
    }

    public CheckTimeoutException(String message, Throwable cause) {
        super(message, cause, HealthStatus.UNHEALTHY, ErrorCategory.TIMEOUT);
    }
}
