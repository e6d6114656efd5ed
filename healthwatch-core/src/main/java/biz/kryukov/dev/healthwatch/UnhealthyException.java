package biz.kryukov.dev.healthwatch;

/**
 * Dependency is reachable but reports itself unhealthy.
 */
public class UnhealthyException extends CheckException {

    public UnhealthyException(String message) {
        super(message, HealthStatus.UNHEALTHY, ErrorCategory.UNHEALTHY);
    }

    public UnhealthyException(String message, String category) {
        super(message, HealthStatus.UNHEALTHY, category);
    }

    public UnhealthyException(String message, String category, Throwable cause) {
        super(message, cause, HealthStatus.UNHEALTHY, category);
    }
}
