package biz.kryukov.dev.healthwatch;

/**
 * Dependency works with reduced quality of service.
 */
public class DegradedException extends CheckException {

    public DegradedException(String message) {
        super(message, HealthStatus.DEGRADED, ErrorCategory.DEGRADED);
    }
}
