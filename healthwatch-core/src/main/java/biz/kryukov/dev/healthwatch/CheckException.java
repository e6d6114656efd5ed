package biz.kryukov.dev.healthwatch;

/**
 * Check failure with an explicit status and error category.
 *
 * <p>Checks throw subclasses of this to control the status the runner records.
 * Any other exception is recorded as {@link HealthStatus#UNHEALTHY}.</p>
 */
public class CheckException extends Exception {

    private final HealthStatus status;
    private final String category;

    public CheckException(String message, HealthStatus status, String category) {
        super(message);
        this.status = status;
        this.category = category;
    }

    public CheckException(String message, Throwable cause, HealthStatus status, String category) {
        super(message, cause);
        this.status = status;
        this.category = category;
    }

    /** Returns the status to record for this failure. */
    public HealthStatus status() {
        return status;
    }

    /** Returns the error category for this failure. */
    public String category() {
        return category;
    }
}
