package biz.kryukov.dev.healthwatch;

/**
 * Base exception for the healthwatch library.
 */
public class HealthWatchException extends RuntimeException {

    public HealthWatchException(String message) {
        super(message);
    }

    public HealthWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
