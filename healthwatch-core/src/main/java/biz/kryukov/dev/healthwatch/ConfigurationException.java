package biz.kryukov.dev.healthwatch;

/**
 * Invalid combination of settings (e.g. an enabled check with no implementation).
 */
public class ConfigurationException extends HealthWatchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
