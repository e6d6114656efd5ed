package biz.kryukov.dev.healthwatch;

/**
 * A configuration value is out of its allowed range.
 */
public class ValidationException extends ConfigurationException {

    public ValidationException(String message) {
        super(message);
    }
}
