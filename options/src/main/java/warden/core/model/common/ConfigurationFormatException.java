package warden.core.model.common;

/**
 * Thrown when a non-empty configuration value cannot be parsed into the
 * type its key requires.
 */
public class ConfigurationFormatException extends IllegalArgumentException {

    private final String value;

    public ConfigurationFormatException(String value, String message) {
        super(message);
        this.value = value;
    }

    public ConfigurationFormatException(String value, String message, Throwable cause) {
        super(message, cause);
        this.value = value;
    }

    /**
     * The raw value that failed to parse.
     */
    public String getValue() {
        return value;
    }
}
