package warden.core.util;

import java.util.Locale;
import java.util.function.Function;

import warden.core.model.common.ConfigurationFormatException;

/**
 * Helpers for turning optional raw configuration strings into typed values.
 */
public final class ConfigurationValues {

    private ConfigurationValues() {}

    /**
     * Parse a raw configuration value, falling back to a default when it is
     * missing.
     *
     * <p>Null and empty strings yield {@code defaultValue}. Any other value is
     * handed to {@code parser}, and whatever the parser throws propagates
     * unchanged.
     *
     * @param value        raw value, may be null
     * @param parser       parser for non-empty values
     * @param defaultValue value returned for null or empty input
     * @param <T>          target type
     * @return the parsed value or {@code defaultValue}
     */
    public static <T> T parseValueOrDefault(String value, Function<String, T> parser, T defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return parser.apply(value);
    }

    /**
     * Strict boolean parse.
     *
     * <p>Accepts {@code true} and {@code false} in any case, ignoring
     * surrounding whitespace. Unlike {@link Boolean#parseBoolean(String)},
     * anything else is rejected.
     *
     * @param value the raw value
     * @return the parsed boolean
     * @throws ConfigurationFormatException if the value is not a boolean literal
     */
    public static boolean parseBoolean(String value) {
        if (value != null) {
            final var trimmed = value.strip().toLowerCase(Locale.ROOT);
            if ("true".equals(trimmed)) {
                return true;
            }
            if ("false".equals(trimmed)) {
                return false;
            }
        }
        throw new ConfigurationFormatException(value, "String '" + value + "' was not recognized as a valid boolean");
    }
}
