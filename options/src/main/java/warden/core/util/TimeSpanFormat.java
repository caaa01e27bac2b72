package warden.core.util;

import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import warden.core.model.common.ConfigurationFormatException;

/**
 * Parses configured durations.
 *
 * <p>Two notations are accepted:
 * <ul>
 * <li>ISO-8601, e.g. {@code PT30S} or {@code P14D}</li>
 * <li>constant time-span notation {@code [-][d.]hh:mm[:ss[.fffffff]]}, or a bare
 * day count {@code d}, e.g. {@code 00:05:00} or {@code 14.00:00:00}</li>
 * <li>general notation {@code [-]d:hh:mm:ss[.fffffff]}, e.g. {@code 6:12:14:45}</li>
 * </ul>
 *
 * <p>The invariant parse only accepts {@code '.'} before the fractional
 * seconds. The locale-aware parse also accepts the locale's decimal separator
 * there.
 */
public final class TimeSpanFormat {

    private static final Pattern DAYS_ONLY = Pattern.compile("(-)?(\\d+)");
    private static final String TIME_OF_DAY =
            "(-)?(?:(\\d+)\\.)?(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2})(?:%s(\\d{1,7}))?)?";
    private static final String DAYS_AND_TIME = "(-)?(\\d+):(\\d{1,2}):(\\d{1,2}):(\\d{1,2})(?:%s(\\d{1,7}))?";
    private static final List<Pattern> INVARIANT_TIME = compile("\\.");
    private static final int MAX_FRACTION_DIGITS = 9;

    private TimeSpanFormat() {}

    /**
     * Parse using the invariant notation.
     *
     * @throws ConfigurationFormatException if the value is not a duration
     */
    public static Duration parseInvariant(String value) {
        return parse(value, INVARIANT_TIME);
    }

    /**
     * Parse using the default formatting locale.
     *
     * @throws ConfigurationFormatException if the value is not a duration
     */
    public static Duration parse(String value) {
        return parse(value, Locale.getDefault(Locale.Category.FORMAT));
    }

    /**
     * Parse using the given locale's decimal separator for fractional seconds.
     *
     * @throws ConfigurationFormatException if the value is not a duration
     */
    public static Duration parse(String value, Locale locale) {
        final var separator = DecimalFormatSymbols.getInstance(locale).getDecimalSeparator();
        if (separator == '.') {
            return parse(value, INVARIANT_TIME);
        }
        return parse(value, compile("(?:\\.|" + Pattern.quote(String.valueOf(separator)) + ")"));
    }

    private static List<Pattern> compile(String fractionSeparator) {
        return List.of(
                Pattern.compile(String.format(TIME_OF_DAY, fractionSeparator)),
                Pattern.compile(String.format(DAYS_AND_TIME, fractionSeparator)));
    }

    private static Duration parse(String value, List<Pattern> timePatterns) {
        if (value == null) {
            throw invalid(null, null);
        }
        final var trimmed = value.strip();

        if (isIso(trimmed)) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw invalid(value, e);
            }
        }

        try {
            final var days = DAYS_ONLY.matcher(trimmed);
            if (days.matches()) {
                final var duration = Duration.ofDays(Long.parseLong(days.group(2)));
                return days.group(1) != null ? duration.negated() : duration;
            }

            final var time = timePatterns.stream()
                    .map(pattern -> pattern.matcher(trimmed))
                    .filter(Matcher::matches)
                    .findFirst()
                    .orElseThrow(() -> invalid(value, null));

            final var hours = Integer.parseInt(time.group(3));
            final var minutes = Integer.parseInt(time.group(4));
            final var seconds = time.group(5) != null ? Integer.parseInt(time.group(5)) : 0;
            if (hours > 23 || minutes > 59 || seconds > 59) {
                throw invalid(value, null);
            }

            var duration = Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
            if (time.group(2) != null) {
                duration = duration.plusDays(Long.parseLong(time.group(2)));
            }
            if (time.group(6) != null) {
                duration = duration.plusNanos(fractionToNanos(time.group(6)));
            }
            return time.group(1) != null ? duration.negated() : duration;
        } catch (NumberFormatException | ArithmeticException e) {
            throw invalid(value, e);
        }
    }

    private static boolean isIso(String value) {
        final var start = value.startsWith("-") || value.startsWith("+") ? 1 : 0;
        return value.length() > start && (value.charAt(start) == 'P' || value.charAt(start) == 'p');
    }

    private static long fractionToNanos(String fraction) {
        final var padded = new StringBuilder(fraction);
        while (padded.length() < MAX_FRACTION_DIGITS) {
            padded.append('0');
        }
        return Long.parseLong(padded.toString());
    }

    private static ConfigurationFormatException invalid(String value, Throwable cause) {
        final var message = "String '" + value + "' was not recognized as a valid duration";
        return cause != null
                ? new ConfigurationFormatException(value, message, cause)
                : new ConfigurationFormatException(value, message);
    }
}
