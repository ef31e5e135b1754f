package com.brandsentinel.core.config;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-readable durations such as {@code 500ms}, {@code 10s},
 * {@code 2m} or {@code 1h30m}. ISO-8601 strings ({@code PT10S}) are accepted
 * as well.
 *
 * @since 1.0.0
 */
public final class Durations {

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h)");
    private static final Pattern WHOLE = Pattern.compile("(\\d+(ms|s|m|h))+");

    private Durations() {
        // utility class, not instantiable
    }

    /**
     * @param text duration text
     * @return the parsed duration
     * @throws IllegalArgumentException if the text is blank or malformed
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must not be null or blank");
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("p")) {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Invalid duration: '" + text + "'", e);
            }
        }
        if (!WHOLE.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Invalid duration: '" + text + "' (expected e.g. 500ms, 10s, 2m, 1h30m)");
        }
        Duration total = Duration.ZERO;
        Matcher m = PART.matcher(value);
        while (m.find()) {
            long amount = Long.parseLong(m.group(1));
            total = total.plus(switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            });
        }
        return total;
    }

    /**
     * @param text duration text
     * @return {@code true} if {@link #parse(String)} would succeed
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
