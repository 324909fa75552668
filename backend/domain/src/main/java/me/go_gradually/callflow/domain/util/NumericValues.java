package me.go_gradually.callflow.domain.util;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads amounts such as "10000", "$10,000", "8k a month" or "1.5m".
 */
public final class NumericValues {
    private static final Pattern SHORTHAND = Pattern.compile("(\\d+(?:\\.\\d+)?)([kmb])");
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private NumericValues() {
    }

    public static OptionalDouble parse(String value) {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        try {
            return OptionalDouble.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException ignored) {
            // not a plain number, fall through to lenient parsing
        }
        String compact = trimmed.toLowerCase(Locale.ROOT)
                .replace("$", "")
                .replace(",", "")
                .replace(" ", "");
        Matcher shorthand = SHORTHAND.matcher(compact);
        if (shorthand.find()) {
            double number = Double.parseDouble(shorthand.group(1));
            return OptionalDouble.of(number * multiplier(shorthand.group(2).charAt(0)));
        }
        Matcher plain = NUMBER.matcher(compact);
        if (plain.find()) {
            return OptionalDouble.of(Double.parseDouble(plain.group(1)));
        }
        return OptionalDouble.empty();
    }

    private static double multiplier(char unit) {
        return switch (unit) {
            case 'k' -> 1_000d;
            case 'm' -> 1_000_000d;
            case 'b' -> 1_000_000_000d;
            default -> 1d;
        };
    }
}
