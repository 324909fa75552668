package me.go_gradually.callflow.domain.flow;

import java.util.Locale;
import java.util.regex.Pattern;

public enum InputType {
    TEXT,
    EMAIL,
    PHONE,
    NUMBER;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    public static InputType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return TEXT;
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }

    public InputValidation validate(String input) {
        String trimmed = input == null ? "" : input.trim();
        return switch (this) {
            case EMAIL -> EMAIL_PATTERN.matcher(trimmed).matches()
                    ? InputValidation.valid(trimmed)
                    : InputValidation.invalid("That doesn't look like a valid email address. Please provide your email.");
            case PHONE -> validatePhone(trimmed);
            case NUMBER -> validateNumber(trimmed);
            case TEXT -> trimmed.isEmpty()
                    ? InputValidation.invalid("Please provide your information.")
                    : InputValidation.valid(trimmed);
        };
    }

    private static InputValidation validatePhone(String input) {
        String digits = NON_DIGIT.matcher(input).replaceAll("");
        if (digits.length() < 10 || digits.length() > 15) {
            return InputValidation.invalid("That doesn't look like a valid phone number. Please provide your phone number.");
        }
        return InputValidation.valid(digits);
    }

    private static InputValidation validateNumber(String input) {
        try {
            Double.parseDouble(input.replace(",", ""));
            return InputValidation.valid(input.replace(",", ""));
        } catch (NumberFormatException e) {
            return InputValidation.invalid("Please provide a valid number.");
        }
    }
}
