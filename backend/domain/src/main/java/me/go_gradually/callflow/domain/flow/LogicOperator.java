package me.go_gradually.callflow.domain.flow;

import me.go_gradually.callflow.domain.util.NumericValues;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.function.DoublePredicate;

public enum LogicOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal"),
    LESS_THAN_OR_EQUAL("less_than_or_equal"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with");

    private final String code;

    LogicOperator(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static LogicOperator fromCode(String code) {
        if (code == null || code.isBlank()) {
            return EQUALS;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (LogicOperator operator : values()) {
            if (operator.code.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown logic operator: " + code);
    }

    public boolean test(String actual, String expected) {
        boolean present = actual != null && !actual.isBlank() && !"undefined".equalsIgnoreCase(actual);
        String left = actual == null ? "" : actual.toLowerCase(Locale.ROOT);
        String right = expected == null ? "" : expected.toLowerCase(Locale.ROOT);
        return switch (this) {
            case EQUALS -> left.equals(right);
            case NOT_EQUALS -> !left.equals(right);
            case CONTAINS -> left.contains(right);
            case STARTS_WITH -> left.startsWith(right);
            case ENDS_WITH -> left.endsWith(right);
            case EXISTS -> present;
            case NOT_EXISTS -> !present;
            case GREATER_THAN -> compare(actual, expected, diff -> diff > 0);
            case LESS_THAN -> compare(actual, expected, diff -> diff < 0);
            case GREATER_THAN_OR_EQUAL -> compare(actual, expected, diff -> diff >= 0);
            case LESS_THAN_OR_EQUAL -> compare(actual, expected, diff -> diff <= 0);
        };
    }

    private static boolean compare(String actual, String expected, DoublePredicate predicate) {
        OptionalDouble left = NumericValues.parse(actual);
        OptionalDouble right = NumericValues.parse(expected);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return predicate.test(Double.compare(left.getAsDouble(), right.getAsDouble()));
    }
}
