package me.go_gradually.callflow.domain.call;

public record CallId(String value) {
    public CallId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallId is required");
        }
    }

    public static CallId of(String value) {
        return new CallId(value);
    }
}
