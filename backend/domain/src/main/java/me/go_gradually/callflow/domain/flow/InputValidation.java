package me.go_gradually.callflow.domain.flow;

public record InputValidation(boolean valid, String value, String errorMessage) {
    public static InputValidation valid(String value) {
        return new InputValidation(true, value, "");
    }

    public static InputValidation invalid(String errorMessage) {
        return new InputValidation(false, "", errorMessage);
    }
}
