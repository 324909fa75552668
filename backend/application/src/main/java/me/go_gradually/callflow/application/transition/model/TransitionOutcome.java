package me.go_gradually.callflow.application.transition.model;

public enum TransitionOutcome {
    SINGLE_PATH("single_path"),
    FAST_PATH("fast_path"),
    MODEL("model"),
    STAY("stay"),
    FALLBACK("fallback"),
    NONE("none");

    private final String code;

    TransitionOutcome(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
