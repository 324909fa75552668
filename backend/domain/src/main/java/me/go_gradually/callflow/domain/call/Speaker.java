package me.go_gradually.callflow.domain.call;

public enum Speaker {
    USER("user"),
    AGENT("assistant");

    private final String code;

    Speaker(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
