package me.go_gradually.callflow.domain.call;

public enum UtteranceClass {
    DISCARD("discard"),
    ECHO("echo"),
    GENUINE("genuine");

    private final String code;

    UtteranceClass(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean accepted() {
        return this == GENUINE;
    }
}
