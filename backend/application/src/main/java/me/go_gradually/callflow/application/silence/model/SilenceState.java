package me.go_gradually.callflow.application.silence.model;

public enum SilenceState {
    QUIET("quiet"),
    CHECKIN_PENDING("checkin_pending"),
    TERMINATED("terminated");

    private final String code;

    SilenceState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
