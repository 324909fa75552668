package me.go_gradually.callflow.domain.call;

public enum CallEndReason {
    CALLER_HANGUP("caller_hangup"),
    FLOW_COMPLETED("flow_completed"),
    TRANSFERRED("transferred"),
    SILENCE_TIMEOUT("silence_timeout"),
    MAX_DURATION("max_duration"),
    SESSION_ERROR("session_error"),
    RECONSTRUCTION_FAILED("reconstruction_failed"),
    OPERATOR_HANGUP("operator_hangup");

    private final String code;

    CallEndReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
