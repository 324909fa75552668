package me.go_gradually.callflow.application.store.model;

public enum SessionFlag {
    SESSION_READY("session_ready"),
    CHECKIN_IN_PROGRESS("checkin_in_progress"),
    AGENT_DONE_SPEAKING("agent_done_speaking");

    private final String code;

    SessionFlag(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
