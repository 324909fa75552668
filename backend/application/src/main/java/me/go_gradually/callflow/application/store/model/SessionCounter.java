package me.go_gradually.callflow.application.store.model;

public enum SessionCounter {
    ACTIVE_PLAYBACK_COUNT("active_playback_count");

    private final String code;

    SessionCounter(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
