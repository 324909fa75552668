package me.go_gradually.callflow.application.call.model;

public enum TelephonyEventType {
    CALL_ANSWERED("call.answered"),
    PLAYBACK_STARTED("call.playback.started"),
    PLAYBACK_ENDED("call.playback.ended"),
    CALL_HANGUP("call.hangup"),
    UNKNOWN("unknown");

    private final String code;

    TelephonyEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TelephonyEventType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (TelephonyEventType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
