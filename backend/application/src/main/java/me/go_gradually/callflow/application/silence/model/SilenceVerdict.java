package me.go_gradually.callflow.application.silence.model;

import me.go_gradually.callflow.domain.call.CallEndReason;

public record SilenceVerdict(SilenceState state, CallEndReason endReason) {
    public static SilenceVerdict of(SilenceState state) {
        return new SilenceVerdict(state, null);
    }

    public static SilenceVerdict terminate(CallEndReason reason) {
        return new SilenceVerdict(SilenceState.TERMINATED, reason);
    }

    public boolean terminated() {
        return state == SilenceState.TERMINATED;
    }
}
