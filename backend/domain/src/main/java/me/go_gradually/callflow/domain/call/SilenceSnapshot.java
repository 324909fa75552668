package me.go_gradually.callflow.domain.call;

import java.time.Duration;
import java.time.Instant;

/**
 * Speaking flags and silence bookkeeping read under the session lock in one step.
 */
public record SilenceSnapshot(boolean agentSpeaking,
                              boolean userSpeaking,
                              Instant silenceStartedAt,
                              int checkinCount,
                              Instant lastCheckinAt,
                              Instant maxCheckinsReachedAt,
                              boolean holdOnRequested,
                              boolean paused,
                              Instant callStartedAt,
                              boolean ended) {

    public Duration silenceElapsed(Instant now) {
        if (silenceStartedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(silenceStartedAt, now);
    }

    public Duration callElapsed(Instant now) {
        return Duration.between(callStartedAt, now);
    }

    public boolean silent() {
        return silenceStartedAt != null && !agentSpeaking && !userSpeaking;
    }
}
