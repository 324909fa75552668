package me.go_gradually.callflow.application.silence.policy;

import java.time.Duration;

public interface SilencePolicy {
    Duration silenceTimeout();

    Duration holdOnSilenceTimeout();

    int maxCheckins();

    String checkinMessage();

    Duration minCheckinInterval();

    Duration maxCallDuration();

    Duration tickInterval();
}
