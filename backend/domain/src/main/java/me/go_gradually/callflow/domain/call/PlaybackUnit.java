package me.go_gradually.callflow.domain.call;

import java.time.Duration;
import java.time.Instant;

public record PlaybackUnit(String callId,
                           long sequence,
                           boolean first,
                           boolean last,
                           String text,
                           Duration estimatedDuration,
                           long epoch,
                           String playbackId,
                           Instant startedAt) {

    public static PlaybackUnit pending(String callId,
                                       long sequence,
                                       boolean first,
                                       boolean last,
                                       String text,
                                       Duration estimatedDuration,
                                       long epoch) {
        return new PlaybackUnit(callId, sequence, first, last, text, estimatedDuration, epoch, null, null);
    }

    public PlaybackUnit dispatched(String playbackId, Instant startedAt) {
        if (playbackId == null || playbackId.isBlank()) {
            throw new IllegalArgumentException("playbackId is required");
        }
        return new PlaybackUnit(callId, sequence, first, last, text, estimatedDuration, epoch, playbackId, startedAt);
    }

    public boolean isDispatched() {
        return playbackId != null;
    }
}
