package me.go_gradually.callflow.domain.speech;

import me.go_gradually.callflow.domain.util.TextUtils;

import java.time.Duration;

public final class SpeechDurationEstimator {
    private static final long MIN_MILLIS = 2_000L;
    private static final long PER_WORD_MILLIS = 150L;
    private static final long LEAD_MILLIS = 1_000L;

    private SpeechDurationEstimator() {
    }

    public static Duration estimate(String text) {
        long words = TextUtils.wordCount(text);
        return Duration.ofMillis(Math.max(MIN_MILLIS, words * PER_WORD_MILLIS + LEAD_MILLIS));
    }
}
