package me.go_gradually.callflow.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordTransitionLatency(Duration duration);

    void recordTurnLatency(Duration duration);

    void recordSynthesisLatency(Duration duration);

    void recordLlmLatency(Duration duration);

    void incrementTransitionOutcome(String outcome);

    void incrementModelTimeout();

    void incrementCheckin();

    void incrementCallEnded(String reason);

    void incrementBargeIn();

    void incrementEchoDiscarded();

    void incrementUtteranceDiscarded();

    void incrementPlaybackError();

    void incrementWebhookError();

    void incrementStoreError();
}
