package me.go_gradually.callflow.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordTransitionLatency(Duration duration) {
        record("call.transition.latency", duration);
    }

    @Override
    public void recordTurnLatency(Duration duration) {
        record("call.turn.latency", duration);
    }

    @Override
    public void recordSynthesisLatency(Duration duration) {
        record("call.synthesis.latency", duration);
    }

    @Override
    public void recordLlmLatency(Duration duration) {
        record("call.llm.latency", duration);
    }

    @Override
    public void incrementTransitionOutcome(String outcome) {
        meterRegistry.counter("call.transitions", "outcome", outcome).increment();
    }

    @Override
    public void incrementModelTimeout() {
        meterRegistry.counter("call.transition.model_timeouts").increment();
    }

    @Override
    public void incrementCheckin() {
        meterRegistry.counter("call.checkins").increment();
    }

    @Override
    public void incrementCallEnded(String reason) {
        meterRegistry.counter("call.ended", "reason", reason).increment();
    }

    @Override
    public void incrementBargeIn() {
        meterRegistry.counter("call.barge_ins").increment();
    }

    @Override
    public void incrementEchoDiscarded() {
        meterRegistry.counter("call.utterances.echo").increment();
    }

    @Override
    public void incrementUtteranceDiscarded() {
        meterRegistry.counter("call.utterances.discarded").increment();
    }

    @Override
    public void incrementPlaybackError() {
        meterRegistry.counter("call.playback.errors").increment();
    }

    @Override
    public void incrementWebhookError() {
        meterRegistry.counter("call.webhook.errors").increment();
    }

    @Override
    public void incrementStoreError() {
        meterRegistry.counter("call.store.errors").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
