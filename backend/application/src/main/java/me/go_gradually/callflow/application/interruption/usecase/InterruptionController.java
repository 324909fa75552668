package me.go_gradually.callflow.application.interruption.usecase;

import me.go_gradually.callflow.application.interruption.model.AgentChannelState;
import me.go_gradually.callflow.application.interruption.model.InterruptionOutcome;
import me.go_gradually.callflow.application.interruption.policy.InterruptionPolicy;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.UtteranceClass;
import me.go_gradually.callflow.domain.util.TextUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class InterruptionController {
    private static final Logger log = Logger.getLogger(InterruptionController.class.getName());

    private final InterruptionPolicy policy;
    private final AudioStreamCoordinator audioStreamCoordinator;
    private final MetricsPort metrics;
    private final Clock clock;
    private final EchoDetector echoDetector;
    private final Set<String> acknowledgementWords;

    public InterruptionController(InterruptionPolicy policy,
                                  AudioStreamCoordinator audioStreamCoordinator,
                                  MetricsPort metrics,
                                  Clock clock) {
        this.policy = policy;
        this.audioStreamCoordinator = audioStreamCoordinator;
        this.metrics = metrics;
        this.clock = clock;
        this.echoDetector = new EchoDetector(policy.echoOverlapThreshold());
        this.acknowledgementWords = new LinkedHashSet<>();
        for (String word : policy.acknowledgementWords()) {
            String normalized = TextUtils.normalize(word);
            if (!normalized.isEmpty()) {
                acknowledgementWords.add(normalized);
            }
        }
    }

    public UtteranceClass classify(String utterance, AgentChannelState state) {
        List<String> words = TextUtils.words(utterance);
        if (words.isEmpty()) {
            return UtteranceClass.DISCARD;
        }
        boolean withinEchoTail = state.busy() || state.quietFor().compareTo(policy.agentQuietGrace()) <= 0;
        if (withinEchoTail && echoDetector.isEcho(utterance, state.agentTexts())) {
            return UtteranceClass.ECHO;
        }
        if (!state.busy()) {
            return UtteranceClass.GENUINE;
        }
        boolean quietLongEnough = state.quietFor().compareTo(policy.agentQuietGrace()) > 0;
        if (words.size() < policy.minInterruptWords() && !quietLongEnough) {
            return UtteranceClass.DISCARD;
        }
        if (isAcknowledgementOnly(utterance)) {
            return UtteranceClass.DISCARD;
        }
        return UtteranceClass.GENUINE;
    }

    /**
     * Classifies the utterance and, for a genuine interruption, cancels all agent audio. Cancellation
     * is suppressed when the utterance began within the start buffer before the current unit started,
     * which is speech that was already in flight when the agent began talking.
     */
    public InterruptionOutcome handle(CallSession session, String utterance, Instant utteranceAt) {
        Instant now = clock.instant();
        AgentChannelState state = AgentChannelState.of(session, now);
        UtteranceClass utteranceClass = classify(utterance, state);
        if (utteranceClass == UtteranceClass.ECHO) {
            metrics.incrementEchoDiscarded();
            log.fine(() -> "interruption.echo callId=" + session.getCallId().value());
            return new InterruptionOutcome(utteranceClass, false, false);
        }
        if (utteranceClass == UtteranceClass.DISCARD) {
            metrics.incrementUtteranceDiscarded();
            return new InterruptionOutcome(utteranceClass, false, false);
        }
        if (!state.busy()) {
            return new InterruptionOutcome(utteranceClass, false, false);
        }
        if (startedBeforePlayback(session, utteranceAt)) {
            log.info(() -> "interruption.suppressed callId=" + session.getCallId().value()
                    + " nodeId=" + session.getCurrentNodeId());
            return new InterruptionOutcome(utteranceClass, false, true);
        }
        audioStreamCoordinator.cancelAll(session);
        String nodeId = session.getCurrentNodeId();
        if (nodeId != null && session.isContentDispatchedFor(nodeId)) {
            session.markContentDispatched(null);
        }
        metrics.incrementBargeIn();
        log.info(() -> "interruption.bargein callId=" + session.getCallId().value()
                + " words=" + TextUtils.wordCount(utterance));
        return new InterruptionOutcome(utteranceClass, true, false);
    }

    public boolean isAcknowledgementOnly(String utterance) {
        List<String> words = TextUtils.words(utterance);
        if (words.isEmpty() || words.size() > policy.acknowledgementMaxWords()) {
            return false;
        }
        String normalized = String.join(" ", words);
        if (acknowledgementWords.contains(normalized)) {
            return true;
        }
        for (String word : words) {
            if (!acknowledgementWords.contains(word)) {
                return false;
            }
        }
        return true;
    }

    public boolean isHoldOn(String utterance) {
        String normalized = TextUtils.normalize(utterance);
        if (normalized.isEmpty()) {
            return false;
        }
        for (String phrase : policy.holdOnPhrases()) {
            if (TextUtils.containsPhrase(normalized, phrase)) {
                return true;
            }
        }
        return false;
    }

    private boolean startedBeforePlayback(CallSession session, Instant utteranceAt) {
        Instant playbackStartedAt = session.getCurrentPlaybackStartedAt();
        if (utteranceAt == null || playbackStartedAt == null || !utteranceAt.isBefore(playbackStartedAt)) {
            return false;
        }
        Duration lead = Duration.between(utteranceAt, playbackStartedAt);
        return lead.compareTo(policy.playbackStartBuffer()) <= 0;
    }
}
