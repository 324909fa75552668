package me.go_gradually.callflow.application.interruption.usecase;

import me.go_gradually.callflow.application.interruption.model.AgentChannelState;
import me.go_gradually.callflow.application.interruption.model.InterruptionOutcome;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.application.support.MutableClock;
import me.go_gradually.callflow.application.support.TestPolicies;
import me.go_gradually.callflow.domain.call.CallId;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.PlaybackUnit;
import me.go_gradually.callflow.domain.call.UtteranceClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class InterruptionControllerTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String AGENT_LINE = "In a nutshell, we set up passive income websites for you.";

    @Mock
    private AudioStreamCoordinator audioStreamCoordinator;
    @Mock
    private MetricsPort metrics;

    private MutableClock clock;
    private InterruptionController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        controller = new InterruptionController(new TestPolicies(), audioStreamCoordinator, metrics, clock);
    }

    private AgentChannelState speaking() {
        return new AgentChannelState(true, Duration.ZERO, List.of(AGENT_LINE));
    }

    private CallSession speakingSession(Instant playbackStartedAt) {
        CallSession session = new CallSession(CallId.of("call-1"), "agent-1", T0.minusSeconds(30), 10);
        PlaybackUnit unit = PlaybackUnit.pending("call-1", 1, true, true, AGENT_LINE, Duration.ofSeconds(4), session.getTurnEpoch())
                .dispatched("pb-1", playbackStartedAt);
        session.registerPlayback(unit, playbackStartedAt);
        return session;
    }

    @Test
    void classify_discardsSingleWordWhileAgentSpeaks() {
        assertEquals(UtteranceClass.DISCARD, controller.classify("yeah", speaking()));
    }

    @Test
    void classify_acceptsRealInterruption() {
        assertEquals(UtteranceClass.GENUINE, controller.classify("no, stop please", speaking()));
    }

    @Test
    void classify_detectsEchoOfAgentSpeech() {
        assertEquals(UtteranceClass.ECHO, controller.classify("passive income websites", speaking()));
    }

    @Test
    void classify_discardsAcknowledgementWhileAgentSpeaks() {
        assertEquals(UtteranceClass.DISCARD, controller.classify("yeah sure", speaking()));
    }

    @Test
    void classify_acceptsShortReplyWhenAgentChannelWentQuiet() {
        AgentChannelState staleBusy = new AgentChannelState(true, Duration.ofSeconds(3), List.of(AGENT_LINE));

        assertEquals(UtteranceClass.GENUINE, controller.classify("stop", staleBusy));
    }

    @Test
    void classify_acceptsAcknowledgementWhenAgentIsIdle() {
        AgentChannelState idle = new AgentChannelState(false, Duration.ofSeconds(5), List.of(AGENT_LINE));

        assertEquals(UtteranceClass.GENUINE, controller.classify("yeah", idle));
    }

    @Test
    void classify_discardsEmptyUtterance() {
        assertEquals(UtteranceClass.DISCARD, controller.classify(" ... ", speaking()));
    }

    @Test
    void handle_cancelsPlaybackOnGenuineInterruption() {
        CallSession session = speakingSession(T0);
        session.moveTo("pitch");
        session.markContentDispatched("pitch");
        clock.set(T0.plusSeconds(2));

        InterruptionOutcome outcome = controller.handle(session, "no, stop please", T0.plusMillis(1500));

        assertTrue(outcome.accepted());
        assertTrue(outcome.playbackCancelled());
        assertFalse(session.isContentDispatchedFor("pitch"));
        verify(audioStreamCoordinator).cancelAll(session);
        verify(metrics).incrementBargeIn();
    }

    @Test
    void handle_suppressesCancellationForSpeechStartedJustBeforePlayback() {
        CallSession session = speakingSession(T0);
        session.moveTo("pitch");
        session.markContentDispatched("pitch");
        clock.set(T0.plusSeconds(1));

        InterruptionOutcome outcome = controller.handle(session, "what is this about", T0.minusMillis(300));

        assertTrue(outcome.accepted());
        assertTrue(outcome.cancellationSuppressed());
        assertFalse(outcome.playbackCancelled());
        assertTrue(session.isContentDispatchedFor("pitch"));
        verify(audioStreamCoordinator, never()).cancelAll(any());
    }

    @Test
    void handle_cancelsWhenSpeechStartedWellBeforePlayback() {
        CallSession session = speakingSession(T0);
        clock.set(T0.plusSeconds(1));

        InterruptionOutcome outcome = controller.handle(session, "what is this about", T0.minusSeconds(2));

        assertTrue(outcome.playbackCancelled());
        verify(audioStreamCoordinator).cancelAll(session);
    }

    @Test
    void handle_ignoresEchoWithoutCancelling() {
        CallSession session = speakingSession(T0);
        clock.set(T0.plusSeconds(1));

        InterruptionOutcome outcome = controller.handle(session, "passive income websites", T0.plusMillis(800));

        assertEquals(UtteranceClass.ECHO, outcome.utteranceClass());
        assertFalse(outcome.accepted());
        verify(audioStreamCoordinator, never()).cancelAll(any());
        verify(metrics).incrementEchoDiscarded();
    }

    @Test
    void isAcknowledgementOnly_matchesShortAcknowledgements() {
        assertTrue(controller.isAcknowledgementOnly("go ahead"));
        assertTrue(controller.isAcknowledgementOnly("Yeah, okay."));
        assertTrue(controller.isAcknowledgementOnly("uh-huh"));
        assertFalse(controller.isAcknowledgementOnly("yeah I think so"));
        assertFalse(controller.isAcknowledgementOnly("no"));
    }

    @Test
    void isHoldOn_matchesHoldOnPhrases() {
        assertTrue(controller.isHoldOn("Hold on a second"));
        assertTrue(controller.isHoldOn("give me a second please"));
        assertFalse(controller.isHoldOn("I'd like to hear more"));
    }
}
