package me.go_gradually.callflow.application.call.usecase;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.call.model.CallSnapshot;
import me.go_gradually.callflow.application.call.model.TelephonyEventCommand;
import me.go_gradually.callflow.application.call.model.TelephonyEventType;
import me.go_gradually.callflow.application.call.model.TranscriptCommand;
import me.go_gradually.callflow.application.call.port.FlowRepository;
import me.go_gradually.callflow.application.call.port.TelephonyGateway;
import me.go_gradually.callflow.application.interruption.usecase.InterruptionController;
import me.go_gradually.callflow.application.llm.port.LlmClient;
import me.go_gradually.callflow.application.shared.port.AsyncExecutor;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.silence.usecase.SilenceMonitor;
import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.usecase.SessionReadinessGate;
import me.go_gradually.callflow.application.stream.port.SpeechSynthesisGateway;
import me.go_gradually.callflow.application.stream.port.SynthesisStream;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.application.support.FakeSessionStore;
import me.go_gradually.callflow.application.support.ManualTickScheduler;
import me.go_gradually.callflow.application.support.MutableClock;
import me.go_gradually.callflow.application.support.TestPolicies;
import me.go_gradually.callflow.application.transition.usecase.TransitionEvaluator;
import me.go_gradually.callflow.application.webhook.port.WebhookGateway;
import me.go_gradually.callflow.domain.flow.FlowGraph;
import me.go_gradually.callflow.domain.flow.FlowNode;
import me.go_gradually.callflow.domain.flow.LogicCondition;
import me.go_gradually.callflow.domain.flow.LogicOperator;
import me.go_gradually.callflow.domain.flow.LogicSplit;
import me.go_gradually.callflow.domain.flow.NodeType;
import me.go_gradually.callflow.domain.flow.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionOrchestratorTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final AsyncExecutor INLINE = Runnable::run;

    @Mock
    private FlowRepository flowRepository;
    @Mock
    private TelephonyGateway telephonyGateway;
    @Mock
    private SpeechSynthesisGateway synthesisGateway;
    @Mock
    private SynthesisStream synthesis;
    @Mock
    private LlmClient llmClient;
    @Mock
    private WebhookGateway webhookGateway;
    @Mock
    private MetricsPort metrics;

    private FakeSessionStore store;
    private ManualTickScheduler tickScheduler;
    private MutableClock clock;
    private TestPolicies policies;
    private SessionOrchestrator orchestrator;
    private final AtomicInteger playbackIds = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        store = new FakeSessionStore();
        tickScheduler = new ManualTickScheduler();
        clock = new MutableClock(T0);
        policies = new TestPolicies();
        lenient().when(flowRepository.findByAgentId("agent-1")).thenReturn(Optional.of(salesFlow()));
        lenient().when(flowRepository.findByAgentId("agent-err")).thenReturn(Optional.of(brokenFlow()));
        lenient().when(synthesisGateway.open(anyString())).thenReturn(synthesis);
        lenient().when(synthesis.isOpen()).thenReturn(true);
        lenient().when(synthesis.mimeType()).thenReturn("audio/mpeg");
        lenient().when(synthesis.synthesize(anyString(), anyBoolean(), anyBoolean(), any(Duration.class)))
                .thenReturn(new byte[]{1, 2, 3});
        lenient().when(telephonyGateway.startPlayback(anyString(), any(byte[].class), anyString()))
                .thenAnswer(invocation -> "pb-" + playbackIds.incrementAndGet());
        orchestrator = newOrchestrator();
    }

    private SessionOrchestrator newOrchestrator() {
        AudioStreamCoordinator coordinator = new AudioStreamCoordinator(synthesisGateway, telephonyGateway, store,
                INLINE, tickScheduler, policies, metrics, clock, policies.sessionTtl());
        InterruptionController interruptionController = new InterruptionController(policies, coordinator, metrics, clock);
        TransitionEvaluator transitionEvaluator = new TransitionEvaluator(llmClient, INLINE, policies, metrics);
        SilenceMonitor silenceMonitor = new SilenceMonitor(policies, coordinator, store, metrics, clock, policies.flagTtl());
        ContentGenerator contentGenerator = new ContentGenerator(llmClient, coordinator, policies, metrics, clock);
        VariableExtractor variableExtractor = new VariableExtractor(llmClient, INLINE, new ObjectMapper(),
                policies.contentModel(), policies.extractionTimeout());
        WebhookExecutor webhookExecutor = new WebhookExecutor(webhookGateway, new ObjectMapper(), metrics, clock,
                policies.webhookTimeout(), policies.webhookAttempts());
        return new SessionOrchestrator(
                flowRepository,
                telephonyGateway,
                store,
                new SessionReadinessGate(store, Duration.ofMillis(20)),
                transitionEvaluator,
                silenceMonitor,
                interruptionController,
                coordinator,
                contentGenerator,
                variableExtractor,
                webhookExecutor,
                INLINE,
                tickScheduler,
                policies,
                policies.tickInterval(),
                metrics,
                clock
        );
    }

    private static FlowGraph salesFlow() {
        FlowNode greeting = FlowNode.builder("greeting", NodeType.START)
                .content("Hi {{name}}! Would you like to hear about our websites?")
                .transition(Transition.of("User agrees or says yes", "pitch"))
                .transition(Transition.of("User declines or is not interested", "goodbye"))
                .build();
        FlowNode pitch = FlowNode.builder("pitch", NodeType.CONVERSATION)
                .content("In a nutshell, we set up passive income websites for you.")
                .transition(Transition.of("always", "goodbye"))
                .build();
        FlowNode goodbye = FlowNode.builder("goodbye", NodeType.ENDING)
                .content("Thanks for your time. Goodbye!")
                .build();
        return FlowGraph.of("agent-1", "greeting", "You are a friendly sales agent.", List.of(greeting, pitch, goodbye));
    }

    private static FlowGraph brokenFlow() {
        FlowNode greeting = FlowNode.builder("greeting", NodeType.START)
                .content("Hello.")
                .transition(Transition.of("always", "router"))
                .build();
        FlowNode router = FlowNode.builder("router", NodeType.LOGIC_SPLIT)
                .logicSplit(new LogicSplit(List.of(new LogicCondition("plan", LogicOperator.EQUALS, "gold", "greeting")), null))
                .build();
        return FlowGraph.of("agent-err", "greeting", null, List.of(greeting, router));
    }

    private TranscriptCommand finalTranscript(String callId, String text) {
        return transcript(callId, text, true);
    }

    private TranscriptCommand transcript(String callId, String text, boolean finalTranscript) {
        TranscriptCommand command = new TranscriptCommand();
        command.setCallId(callId);
        command.setText(text);
        command.setFinalTranscript(finalTranscript);
        return command;
    }

    private TelephonyEventCommand event(String eventId, TelephonyEventType type, String callId, String playbackId) {
        TelephonyEventCommand command = new TelephonyEventCommand();
        command.setEventId(eventId);
        command.setEventType(type);
        command.setCallId(callId);
        command.setPlaybackId(playbackId);
        command.setAgentId("agent-1");
        return command;
    }

    private void finishPlayback(SessionOrchestrator target, String callId, String... ids) {
        for (String id : ids) {
            target.onPlaybackEvent(callId, id, true);
        }
    }

    @Test
    void onCallAnswered_greetsCallerAndPublishesSession() throws Exception {
        CallSnapshot snapshot = orchestrator.onCallAnswered("call-1", "agent-1", Map.of("name", "Sam"));

        verify(synthesis).synthesize(eq("Hi Sam!"), eq(true), eq(false), any(Duration.class));
        verify(synthesis).synthesize(eq("Would you like to hear about our websites?"), eq(false), eq(true), any(Duration.class));
        assertEquals("greeting", snapshot.currentNodeId());
        assertEquals(2, orchestrator.snapshot("call-1").activePlaybackCount());
        assertTrue(store.getFlag("call-1", SessionFlag.SESSION_READY));
        assertEquals("agent-1", store.get("call-1").orElseThrow().agentId());
        assertEquals("Sam", store.get("call-1").orElseThrow().variables().get("name"));
    }

    @Test
    void onCallAnswered_failsForUnknownAgent() {
        when(flowRepository.findByAgentId("ghost")).thenReturn(Optional.empty());

        assertThrows(NoSuchElementException.class, () -> orchestrator.onCallAnswered("call-1", "ghost", Map.of()));
    }

    @Test
    void onTranscript_affirmativeReplyMovesWithoutModelCall() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of("name", "Sam"));
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");
        clock.advance(Duration.ofSeconds(1));

        orchestrator.onTranscript(finalTranscript("call-1", "Yes please"));

        assertEquals("pitch", orchestrator.snapshot("call-1").currentNodeId());
        verify(synthesis).synthesize(eq("In a nutshell, we set up passive income websites for you."),
                anyBoolean(), anyBoolean(), any(Duration.class));
        verifyNoInteractions(llmClient);
        assertEquals("pitch", store.get("call-1").orElseThrow().currentNodeId());
    }

    @Test
    void onTranscript_echoOfAgentSpeechIsIgnored() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of("name", "Sam"));
        clock.advance(Duration.ofSeconds(1));

        orchestrator.onTranscript(finalTranscript("call-1", "hear about our websites"));

        CallSnapshot snapshot = orchestrator.snapshot("call-1");
        assertEquals("greeting", snapshot.currentNodeId());
        assertEquals(2, snapshot.activePlaybackCount());
        verify(telephonyGateway, never()).stopPlayback(anyString(), anyList());
    }

    @Test
    void onTranscript_bargeInCancelsAgentAndHandlesReply() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of("name", "Sam"));
        clock.advance(Duration.ofSeconds(1));

        orchestrator.onTranscript(finalTranscript("call-1", "no, stop please"));

        verify(telephonyGateway).stopPlayback("call-1", List.of());
        assertEquals("goodbye", orchestrator.snapshot("call-1").currentNodeId());
        verify(synthesis).synthesize(eq("Thanks for your time."), anyBoolean(), anyBoolean(), any(Duration.class));
    }

    @Test
    void endingNode_hangsUpOnceGoodbyeFinishes() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");

        orchestrator.onTranscript(finalTranscript("call-1", "No thanks"));
        verify(telephonyGateway, never()).hangup(anyString());

        finishPlayback(orchestrator, "call-1", "pb-3", "pb-4");

        verify(telephonyGateway).hangup("call-1");
        assertTrue(store.get("call-1").isEmpty());
        assertThrows(NoSuchElementException.class, () -> orchestrator.snapshot("call-1"));
        verify(metrics).incrementCallEnded("flow_completed");
    }

    @Test
    void onTelephonyEvent_ignoresDuplicateDeliveries() throws Exception {
        orchestrator.onTelephonyEvent(event("ev-1", TelephonyEventType.CALL_ANSWERED, "call-1", null));
        orchestrator.onTelephonyEvent(event("ev-1", TelephonyEventType.CALL_ANSWERED, "call-1", null));
        orchestrator.onTelephonyEvent(event("ev-2", TelephonyEventType.PLAYBACK_ENDED, "call-1", "pb-1"));
        orchestrator.onTelephonyEvent(event("ev-2", TelephonyEventType.PLAYBACK_ENDED, "call-1", "pb-1"));

        verify(flowRepository, times(1)).findByAgentId("agent-1");
        assertEquals(1, orchestrator.snapshot("call-1").activePlaybackCount());
    }

    @Test
    void silenceTick_checksInAfterDeadAir() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");
        clock.advance(Duration.ofSeconds(7));

        tickScheduler.tickAll();

        verify(synthesis).synthesize(eq("Are you still there?"), anyBoolean(), anyBoolean(), any(Duration.class));
        assertEquals(1, orchestrator.snapshot("call-1").checkinCount());
    }

    @Test
    void silenceTick_hangsUpWhenCheckinsAreExhausted() throws Exception {
        policies.maxCheckins = 0;
        orchestrator = newOrchestrator();
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");
        clock.advance(Duration.ofSeconds(7));

        tickScheduler.tickAll();

        verify(telephonyGateway).hangup("call-1");
        verify(metrics).incrementCallEnded("silence_timeout");
    }

    @Test
    void onCallHangup_releasesCall() {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());

        orchestrator.onCallHangup("call-1");

        assertThrows(NoSuchElementException.class, () -> orchestrator.snapshot("call-1"));
        assertEquals(0, tickScheduler.activeCount());
        verify(synthesis).close();
    }

    @Test
    void hangup_endsCallOnOperatorRequest() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());

        orchestrator.hangup("call-1");

        verify(telephonyGateway).stopPlayback("call-1", List.of());
        verify(telephonyGateway).hangup("call-1");
        verify(metrics).incrementCallEnded("operator_hangup");
    }

    @Test
    void otherWorker_restoresSessionFromSharedStore() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of("name", "Sam"));
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");
        SessionOrchestrator otherWorker = newOrchestrator();

        otherWorker.onTranscript(finalTranscript("call-1", "Yes please"));

        CallSnapshot snapshot = otherWorker.snapshot("call-1");
        assertEquals("pitch", snapshot.currentNodeId());
        assertEquals("Sam", snapshot.variables().get("name"));
        assertEquals("pitch", store.get("call-1").orElseThrow().currentNodeId());
    }

    @Test
    void otherWorker_playbackEndOnlyUpdatesSharedStore() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());
        long ticks = tickScheduler.activeCount();
        SessionOrchestrator otherWorker = newOrchestrator();

        finishPlayback(otherWorker, "call-1", "pb-1", "pb-2");

        assertEquals(0L, store.counter("call-1", SessionCounter.ACTIVE_PLAYBACK_COUNT));
        assertTrue(store.playbackIds("call-1").isEmpty());
        assertEquals(ticks, tickScheduler.activeCount());
        verify(synthesisGateway, times(1)).open("call-1");

        clock.advance(Duration.ofSeconds(5));
        tickScheduler.tickAll();

        CallSnapshot owner = orchestrator.snapshot("call-1");
        assertEquals(0, owner.activePlaybackCount());
        assertFalse(owner.agentSpeaking());
        assertTrue(store.getFlag("call-1", SessionFlag.AGENT_DONE_SPEAKING));

        orchestrator.onTranscript(finalTranscript("call-1", "yes"));

        assertEquals("pitch", orchestrator.snapshot("call-1").currentNodeId());
    }

    @Test
    void otherWorker_checkinPlaybackEndReleasesCheckinFlag() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");
        clock.advance(Duration.ofSeconds(7));
        tickScheduler.tickAll();
        assertTrue(store.getFlag("call-1", SessionFlag.CHECKIN_IN_PROGRESS));

        finishPlayback(newOrchestrator(), "call-1", "pb-3");
        clock.advance(Duration.ofSeconds(3));
        tickScheduler.tickAll();

        assertFalse(store.getFlag("call-1", SessionFlag.CHECKIN_IN_PROGRESS));
        clock.advance(Duration.ofSeconds(7));
        tickScheduler.tickAll();

        verify(synthesis, times(2)).synthesize(eq("Are you still there?"), anyBoolean(), anyBoolean(), any(Duration.class));
        assertEquals(2, orchestrator.snapshot("call-1").checkinCount());
    }

    @Test
    void emptyFinalAfterPartial_restartsSilenceTimer() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-1", Map.of());
        finishPlayback(orchestrator, "call-1", "pb-1", "pb-2");

        orchestrator.onTranscript(transcript("call-1", "um so", false));
        assertTrue(orchestrator.snapshot("call-1").userSpeaking());
        orchestrator.onTranscript(transcript("call-1", "", true));

        assertFalse(orchestrator.snapshot("call-1").userSpeaking());
        clock.advance(Duration.ofSeconds(7));
        tickScheduler.tickAll();
        assertEquals(1, orchestrator.snapshot("call-1").checkinCount());
    }

    @Test
    void otherWorker_endsCallGracefullyWhenStateIsMissing() throws Exception {
        store.setFlag("call-9", SessionFlag.SESSION_READY, Duration.ofMinutes(5));

        orchestrator.onTranscript(finalTranscript("call-9", "hello there"));

        verify(synthesis).synthesize(eq("Sorry, something went wrong on our side."), anyBoolean(), anyBoolean(), any(Duration.class));
        verify(telephonyGateway, never()).hangup(anyString());

        finishPlayback(orchestrator, "call-9", "pb-1", "pb-2");

        verify(telephonyGateway).hangup("call-9");
        verify(metrics).incrementCallEnded("reconstruction_failed");
    }

    @Test
    void onTranscript_ignoresUnknownCallAfterWaiting() throws Exception {
        orchestrator.onTranscript(finalTranscript("call-404", "hello there"));

        verify(telephonyGateway, never()).startPlayback(anyString(), any(byte[].class), anyString());
        verify(telephonyGateway, never()).hangup(anyString());
    }

    @Test
    void turnFailure_speaksClosingLineAndHangsUp() throws Exception {
        orchestrator.onCallAnswered("call-1", "agent-err", Map.of());
        finishPlayback(orchestrator, "call-1", "pb-1");

        orchestrator.onTranscript(finalTranscript("call-1", "hi there"));

        verify(synthesis).synthesize(eq("Sorry, something went wrong on our side."), anyBoolean(), anyBoolean(), any(Duration.class));
        finishPlayback(orchestrator, "call-1", "pb-2", "pb-3");
        verify(telephonyGateway).hangup("call-1");
        verify(metrics).incrementCallEnded("session_error");
    }
}
