package me.go_gradually.callflow.application.silence.usecase;

import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.silence.model.SilenceState;
import me.go_gradually.callflow.application.silence.model.SilenceVerdict;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.application.support.FakeSessionStore;
import me.go_gradually.callflow.application.support.MutableClock;
import me.go_gradually.callflow.application.support.TestPolicies;
import me.go_gradually.callflow.domain.call.CallEndReason;
import me.go_gradually.callflow.domain.call.CallId;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.PlaybackUnit;
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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SilenceMonitorTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private AudioStreamCoordinator audioStreamCoordinator;
    @Mock
    private MetricsPort metrics;

    private FakeSessionStore store;
    private MutableClock clock;
    private TestPolicies policies;
    private CallSession session;
    private SilenceMonitor monitor;

    @BeforeEach
    void setUp() {
        store = new FakeSessionStore();
        clock = new MutableClock(T0);
        policies = new TestPolicies();
        session = new CallSession(CallId.of("call-1"), "agent-1", T0, 10);
        lenient().when(audioStreamCoordinator.streamContent(any(CallSession.class), anyString()))
                .thenAnswer(invocation -> List.of(PlaybackUnit.pending("call-1", 1, true, true,
                        invocation.getArgument(1), Duration.ofSeconds(2), 0)));
        monitor = new SilenceMonitor(policies, audioStreamCoordinator, store, metrics, clock, Duration.ofSeconds(10));
    }

    private SilenceVerdict tickAt(Instant at) {
        clock.set(at);
        return monitor.tick(session);
    }

    private void checkinPlayed(Instant at) {
        session.finishCheckin(at);
        store.clearFlag("call-1", SessionFlag.CHECKIN_IN_PROGRESS);
    }

    @Test
    void tick_staysQuietBeforeTimeout() {
        session.userSpeechEnded(T0);

        SilenceVerdict verdict = tickAt(T0.plusSeconds(6));

        assertEquals(SilenceState.QUIET, verdict.state());
        verifyNoInteractions(audioStreamCoordinator);
    }

    @Test
    void tick_acknowledgedCheckinsStillEndTheCall() {
        session.userSpeechEnded(T0);

        assertEquals(SilenceState.CHECKIN_PENDING, tickAt(T0.plusSeconds(7)).state());
        assertEquals(1, session.getCheckinCount());
        checkinPlayed(T0.plusSeconds(9));
        session.applyUserResponse(true, false, T0.plusSeconds(10));

        assertEquals(SilenceState.CHECKIN_PENDING, tickAt(T0.plusSeconds(17)).state());
        assertEquals(2, session.getCheckinCount());
        checkinPlayed(T0.plusSeconds(19));
        session.applyUserResponse(true, false, T0.plusSeconds(20));

        assertFalse(tickAt(T0.plusSeconds(26)).terminated());
        SilenceVerdict verdict = tickAt(T0.plusSeconds(27));

        assertTrue(verdict.terminated());
        assertEquals(CallEndReason.SILENCE_TIMEOUT, verdict.endReason());
        verify(audioStreamCoordinator, times(2)).streamContent(session, "Are you still there?");
        verify(metrics, times(2)).incrementCheckin();
    }

    @Test
    void tick_realReplyResetsCheckinCount() {
        session.userSpeechEnded(T0);
        tickAt(T0.plusSeconds(7));
        checkinPlayed(T0.plusSeconds(9));

        session.applyUserResponse(false, false, T0.plusSeconds(10));

        assertEquals(0, session.getCheckinCount());
        assertEquals(SilenceState.QUIET, tickAt(T0.plusSeconds(12)).state());
    }

    @Test
    void tick_waitsOneMoreIntervalAfterLastCheckin() {
        session.userSpeechEnded(T0);
        tickAt(T0.plusSeconds(7));
        checkinPlayed(T0.plusSeconds(9));
        tickAt(T0.plusSeconds(16));
        checkinPlayed(T0.plusSeconds(18));

        assertFalse(tickAt(T0.plusSeconds(24)).terminated());
        assertTrue(tickAt(T0.plusSeconds(25)).terminated());
    }

    @Test
    void tick_holdOnExtendsTimeout() {
        session.applyUserResponse(false, true, T0);

        assertEquals(SilenceState.QUIET, tickAt(T0.plusSeconds(20)).state());
        assertEquals(SilenceState.CHECKIN_PENDING, tickAt(T0.plusSeconds(25)).state());
        assertFalse(session.isHoldOnRequested());
    }

    @Test
    void tick_isPausedWhileResponseIsGenerated() {
        session.userSpeechEnded(T0);
        session.setGeneratingResponse(true, T0);

        assertEquals(SilenceState.QUIET, tickAt(T0.plusSeconds(30)).state());
        verifyNoInteractions(audioStreamCoordinator);
    }

    @Test
    void tick_skipsCheckinWhileAnotherWorkerIssuesOne() {
        session.userSpeechEnded(T0);
        store.setFlag("call-1", SessionFlag.CHECKIN_IN_PROGRESS, Duration.ofSeconds(10));

        assertEquals(SilenceState.CHECKIN_PENDING, tickAt(T0.plusSeconds(8)).state());
        assertEquals(0, session.getCheckinCount());
        verifyNoInteractions(audioStreamCoordinator);
    }

    @Test
    void tick_endsCallAtMaxDuration() {
        session.userSpeechStarted();

        SilenceVerdict verdict = tickAt(T0.plus(policies.maxCallDuration));

        assertEquals(CallEndReason.MAX_DURATION, verdict.endReason());
    }
}
