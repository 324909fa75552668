package me.go_gradually.callflow.application.silence.usecase;

import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.silence.model.SilenceState;
import me.go_gradually.callflow.application.silence.model.SilenceVerdict;
import me.go_gradually.callflow.application.silence.policy.SilencePolicy;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.domain.call.CallEndReason;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.SilenceSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

public class SilenceMonitor {
    private static final Logger log = Logger.getLogger(SilenceMonitor.class.getName());

    private final SilencePolicy policy;
    private final AudioStreamCoordinator audioStreamCoordinator;
    private final SharedSessionStorePort store;
    private final MetricsPort metrics;
    private final Clock clock;
    private final Duration flagTtl;

    public SilenceMonitor(SilencePolicy policy,
                          AudioStreamCoordinator audioStreamCoordinator,
                          SharedSessionStorePort store,
                          MetricsPort metrics,
                          Clock clock,
                          Duration flagTtl) {
        this.policy = policy;
        this.audioStreamCoordinator = audioStreamCoordinator;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.flagTtl = flagTtl;
    }

    public SilenceVerdict tick(CallSession session) {
        Instant now = clock.instant();
        SilenceSnapshot snapshot = session.silenceSnapshot();
        if (snapshot.ended()) {
            return SilenceVerdict.of(SilenceState.TERMINATED);
        }
        if (snapshot.callElapsed(now).compareTo(policy.maxCallDuration()) >= 0) {
            log.info(() -> "silence.maxduration callId=" + session.getCallId().value());
            return SilenceVerdict.terminate(CallEndReason.MAX_DURATION);
        }
        SilenceVerdict current = SilenceVerdict.of(snapshot.checkinCount() > 0 ? SilenceState.CHECKIN_PENDING : SilenceState.QUIET);
        if (!snapshot.silent() || snapshot.paused()) {
            return current;
        }
        Duration timeout = snapshot.holdOnRequested() ? policy.holdOnSilenceTimeout() : policy.silenceTimeout();
        Duration elapsed = snapshot.silenceElapsed(now);
        if (elapsed.compareTo(timeout) < 0) {
            return current;
        }
        if (snapshot.checkinCount() >= policy.maxCheckins()) {
            Instant reachedAt = snapshot.maxCheckinsReachedAt() == null ? now : snapshot.maxCheckinsReachedAt();
            log.info(() -> "silence.timeout callId=" + session.getCallId().value()
                    + " checkins=" + snapshot.checkinCount() + " silentMs=" + elapsed.toMillis()
                    + " sinceMaxCheckinsMs=" + Duration.between(reachedAt, now).toMillis());
            return SilenceVerdict.terminate(CallEndReason.SILENCE_TIMEOUT);
        }
        if (snapshot.lastCheckinAt() != null
                && Duration.between(snapshot.lastCheckinAt(), now).compareTo(policy.minCheckinInterval()) < 0) {
            return current;
        }
        String callId = session.getCallId().value();
        if (!store.setFlagIfAbsent(callId, SessionFlag.CHECKIN_IN_PROGRESS, flagTtl)) {
            return SilenceVerdict.of(SilenceState.CHECKIN_PENDING);
        }
        int count = session.recordCheckin(now, policy.maxCheckins());
        metrics.incrementCheckin();
        log.info(() -> "silence.checkin callId=" + callId + " count=" + count + " silentMs=" + elapsed.toMillis());
        if (audioStreamCoordinator.streamContent(session, policy.checkinMessage()).isEmpty()) {
            session.finishCheckin(now);
            store.clearFlag(callId, SessionFlag.CHECKIN_IN_PROGRESS);
        }
        return SilenceVerdict.of(SilenceState.CHECKIN_PENDING);
    }
}
