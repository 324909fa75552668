package me.go_gradually.callflow.application.stream.usecase;

import me.go_gradually.callflow.application.call.port.TelephonyGateway;
import me.go_gradually.callflow.application.shared.port.AsyncExecutor;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.shared.port.TickScheduler;
import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;
import me.go_gradually.callflow.application.stream.policy.StreamingPolicy;
import me.go_gradually.callflow.application.stream.port.SpeechSynthesisGateway;
import me.go_gradually.callflow.application.stream.port.SynthesisStream;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.PlaybackUnit;
import me.go_gradually.callflow.domain.speech.SentenceBuffer;
import me.go_gradually.callflow.domain.speech.SentenceSegmenter;
import me.go_gradually.callflow.domain.speech.SpeechDurationEstimator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns agent text into ordered playback units. Each call has one queue drained by a single worker
 * at a time, so units reach the provider in sequence order.
 */
public class AudioStreamCoordinator {
    private static final Logger log = Logger.getLogger(AudioStreamCoordinator.class.getName());

    private final SpeechSynthesisGateway synthesisGateway;
    private final TelephonyGateway telephonyGateway;
    private final SharedSessionStorePort store;
    private final AsyncExecutor asyncExecutor;
    private final TickScheduler tickScheduler;
    private final StreamingPolicy policy;
    private final MetricsPort metrics;
    private final Clock clock;
    private final Duration sessionTtl;
    private final SentenceSegmenter segmenter;
    private final Map<String, CallChannel> channels = new ConcurrentHashMap<>();

    public AudioStreamCoordinator(SpeechSynthesisGateway synthesisGateway,
                                  TelephonyGateway telephonyGateway,
                                  SharedSessionStorePort store,
                                  AsyncExecutor asyncExecutor,
                                  TickScheduler tickScheduler,
                                  StreamingPolicy policy,
                                  MetricsPort metrics,
                                  Clock clock,
                                  Duration sessionTtl) {
        this.synthesisGateway = synthesisGateway;
        this.telephonyGateway = telephonyGateway;
        this.store = store;
        this.asyncExecutor = asyncExecutor;
        this.tickScheduler = tickScheduler;
        this.policy = policy;
        this.metrics = metrics;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.segmenter = new SentenceSegmenter(policy.maxFragmentChars());
    }

    /**
     * Opens the persistent synthesis stream ahead of the first utterance and keeps it warm.
     */
    public void open(CallSession session) {
        CallChannel channel = channel(session);
        if (!channel.keepAliveStarted.compareAndSet(false, true)) {
            return;
        }
        channel.synthesis();
        Duration interval = policy.keepAliveInterval();
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            channel.keepAlive = tickScheduler.scheduleAtFixedRate(channel::keepAlive, interval);
        }
    }

    public ContentStream begin(CallSession session) {
        channel(session);
        return new ContentStream(this, session, session.getTurnEpoch(), new SentenceBuffer(segmenter));
    }

    public List<PlaybackUnit> streamContent(CallSession session, String text) {
        ContentStream stream = begin(session);
        stream.append(text);
        return stream.finish(clock.instant());
    }

    PlaybackUnit enqueue(CallSession session, String fragment, boolean first, boolean last, long epoch) {
        CallChannel channel = channel(session);
        PlaybackUnit unit = PlaybackUnit.pending(
                session.getCallId().value(),
                channel.sequence.incrementAndGet(),
                first,
                last,
                fragment,
                SpeechDurationEstimator.estimate(fragment),
                epoch
        );
        channel.queue.add(unit);
        scheduleDrain(channel);
        return unit;
    }

    /**
     * Handles a provider "playback ended" report. Returns true only the first time the id is seen.
     */
    public boolean onPlaybackEnded(CallSession session, String playbackId) {
        String callId = session.getCallId().value();
        boolean local = session.completePlayback(playbackId, clock.instant());
        if (store.removePlayback(callId, playbackId)) {
            store.decrement(callId, SessionCounter.ACTIVE_PLAYBACK_COUNT);
        }
        if (local && session.getActivePlaybackCount() == 0) {
            store.setFlag(callId, SessionFlag.AGENT_DONE_SPEAKING, sessionTtl);
            store.clearFlag(callId, SessionFlag.CHECKIN_IN_PROGRESS);
            log.fine(() -> "stream.drained callId=" + callId);
        }
        return local;
    }

    /**
     * Applies a "playback ended" report for a call this worker does not run. Only the shared
     * playback set and counter change; the owning worker picks the change up on its next tick.
     */
    public void onPlaybackEndedElsewhere(String callId, String playbackId) {
        if (store.removePlayback(callId, playbackId)) {
            store.decrement(callId, SessionCounter.ACTIVE_PLAYBACK_COUNT);
            log.fine(() -> "stream.playback.ended.shared callId=" + callId + " playbackId=" + playbackId);
        }
    }

    /**
     * Brings the local playback count in line with the shared playback set.
     */
    public int reconcilePlaybacks(CallSession session) {
        if (!session.isAgentSpeaking()) {
            return 0;
        }
        String callId = session.getCallId().value();
        Set<String> shared = store.playbackIds(callId);
        int ended = session.reconcilePlaybacks(shared, clock.instant());
        if (ended == 0) {
            return 0;
        }
        if (session.getActivePlaybackCount() == 0) {
            store.setFlag(callId, SessionFlag.AGENT_DONE_SPEAKING, sessionTtl);
            store.clearFlag(callId, SessionFlag.CHECKIN_IN_PROGRESS);
        }
        log.info(() -> "stream.reconciled callId=" + callId + " ended=" + ended
                + " active=" + session.getActivePlaybackCount());
        return ended;
    }

    /**
     * Drops everything queued or playing for the call. The epoch bump happens first, under the
     * session lock, so a unit that is mid-dispatch can no longer register.
     */
    public void cancelAll(CallSession session) {
        String callId = session.getCallId().value();
        long epoch = session.cancelAllPlayback(clock.instant());
        CallChannel channel = channels.get(callId);
        if (channel != null) {
            channel.queue.clear();
            SynthesisStream synthesis = channel.synthesis;
            if (synthesis != null) {
                synthesis.cancelPending();
            }
        }
        try {
            telephonyGateway.stopPlayback(callId, List.of());
        } catch (Exception e) {
            log.log(Level.WARNING, "stream.stop.failed callId=" + callId, e);
        }
        store.clearPlaybacks(callId);
        store.resetCounter(callId, SessionCounter.ACTIVE_PLAYBACK_COUNT);
        log.info(() -> "stream.cancelled callId=" + callId + " epoch=" + epoch);
    }

    /**
     * True when nothing is queued or being dispatched for the call.
     */
    public boolean isIdle(String callId) {
        CallChannel channel = channels.get(callId);
        return channel == null || (channel.queue.isEmpty() && !channel.draining.get());
    }

    public void close(String callId) {
        CallChannel channel = channels.remove(callId);
        if (channel == null) {
            return;
        }
        channel.queue.clear();
        if (channel.keepAlive != null) {
            channel.keepAlive.cancel();
        }
        SynthesisStream synthesis = channel.synthesis;
        if (synthesis != null) {
            synthesis.close();
        }
    }

    private CallChannel channel(CallSession session) {
        return channels.computeIfAbsent(session.getCallId().value(), key -> new CallChannel(session));
    }

    private void scheduleDrain(CallChannel channel) {
        if (channel.draining.compareAndSet(false, true)) {
            asyncExecutor.execute(() -> drain(channel));
        }
    }

    private void drain(CallChannel channel) {
        try {
            PlaybackUnit unit;
            while ((unit = channel.queue.poll()) != null) {
                dispatch(channel, unit);
            }
        } finally {
            channel.draining.set(false);
            if (!channel.queue.isEmpty() && channels.containsKey(channel.callId)) {
                scheduleDrain(channel);
            }
        }
    }

    private void dispatch(CallChannel channel, PlaybackUnit unit) {
        CallSession session = channel.session;
        if (isStale(session, unit)) {
            return;
        }
        int attempts = Math.max(1, policy.playbackAttempts());
        for (int attempt = 1; attempt <= attempts; attempt += 1) {
            try {
                dispatchOnce(channel, unit);
                return;
            } catch (Exception e) {
                log.warning("stream.dispatch.failed callId=" + channel.callId + " seq=" + unit.sequence()
                        + " attempt=" + attempt + " error=" + e.getMessage());
                channel.resetSynthesis();
                if (isStale(session, unit)) {
                    return;
                }
            }
        }
        metrics.incrementPlaybackError();
        if (session.getActivePlaybackCount() == 0) {
            session.finishCheckin(clock.instant());
            store.clearFlag(channel.callId, SessionFlag.CHECKIN_IN_PROGRESS);
        }
    }

    private void dispatchOnce(CallChannel channel, PlaybackUnit unit) throws Exception {
        CallSession session = channel.session;
        Instant synthesisStart = clock.instant();
        SynthesisStream synthesis = channel.synthesis();
        if (synthesis == null) {
            throw new IllegalStateException("Synthesis stream unavailable");
        }
        byte[] audio = synthesis.synthesize(unit.text(), unit.first(), unit.last(), policy.synthesisTimeout());
        metrics.recordSynthesisLatency(Duration.between(synthesisStart, clock.instant()));
        if (isStale(session, unit)) {
            return;
        }
        if (audio == null || audio.length == 0) {
            throw new IllegalStateException("Synthesis returned no audio");
        }
        String playbackId = telephonyGateway.startPlayback(channel.callId, audio, synthesis.mimeType());
        Instant now = clock.instant();
        PlaybackUnit dispatched = unit.dispatched(playbackId, now);
        if (!session.registerPlayback(dispatched, now)) {
            if (dispatched.epoch() != session.getTurnEpoch() || session.isShouldEndCall()) {
                stopQuietly(channel.callId, playbackId);
            }
            return;
        }
        store.addPlayback(channel.callId, playbackId, sessionTtl);
        store.increment(channel.callId, SessionCounter.ACTIVE_PLAYBACK_COUNT);
        store.clearFlag(channel.callId, SessionFlag.AGENT_DONE_SPEAKING);
        log.fine(() -> "stream.dispatched callId=" + channel.callId + " seq=" + unit.sequence()
                + " playbackId=" + playbackId);
    }

    private boolean isStale(CallSession session, PlaybackUnit unit) {
        return unit.epoch() != session.getTurnEpoch() || session.isShouldEndCall();
    }

    private void stopQuietly(String callId, String playbackId) {
        try {
            telephonyGateway.stopPlayback(callId, List.of(playbackId));
        } catch (Exception e) {
            log.log(Level.WARNING, "stream.stop.failed callId=" + callId + " playbackId=" + playbackId, e);
        }
    }

    private final class CallChannel {
        private final String callId;
        private final CallSession session;
        private final Queue<PlaybackUnit> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final AtomicBoolean keepAliveStarted = new AtomicBoolean(false);
        private final AtomicLong sequence = new AtomicLong();
        private final Object synthesisLock = new Object();
        private volatile SynthesisStream synthesis;
        private volatile TickScheduler.ScheduledTick keepAlive;

        private CallChannel(CallSession session) {
            this.callId = session.getCallId().value();
            this.session = session;
        }

        private SynthesisStream synthesis() {
            synchronized (synthesisLock) {
                if (synthesis != null && synthesis.isOpen()) {
                    return synthesis;
                }
                try {
                    synthesis = synthesisGateway.open(callId);
                } catch (Exception e) {
                    log.log(Level.WARNING, "stream.synthesis.open.failed callId=" + callId, e);
                    synthesis = null;
                }
                return synthesis;
            }
        }

        private void resetSynthesis() {
            synchronized (synthesisLock) {
                if (synthesis != null && !synthesis.isOpen()) {
                    synthesis.close();
                    synthesis = null;
                }
            }
        }

        private void keepAlive() {
            SynthesisStream current = synthesis;
            if (current == null || !current.isOpen()) {
                synthesis();
                return;
            }
            try {
                current.keepAlive();
            } catch (RuntimeException e) {
                log.warning("stream.keepalive.failed callId=" + callId + " error=" + e.getMessage());
            }
        }
    }
}
