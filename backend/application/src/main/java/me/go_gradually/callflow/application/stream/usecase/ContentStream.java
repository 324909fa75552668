package me.go_gradually.callflow.application.stream.usecase;

import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.PlaybackUnit;
import me.go_gradually.callflow.domain.speech.SentenceBuffer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One piece of agent content being fed to the coordinator, either all at once or as streamed
 * model deltas. Every unit it produces carries the epoch captured when the stream began.
 */
public final class ContentStream {
    private final AudioStreamCoordinator coordinator;
    private final CallSession session;
    private final long epoch;
    private final SentenceBuffer buffer;
    private final StringBuilder text = new StringBuilder();
    private final List<PlaybackUnit> units = new ArrayList<>();
    private boolean finished;

    ContentStream(AudioStreamCoordinator coordinator, CallSession session, long epoch, SentenceBuffer buffer) {
        this.coordinator = coordinator;
        this.session = session;
        this.epoch = epoch;
        this.buffer = buffer;
    }

    public synchronized void append(String delta) {
        if (finished || delta == null || delta.isEmpty()) {
            return;
        }
        text.append(delta);
        for (String fragment : buffer.append(delta)) {
            enqueue(fragment, false);
        }
    }

    public synchronized List<PlaybackUnit> finish(Instant now) {
        if (finished) {
            return List.copyOf(units);
        }
        finished = true;
        List<String> rest = buffer.flush();
        for (int i = 0; i < rest.size(); i += 1) {
            enqueue(rest.get(i), i == rest.size() - 1);
        }
        session.recordAgentText(text.toString(), now);
        return List.copyOf(units);
    }

    public synchronized boolean hasOutput() {
        return !units.isEmpty();
    }

    public synchronized String text() {
        return text.toString();
    }

    public long epoch() {
        return epoch;
    }

    private void enqueue(String fragment, boolean last) {
        units.add(coordinator.enqueue(session, fragment, units.isEmpty(), last, epoch));
    }
}
