package me.go_gradually.callflow.application.support;

import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionDescriptor;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class FakeSessionStore implements SharedSessionStorePort {
    private final Map<String, SessionDescriptor> descriptors = new ConcurrentHashMap<>();
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private final Set<String> flags = ConcurrentHashMap.newKeySet();
    private final Map<String, Set<String>> playbacks = new ConcurrentHashMap<>();
    private final Set<String> events = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<SessionDescriptor> get(String callId) {
        return Optional.ofNullable(descriptors.get(callId));
    }

    @Override
    public void set(String callId, SessionDescriptor descriptor, Duration ttl) {
        descriptors.put(callId, descriptor);
    }

    @Override
    public long increment(String callId, SessionCounter counter) {
        return counters.merge(callId + ":" + counter.code(), 1L, Long::sum);
    }

    @Override
    public long decrement(String callId, SessionCounter counter) {
        return counters.compute(callId + ":" + counter.code(), (key, value) -> Math.max(0L, (value == null ? 0L : value) - 1L));
    }

    @Override
    public long counter(String callId, SessionCounter counter) {
        return counters.getOrDefault(callId + ":" + counter.code(), 0L);
    }

    @Override
    public void resetCounter(String callId, SessionCounter counter) {
        counters.put(callId + ":" + counter.code(), 0L);
    }

    @Override
    public void setFlag(String callId, SessionFlag flag, Duration ttl) {
        flags.add(callId + ":" + flag.code());
    }

    @Override
    public boolean setFlagIfAbsent(String callId, SessionFlag flag, Duration ttl) {
        return flags.add(callId + ":" + flag.code());
    }

    @Override
    public boolean getFlag(String callId, SessionFlag flag) {
        return flags.contains(callId + ":" + flag.code());
    }

    @Override
    public void clearFlag(String callId, SessionFlag flag) {
        flags.remove(callId + ":" + flag.code());
    }

    @Override
    public boolean addPlayback(String callId, String playbackId, Duration ttl) {
        return playbacks.computeIfAbsent(callId, key -> ConcurrentHashMap.newKeySet()).add(playbackId);
    }

    @Override
    public boolean removePlayback(String callId, String playbackId) {
        Set<String> ids = playbacks.get(callId);
        return ids != null && ids.remove(playbackId);
    }

    @Override
    public Set<String> playbackIds(String callId) {
        return Set.copyOf(playbacks.getOrDefault(callId, Set.of()));
    }

    @Override
    public void clearPlaybacks(String callId) {
        playbacks.remove(callId);
    }

    @Override
    public boolean markEventProcessed(String eventId, Duration ttl) {
        return events.add(eventId);
    }

    @Override
    public void expire(String callId) {
        descriptors.remove(callId);
        playbacks.remove(callId);
        counters.keySet().removeIf(key -> key.startsWith(callId + ":"));
        flags.removeIf(key -> key.startsWith(callId + ":"));
    }
}
