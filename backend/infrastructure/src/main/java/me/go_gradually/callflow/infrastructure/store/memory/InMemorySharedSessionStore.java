package me.go_gradually.callflow.infrastructure.store.memory;

import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionDescriptor;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process store. Entries expire lazily on read.
 */
public class InMemorySharedSessionStore implements SharedSessionStorePort {
    private final Map<String, Expiring<SessionDescriptor>> descriptors = new ConcurrentHashMap<>();
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private final Map<String, Instant> flags = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> playbacks = new ConcurrentHashMap<>();
    private final Map<String, Instant> events = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySharedSessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<SessionDescriptor> get(String callId) {
        Expiring<SessionDescriptor> entry = descriptors.get(callId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expired(clock.instant())) {
            descriptors.remove(callId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String callId, SessionDescriptor descriptor, Duration ttl) {
        descriptors.put(callId, new Expiring<>(descriptor, clock.instant().plus(ttl)));
    }

    @Override
    public long increment(String callId, SessionCounter counter) {
        return counters.merge(counterKey(callId, counter), 1L, Long::sum);
    }

    @Override
    public long decrement(String callId, SessionCounter counter) {
        return counters.compute(counterKey(callId, counter),
                (key, value) -> Math.max(0L, (value == null ? 0L : value) - 1L));
    }

    @Override
    public long counter(String callId, SessionCounter counter) {
        return counters.getOrDefault(counterKey(callId, counter), 0L);
    }

    @Override
    public void resetCounter(String callId, SessionCounter counter) {
        counters.remove(counterKey(callId, counter));
    }

    @Override
    public void setFlag(String callId, SessionFlag flag, Duration ttl) {
        flags.put(flagKey(callId, flag), clock.instant().plus(ttl));
    }

    @Override
    public boolean setFlagIfAbsent(String callId, SessionFlag flag, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean set = new AtomicBoolean(false);
        flags.compute(flagKey(callId, flag), (key, expiresAt) -> {
            if (expiresAt != null && expiresAt.isAfter(now)) {
                return expiresAt;
            }
            set.set(true);
            return now.plus(ttl);
        });
        return set.get();
    }

    @Override
    public boolean getFlag(String callId, SessionFlag flag) {
        Instant expiresAt = flags.get(flagKey(callId, flag));
        return expiresAt != null && expiresAt.isAfter(clock.instant());
    }

    @Override
    public void clearFlag(String callId, SessionFlag flag) {
        flags.remove(flagKey(callId, flag));
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
        Instant now = clock.instant();
        events.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        return events.putIfAbsent(eventId, now.plus(ttl)) == null;
    }

    @Override
    public void expire(String callId) {
        descriptors.remove(callId);
        playbacks.remove(callId);
        String prefix = callId + ":";
        counters.keySet().removeIf(key -> key.startsWith(prefix));
        flags.keySet().removeIf(key -> key.startsWith(prefix));
    }

    private static String counterKey(String callId, SessionCounter counter) {
        return callId + ":" + counter.code();
    }

    private static String flagKey(String callId, SessionFlag flag) {
        return callId + ":" + flag.code();
    }

    private record Expiring<T>(T value, Instant expiresAt) {
        private boolean expired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
