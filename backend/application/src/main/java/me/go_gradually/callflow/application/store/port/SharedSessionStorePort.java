package me.go_gradually.callflow.application.store.port;

import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionDescriptor;
import me.go_gradually.callflow.application.store.model.SessionFlag;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

public interface SharedSessionStorePort {
    Optional<SessionDescriptor> get(String callId);

    void set(String callId, SessionDescriptor descriptor, Duration ttl);

    long increment(String callId, SessionCounter counter);

    /**
     * Decrements atomically and never goes below zero.
     */
    long decrement(String callId, SessionCounter counter);

    long counter(String callId, SessionCounter counter);

    void resetCounter(String callId, SessionCounter counter);

    void setFlag(String callId, SessionFlag flag, Duration ttl);

    boolean setFlagIfAbsent(String callId, SessionFlag flag, Duration ttl);

    boolean getFlag(String callId, SessionFlag flag);

    void clearFlag(String callId, SessionFlag flag);

    boolean addPlayback(String callId, String playbackId, Duration ttl);

    boolean removePlayback(String callId, String playbackId);

    Set<String> playbackIds(String callId);

    void clearPlaybacks(String callId);

    boolean markEventProcessed(String eventId, Duration ttl);

    void expire(String callId);
}
