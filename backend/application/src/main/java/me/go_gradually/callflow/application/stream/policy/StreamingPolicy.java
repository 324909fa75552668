package me.go_gradually.callflow.application.stream.policy;

import java.time.Duration;

public interface StreamingPolicy {
    int maxFragmentChars();

    Duration synthesisTimeout();

    int playbackAttempts();

    Duration keepAliveInterval();
}
