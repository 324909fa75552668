package me.go_gradually.callflow.application.interruption.policy;

import java.time.Duration;
import java.util.List;

public interface InterruptionPolicy {
    List<String> acknowledgementWords();

    int acknowledgementMaxWords();

    int minInterruptWords();

    Duration agentQuietGrace();

    double echoOverlapThreshold();

    Duration playbackStartBuffer();

    List<String> holdOnPhrases();
}
