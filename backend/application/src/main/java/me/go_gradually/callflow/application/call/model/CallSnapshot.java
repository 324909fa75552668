package me.go_gradually.callflow.application.call.model;

import java.time.Instant;
import java.util.Map;

public record CallSnapshot(String callId,
                           String agentId,
                           String currentNodeId,
                           int activePlaybackCount,
                           boolean agentSpeaking,
                           boolean userSpeaking,
                           int checkinCount,
                           Instant silenceStartedAt,
                           Map<String, String> variables,
                           boolean ended,
                           String endReason) {
}
