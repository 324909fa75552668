package me.go_gradually.callflow.application.interruption.model;

import me.go_gradually.callflow.domain.call.CallSession;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record AgentChannelState(boolean busy, Duration quietFor, List<String> agentTexts) {
    public AgentChannelState {
        quietFor = quietFor == null ? Duration.ZERO : quietFor;
        agentTexts = agentTexts == null ? List.of() : List.copyOf(agentTexts);
    }

    public static AgentChannelState of(CallSession session, Instant now) {
        List<String> texts = new ArrayList<>(session.getActivePlaybackTexts());
        String last = session.getLastAgentText();
        if (last != null && !last.isBlank()) {
            texts.add(last);
        }
        texts.addAll(session.getRecentAgentTexts());
        return new AgentChannelState(session.isAgentSpeaking(), session.agentQuietFor(now), texts);
    }
}
