package me.go_gradually.callflow.application.store.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import me.go_gradually.callflow.domain.call.CallSession;

import java.util.List;
import java.util.Map;

/**
 * Serializable slice of a call that any worker can read back. Holds plain data only.
 */
public record SessionDescriptor(String callId,
                                String agentId,
                                String currentNodeId,
                                Map<String, String> variables,
                                String lastAgentText,
                                List<String> recentAgentTexts,
                                boolean userHasSpoken,
                                int checkinCount,
                                long callStartedAtEpochMs) {

    public SessionDescriptor {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        recentAgentTexts = recentAgentTexts == null ? List.of() : List.copyOf(recentAgentTexts);
        lastAgentText = lastAgentText == null ? "" : lastAgentText;
    }

    public static SessionDescriptor from(CallSession session) {
        return new SessionDescriptor(
                session.getCallId().value(),
                session.getAgentId(),
                session.getCurrentNodeId(),
                session.getVariables(),
                session.getLastAgentText(),
                session.getRecentAgentTexts(),
                session.isUserHasSpoken(),
                session.getCheckinCount(),
                session.getCallStartedAt().toEpochMilli()
        );
    }

    @JsonIgnore
    public boolean isRestorable() {
        return agentId != null && !agentId.isBlank() && callStartedAtEpochMs > 0;
    }
}
