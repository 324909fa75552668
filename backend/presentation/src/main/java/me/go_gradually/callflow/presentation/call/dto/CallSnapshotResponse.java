package me.go_gradually.callflow.presentation.call.dto;

import java.time.Instant;
import java.util.Map;

public class CallSnapshotResponse {
    private String callId;
    private String agentId;
    private String currentNodeId;
    private int activePlaybackCount;
    private boolean agentSpeaking;
    private boolean userSpeaking;
    private int checkinCount;
    private Instant silenceStartedAt;
    private Map<String, String> variables;
    private boolean ended;
    private String endReason;

    public String getCallId() {
        return callId;
    }

    public void setCallId(String callId) {
        this.callId = callId;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public void setCurrentNodeId(String currentNodeId) {
        this.currentNodeId = currentNodeId;
    }

    public int getActivePlaybackCount() {
        return activePlaybackCount;
    }

    public void setActivePlaybackCount(int activePlaybackCount) {
        this.activePlaybackCount = activePlaybackCount;
    }

    public boolean isAgentSpeaking() {
        return agentSpeaking;
    }

    public void setAgentSpeaking(boolean agentSpeaking) {
        this.agentSpeaking = agentSpeaking;
    }

    public boolean isUserSpeaking() {
        return userSpeaking;
    }

    public void setUserSpeaking(boolean userSpeaking) {
        this.userSpeaking = userSpeaking;
    }

    public int getCheckinCount() {
        return checkinCount;
    }

    public void setCheckinCount(int checkinCount) {
        this.checkinCount = checkinCount;
    }

    public Instant getSilenceStartedAt() {
        return silenceStartedAt;
    }

    public void setSilenceStartedAt(Instant silenceStartedAt) {
        this.silenceStartedAt = silenceStartedAt;
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, String> variables) {
        this.variables = variables;
    }

    public boolean isEnded() {
        return ended;
    }

    public void setEnded(boolean ended) {
        this.ended = ended;
    }

    public String getEndReason() {
        return endReason;
    }

    public void setEndReason(String endReason) {
        this.endReason = endReason;
    }
}
