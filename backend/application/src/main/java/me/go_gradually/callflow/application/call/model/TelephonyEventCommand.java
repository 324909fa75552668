package me.go_gradually.callflow.application.call.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class TelephonyEventCommand {
    private String eventId;
    private TelephonyEventType eventType;
    private String callId;
    private String playbackId;
    private String agentId;
    private Map<String, String> variables = new LinkedHashMap<>();

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public TelephonyEventType getEventType() {
        return eventType;
    }

    public void setEventType(TelephonyEventType eventType) {
        this.eventType = eventType;
    }

    public String getCallId() {
        return callId;
    }

    public void setCallId(String callId) {
        this.callId = callId;
    }

    public String getPlaybackId() {
        return playbackId;
    }

    public void setPlaybackId(String playbackId) {
        this.playbackId = playbackId;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, String> variables) {
        this.variables = variables == null ? new LinkedHashMap<>() : variables;
    }
}
