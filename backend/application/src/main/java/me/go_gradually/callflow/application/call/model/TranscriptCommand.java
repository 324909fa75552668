package me.go_gradually.callflow.application.call.model;

import java.time.Instant;

public class TranscriptCommand {
    private String callId;
    private String text;
    private boolean finalTranscript;
    private Instant timestamp;

    public String getCallId() {
        return callId;
    }

    public void setCallId(String callId) {
        this.callId = callId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public boolean isFinalTranscript() {
        return finalTranscript;
    }

    public void setFinalTranscript(boolean finalTranscript) {
        this.finalTranscript = finalTranscript;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
