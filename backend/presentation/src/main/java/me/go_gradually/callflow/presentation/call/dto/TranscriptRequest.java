package me.go_gradually.callflow.presentation.call.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public class TranscriptRequest {
    @NotNull
    private String text;
    private boolean isFinal;
    private Instant timestamp;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public boolean getIsFinal() {
        return isFinal;
    }

    public void setIsFinal(boolean isFinal) {
        this.isFinal = isFinal;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
