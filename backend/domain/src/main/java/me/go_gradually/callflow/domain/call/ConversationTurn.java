package me.go_gradually.callflow.domain.call;

import java.time.Instant;

public record ConversationTurn(Speaker speaker, String text, Instant at) {
    public ConversationTurn {
        if (speaker == null) {
            throw new IllegalArgumentException("speaker is required");
        }
        text = text == null ? "" : text.trim();
    }
}
