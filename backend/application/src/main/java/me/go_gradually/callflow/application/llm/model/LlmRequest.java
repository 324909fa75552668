package me.go_gradually.callflow.application.llm.model;

import java.util.List;

public record LlmRequest(String model, List<LlmMessage> messages, int maxTokens, double temperature) {
    public LlmRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("LLM request needs at least one message");
        }
        messages = List.copyOf(messages);
    }
}
