package me.go_gradually.callflow.application.llm.port;

import me.go_gradually.callflow.application.llm.model.LlmRequest;

import java.time.Duration;
import java.util.function.Consumer;

public interface LlmClient {
    String complete(LlmRequest request, Duration timeout) throws Exception;

    /**
     * Streams content deltas in arrival order. Must give up once the timeout elapses.
     */
    void stream(LlmRequest request, Duration timeout, Consumer<String> onDelta) throws Exception;
}
