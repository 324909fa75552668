package me.go_gradually.callflow.infrastructure.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.llm.model.LlmMessage;
import me.go_gradually.callflow.application.llm.model.LlmRequest;
import me.go_gradually.callflow.application.llm.port.LlmClient;
import me.go_gradually.callflow.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.logging.Logger;

@Component
public class OpenAiLlmClient implements LlmClient {
    private static final Logger log = Logger.getLogger(OpenAiLlmClient.class.getName());
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final String DONE = "[DONE]";
    private static final int MAX_ATTEMPTS = 2;
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebClient webClient;
    private final String apiKey;

    @Autowired
    public OpenAiLlmClient(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getOpenai().getApiKey());
    }

    OpenAiLlmClient(WebClient webClient, String apiKey) {
        this.webClient = webClient;
        this.apiKey = apiKey;
    }

    @Override
    public String complete(LlmRequest request, Duration timeout) throws Exception {
        Map<String, Object> payload = payload(request, false);
        long deadline = System.nanoTime() + timeout.toNanos();
        for (int attempt = 1; ; attempt++) {
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                throw new TimeoutException("OpenAI completion timed out after " + timeout.toMillis() + "ms");
            }
            try {
                String body = webClient.post()
                        .uri(COMPLETIONS_PATH)
                        .headers(headers -> headers.setBearerAuth(apiKey))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(payload)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(remaining)
                        .block();
                JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
                return root.path("choices").path(0).path("message").path("content").asText("").trim();
            } catch (WebClientResponseException e) {
                if (attempt >= MAX_ATTEMPTS || !retryable(e)) {
                    throw new IllegalStateException("OpenAI request failed: " + resolveErrorMessage(e.getResponseBodyAsString()), e);
                }
                int failedAttempt = attempt;
                log.warning(() -> "openai.llm.retry attempt=" + failedAttempt + " status=" + e.getStatusCode().value());
            } catch (RuntimeException e) {
                throw unwrapTimeout(e, timeout);
            }
        }
    }

    @Override
    public void stream(LlmRequest request, Duration timeout, Consumer<String> onDelta) throws Exception {
        Map<String, Object> payload = payload(request, true);
        try {
            webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToFlux(SSE_TYPE)
                    .take(timeout)
                    .mapNotNull(ServerSentEvent::data)
                    .takeWhile(data -> !DONE.equals(data.trim()))
                    .doOnNext(data -> {
                        String delta = extractDelta(data);
                        if (!delta.isEmpty()) {
                            onDelta.accept(delta);
                        }
                    })
                    .blockLast();
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("OpenAI stream failed: " + resolveErrorMessage(e.getResponseBodyAsString()), e);
        }
    }

    String extractDelta(String data) {
        try {
            JsonNode root = objectMapper.readTree(data);
            return root.path("choices").path(0).path("delta").path("content").asText("");
        } catch (Exception e) {
            log.fine(() -> "openai.llm.stream.skip reason=" + e.getMessage());
            return "";
        }
    }

    private Map<String, Object> payload(LlmRequest request, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        List<Map<String, Object>> messages = new ArrayList<>();
        for (LlmMessage message : request.messages()) {
            messages.add(Map.of("role", message.role(), "content", message.content()));
        }
        payload.put("messages", messages);
        payload.put("max_tokens", request.maxTokens());
        payload.put("temperature", request.temperature());
        if (stream) {
            payload.put("stream", true);
        }
        return payload;
    }

    private boolean retryable(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        return status == 429 || status >= 500;
    }

    private Exception unwrapTimeout(RuntimeException e, Duration timeout) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof TimeoutException) {
                return new TimeoutException("OpenAI completion timed out after " + timeout.toMillis() + "ms");
            }
            cause = cause.getCause();
        }
        return e;
    }

    private String resolveErrorMessage(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            String message = root.path("error").path("message").asText("");
            return message.isBlank() ? body : message;
        } catch (Exception e) {
            return body;
        }
    }
}
