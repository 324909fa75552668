package me.go_gradually.callflow.infrastructure.synthesis.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.stream.port.SpeechSynthesisGateway;
import me.go_gradually.callflow.application.stream.port.SynthesisStream;
import me.go_gradually.callflow.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Opens one persistent text-to-speech WebSocket per call. Text is sent with a flush and the
 * base64 audio chunks that come back are collected until the provider marks the
 * generation final or goes quiet.
 */
@Component
public class WebSocketSpeechSynthesisGateway implements SpeechSynthesisGateway {
    private static final Logger log = Logger.getLogger(WebSocketSpeechSynthesisGateway.class.getName());

    private final AppProperties.Synthesis settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebSocketSpeechSynthesisGateway(AppProperties properties) {
        this.settings = properties.getIntegrations().getSynthesis();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.getConnectTimeout())
                .build();
    }

    @Override
    public SynthesisStream open(String callId) {
        URI uri = toStreamUri();
        AudioCollector collector = new AudioCollector(objectMapper);
        WebSocket webSocket;
        try {
            webSocket = httpClient.newWebSocketBuilder()
                    .header("xi-api-key", settings.getApiKey())
                    .connectTimeout(settings.getConnectTimeout())
                    .buildAsync(uri, collector)
                    .get(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting synthesis stream", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to connect synthesis stream for call " + callId, e);
        }
        WebSocketSynthesisStream stream = new WebSocketSynthesisStream(
                callId, webSocket, collector, objectMapper, settings.getMimeType(), settings.getIdleAfterFlush());
        stream.sendText(" ", false);
        log.info(() -> "synthesis.stream.opened callId=" + callId);
        return stream;
    }

    URI toStreamUri() {
        String base = settings.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String query = "model_id=" + URLEncoder.encode(settings.getModelId(), StandardCharsets.UTF_8)
                + "&output_format=" + URLEncoder.encode(settings.getOutputFormat(), StandardCharsets.UTF_8);
        return URI.create(base + "/v1/text-to-speech/" + settings.getVoiceId() + "/stream-input?" + query);
    }

    static final class WebSocketSynthesisStream implements SynthesisStream {
        private final String callId;
        private final WebSocket webSocket;
        private final AudioCollector collector;
        private final ObjectMapper objectMapper;
        private final String mimeType;
        private final Duration idleAfterFlush;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        WebSocketSynthesisStream(String callId,
                                 WebSocket webSocket,
                                 AudioCollector collector,
                                 ObjectMapper objectMapper,
                                 String mimeType,
                                 Duration idleAfterFlush) {
            this.callId = callId;
            this.webSocket = webSocket;
            this.collector = collector;
            this.objectMapper = objectMapper;
            this.mimeType = mimeType;
            this.idleAfterFlush = idleAfterFlush;
        }

        @Override
        public synchronized byte[] synthesize(String text, boolean first, boolean last, Duration timeout) throws Exception {
            if (!isOpen()) {
                throw new IllegalStateException("Synthesis stream closed for call " + callId);
            }
            CompletableFuture<byte[]> pending = collector.begin();
            sendText(text.endsWith(" ") ? text : text + " ", true);
            long deadline = System.nanoTime() + timeout.toNanos();
            long pollMs = Math.max(10L, idleAfterFlush.toMillis() / 5);
            while (true) {
                try {
                    return pending.get(pollMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (collector.quietFor(idleAfterFlush)) {
                        return collector.finish();
                    }
                    if (System.nanoTime() >= deadline) {
                        collector.abandon();
                        throw new TimeoutException("Synthesis timed out after " + timeout.toMillis() + "ms for call " + callId);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof Exception exception) {
                        throw exception;
                    }
                    throw e;
                }
            }
        }

        @Override
        public String mimeType() {
            return mimeType;
        }

        @Override
        public void cancelPending() {
            collector.cancel();
        }

        @Override
        public void keepAlive() {
            if (isOpen()) {
                sendText(" ", false);
            }
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !collector.isClosed() && !webSocket.isOutputClosed();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            collector.cancel();
            try {
                webSocket.sendText("{\"text\":\"\"}", true).join();
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "call ended").join();
            } catch (RuntimeException e) {
                log.fine(() -> "synthesis.stream.close_failed callId=" + callId + " error=" + e.getMessage());
                webSocket.abort();
            }
            log.info(() -> "synthesis.stream.closed callId=" + callId);
        }

        void sendText(String text, boolean flush) {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("text", text);
            if (flush) {
                message.put("try_trigger_generation", true);
                message.put("flush", true);
            }
            try {
                webSocket.sendText(objectMapper.writeValueAsString(message), true).join();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to send synthesis text for call " + callId, e);
            }
        }
    }

    static final class AudioCollector implements WebSocket.Listener {
        private final ObjectMapper objectMapper;
        private final StringBuilder partial = new StringBuilder();
        private ByteArrayOutputStream audio = new ByteArrayOutputStream();
        private CompletableFuture<byte[]> pending;
        private long lastChunkNanos;
        private volatile boolean closed;

        AudioCollector(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        synchronized CompletableFuture<byte[]> begin() {
            audio = new ByteArrayOutputStream();
            lastChunkNanos = 0L;
            pending = new CompletableFuture<>();
            return pending;
        }

        synchronized boolean quietFor(Duration idle) {
            return audio.size() > 0 && System.nanoTime() - lastChunkNanos >= idle.toNanos();
        }

        synchronized byte[] finish() {
            byte[] bytes = audio.toByteArray();
            if (pending != null) {
                pending.complete(bytes);
                pending = null;
            }
            return bytes;
        }

        synchronized void abandon() {
            pending = null;
            audio = new ByteArrayOutputStream();
        }

        synchronized void cancel() {
            if (pending != null) {
                pending.completeExceptionally(new CancellationException("Synthesis cancelled"));
                pending = null;
            }
            audio = new ByteArrayOutputStream();
        }

        boolean isClosed() {
            return closed;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                handle(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            fail(new IllegalStateException("Synthesis stream closed: " + statusCode + " " + reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            fail(new IllegalStateException("Synthesis stream failed", error));
        }

        private synchronized void handle(String message) {
            JsonNode root;
            try {
                root = objectMapper.readTree(message);
            } catch (Exception e) {
                log.fine(() -> "synthesis.stream.skip reason=" + e.getMessage());
                return;
            }
            if (pending == null) {
                return;
            }
            String chunk = root.path("audio").asText("");
            if (!chunk.isEmpty()) {
                byte[] decoded = Base64.getDecoder().decode(chunk);
                audio.write(decoded, 0, decoded.length);
                lastChunkNanos = System.nanoTime();
            }
            if (root.path("isFinal").asBoolean(false)) {
                finish();
            }
        }

        private synchronized void fail(Exception error) {
            closed = true;
            if (pending != null) {
                pending.completeExceptionally(error);
                pending = null;
            }
        }
    }
}
