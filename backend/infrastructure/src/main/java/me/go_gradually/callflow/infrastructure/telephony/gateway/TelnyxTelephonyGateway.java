package me.go_gradually.callflow.infrastructure.telephony.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.call.port.TelephonyGateway;
import me.go_gradually.callflow.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

@Component
public class TelnyxTelephonyGateway implements TelephonyGateway {
    private static final Logger log = Logger.getLogger(TelnyxTelephonyGateway.class.getName());

    private final WebClient webClient;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public TelnyxTelephonyGateway(@Qualifier("telnyxWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getTelnyx().getApiKey());
    }

    TelnyxTelephonyGateway(WebClient webClient, String apiKey) {
        this.webClient = webClient;
        this.apiKey = apiKey;
    }

    @Override
    public String startPlayback(String callId, byte[] audio, String mimeType) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playback_content", Base64.getEncoder().encodeToString(audio));
        payload.put("audio_type", audioType(mimeType));
        JsonNode root = objectMapper.readTree(post(callId, "playback_start", payload));
        String playbackId = root.path("data").path("playback_id").asText("");
        if (playbackId.isBlank()) {
            throw new IllegalStateException("Telnyx playback_start returned no playback id for call " + callId);
        }
        log.fine(() -> "telnyx.playback.started callId=" + callId + " playbackId=" + playbackId);
        return playbackId;
    }

    @Override
    public void stopPlayback(String callId, List<String> playbackIds) {
        Map<String, Object> payload = playbackIds == null || playbackIds.isEmpty()
                ? Map.of()
                : Map.of("playback_ids", playbackIds);
        post(callId, "playback_stop", payload);
    }

    @Override
    public void hangup(String callId) {
        post(callId, "hangup", Map.of());
        log.info(() -> "telnyx.hangup callId=" + callId);
    }

    @Override
    public void transfer(String callId, String destination) {
        post(callId, "transfer", Map.of("to", destination));
        log.info(() -> "telnyx.transfer callId=" + callId + " to=" + destination);
    }

    private String post(String callId, String action, Map<String, Object> payload) {
        try {
            String body = webClient.post()
                    .uri("/v2/calls/{callId}/actions/{action}", callId, action)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return body == null ? "{}" : body;
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("Telnyx " + action + " failed: " + e.getStatusCode().value()
                    + " " + e.getResponseBodyAsString(), e);
        }
    }

    private String audioType(String mimeType) {
        if (mimeType != null && mimeType.toLowerCase(Locale.ROOT).contains("wav")) {
            return "wav";
        }
        return "mp3";
    }
}
