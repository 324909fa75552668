package me.go_gradually.callflow.infrastructure.telephony.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelnyxTelephonyGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void startPlayback_uploadsBase64AudioAndReturnsPlaybackId() throws Exception {
        enqueueJson("{\"data\":{\"playback_id\":\"pb-9\"}}");
        byte[] audio = "mp3-bytes".getBytes(StandardCharsets.UTF_8);

        String playbackId = gateway().startPlayback("c1", audio, "audio/mpeg");

        assertEquals("pb-9", playbackId);
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v2/calls/c1/actions/playback_start", request.getPath());
        assertEquals("Bearer telnyx-key", request.getHeader("Authorization"));
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(Base64.getEncoder().encodeToString(audio), payload.path("playback_content").asText());
        assertEquals("mp3", payload.path("audio_type").asText());
    }

    @Test
    void startPlayback_usesWavForWaveAudio() throws Exception {
        enqueueJson("{\"data\":{\"playback_id\":\"pb-1\"}}");

        gateway().startPlayback("c1", new byte[]{1, 2}, "audio/WAV");

        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("wav", payload.path("audio_type").asText());
    }

    @Test
    void startPlayback_failsWithoutPlaybackId() {
        enqueueJson("{\"data\":{}}");

        assertThrows(IllegalStateException.class, () -> gateway().startPlayback("c1", new byte[]{1}, "audio/mpeg"));
    }

    @Test
    void stopPlayback_withoutIdsStopsEverything() throws Exception {
        enqueueJson("{\"data\":{\"result\":\"ok\"}}");

        gateway().stopPlayback("c1", List.of());

        RecordedRequest request = server.takeRequest();
        assertEquals("/v2/calls/c1/actions/playback_stop", request.getPath());
        assertEquals("{}", request.getBody().readUtf8());
    }

    @Test
    void stopPlayback_sendsPlaybackIds() throws Exception {
        enqueueJson("{\"data\":{\"result\":\"ok\"}}");

        gateway().stopPlayback("c1", List.of("pb-1", "pb-2"));

        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("pb-1", payload.path("playback_ids").path(0).asText());
        assertEquals("pb-2", payload.path("playback_ids").path(1).asText());
    }

    @Test
    void transfer_postsDestination() throws Exception {
        enqueueJson("{\"data\":{\"result\":\"ok\"}}");

        gateway().transfer("c1", "+15550100");

        RecordedRequest request = server.takeRequest();
        assertEquals("/v2/calls/c1/actions/transfer", request.getPath());
        assertEquals("+15550100", objectMapper.readTree(request.getBody().readUtf8()).path("to").asText());
    }

    @Test
    void hangup_wrapsApiErrors() {
        server.enqueue(new MockResponse().setResponseCode(422).setBody("{\"errors\":[{\"title\":\"Call ended\"}]}"));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> gateway().hangup("c1"));

        assertTrue(error.getMessage().contains("422"));
    }

    private TelnyxTelephonyGateway gateway() {
        WebClient webClient = WebClient.builder().baseUrl(server.url("/").toString()).build();
        return new TelnyxTelephonyGateway(webClient, "telnyx-key");
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(body));
    }
}
