package me.go_gradually.callflow.infrastructure.webhook.gateway;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WebClientWebhookGatewayTest {

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
    void call_postsJsonBodyAndReturnsResponse() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"slot\":\"3pm\"}"));

        String response = gateway().call("post", server.url("/book").toString(), "{\"name\":\"Ann\"}", Duration.ofSeconds(2));

        assertEquals("{\"slot\":\"3pm\"}", response);
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/book", request.getPath());
        assertEquals("{\"name\":\"Ann\"}", request.getBody().readUtf8());
    }

    @Test
    void call_getSendsNoBody() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        gateway().call("GET", server.url("/status?id=1").toString(), "{\"ignored\":true}", Duration.ofSeconds(2));

        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/status?id=1", request.getPath());
        assertEquals(0, request.getBodySize());
    }

    @Test
    void call_returnsEmptyForEmptyResponse() {
        server.enqueue(new MockResponse().setResponseCode(204));

        assertEquals("", gateway().call("DELETE", server.url("/slot").toString(), "", Duration.ofSeconds(2)));
    }

    @Test
    void call_wrapsErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(IllegalStateException.class,
                () -> gateway().call("POST", server.url("/book").toString(), "{}", Duration.ofSeconds(2)));
    }

    private WebClientWebhookGateway gateway() {
        return new WebClientWebhookGateway(WebClient.create());
    }
}
