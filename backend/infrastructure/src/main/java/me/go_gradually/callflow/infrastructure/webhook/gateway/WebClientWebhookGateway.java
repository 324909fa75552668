package me.go_gradually.callflow.infrastructure.webhook.gateway;

import me.go_gradually.callflow.application.webhook.port.WebhookGateway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Locale;

@Component
public class WebClientWebhookGateway implements WebhookGateway {
    private final WebClient webClient;

    public WebClientWebhookGateway(@Qualifier("webhookWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String call(String method, String url, String body, Duration timeout) {
        HttpMethod httpMethod = HttpMethod.valueOf(method == null || method.isBlank()
                ? "POST"
                : method.trim().toUpperCase(Locale.ROOT));
        WebClient.RequestBodySpec request = webClient.method(httpMethod)
                .uri(url)
                .accept(MediaType.APPLICATION_JSON);
        WebClient.RequestHeadersSpec<?> spec = body == null || body.isBlank() || httpMethod == HttpMethod.GET
                ? request
                : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        try {
            String response = spec.retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return response == null ? "" : response;
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("Webhook " + httpMethod.name() + " " + url + " failed: "
                    + e.getStatusCode().value(), e);
        }
    }
}
