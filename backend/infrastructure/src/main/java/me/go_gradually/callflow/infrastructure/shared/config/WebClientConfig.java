package me.go_gradually.callflow.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    @Bean("telnyxWebClient")
    public WebClient telnyxWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getTelnyx().getBaseUrl());
    }

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getOpenai().getBaseUrl());
    }

    @Bean("webhookWebClient")
    public WebClient webhookWebClient() {
        return createWebClient(null);
    }

    private WebClient createWebClient(String baseUrl) {
        ConnectionProvider provider = createConnectionProvider();
        HttpClient httpClient = createHttpClient(provider);
        ExchangeStrategies strategies = createExchangeStrategies();
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    private ConnectionProvider createConnectionProvider() {
        return ConnectionProvider.builder("callflow-http")
                .maxConnections(200)
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .build();
    }

    private HttpClient createHttpClient(ConnectionProvider provider) {
        return HttpClient.create(provider).responseTimeout(Duration.ofSeconds(30));
    }

    private ExchangeStrategies createExchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }
}
