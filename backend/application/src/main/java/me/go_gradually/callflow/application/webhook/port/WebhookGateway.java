package me.go_gradually.callflow.application.webhook.port;

import java.time.Duration;

public interface WebhookGateway {
    String call(String method, String url, String body, Duration timeout) throws Exception;
}
