package me.go_gradually.callflow.domain.flow;

import java.util.Locale;

public record WebhookSpec(String url, String method, String bodyTemplate, String responseVariable) {
    public WebhookSpec {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Webhook url is required");
        }
        method = method == null || method.isBlank() ? "POST" : method.toUpperCase(Locale.ROOT);
        bodyTemplate = bodyTemplate == null ? "" : bodyTemplate;
    }
}
