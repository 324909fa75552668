package me.go_gradually.callflow.application.call.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.webhook.port.WebhookGateway;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.flow.WebhookSpec;
import me.go_gradually.callflow.domain.util.TemplateRenderer;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public class WebhookExecutor {
    private static final Logger log = Logger.getLogger(WebhookExecutor.class.getName());

    private final WebhookGateway webhookGateway;
    private final ObjectMapper objectMapper;
    private final MetricsPort metrics;
    private final Clock clock;
    private final Duration timeout;
    private final int attempts;

    public WebhookExecutor(WebhookGateway webhookGateway,
                           ObjectMapper objectMapper,
                           MetricsPort metrics,
                           Clock clock,
                           Duration timeout,
                           int attempts) {
        this.webhookGateway = webhookGateway;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.timeout = timeout;
        this.attempts = Math.max(1, attempts);
    }

    /**
     * Calls the node's webhook with the silence monitor paused. The raw body lands in the response
     * variable and scalar fields of a JSON object body become session variables.
     */
    public Optional<String> execute(CallSession session, WebhookSpec spec) {
        Map<String, String> variables = session.getVariables();
        String url = TemplateRenderer.render(spec.url(), variables);
        String body = spec.bodyTemplate() == null ? null : TemplateRenderer.render(spec.bodyTemplate(), variables);
        session.setExecutingWebhook(true, clock.instant());
        try {
            for (int attempt = 1; attempt <= attempts; attempt += 1) {
                try {
                    String response = webhookGateway.call(spec.method(), url, body, timeout);
                    apply(session, spec, response);
                    return Optional.ofNullable(response);
                } catch (Exception e) {
                    log.warning("webhook.failed callId=" + session.getCallId().value() + " attempt=" + attempt
                            + " error=" + e.getMessage());
                }
            }
            metrics.incrementWebhookError();
            return Optional.empty();
        } finally {
            session.setExecutingWebhook(false, clock.instant());
        }
    }

    private void apply(CallSession session, WebhookSpec spec, String response) {
        if (response == null || response.isBlank()) {
            return;
        }
        if (spec.responseVariable() != null && !spec.responseVariable().isBlank()) {
            session.putVariable(spec.responseVariable(), response.trim());
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            if (!root.isObject()) {
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                    session.putVariable(field.getKey(), field.getValue().asText());
                }
            }
        } catch (Exception e) {
            log.fine(() -> "webhook.response.notjson callId=" + session.getCallId().value());
        }
    }
}
