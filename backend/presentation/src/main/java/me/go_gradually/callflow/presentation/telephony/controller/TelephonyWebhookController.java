package me.go_gradually.callflow.presentation.telephony.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import me.go_gradually.callflow.application.call.model.TelephonyEventCommand;
import me.go_gradually.callflow.application.call.model.TelephonyEventType;
import me.go_gradually.callflow.application.call.usecase.SessionOrchestrator;
import me.go_gradually.callflow.presentation.telephony.dto.TelephonyWebhookRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

@RestController
@RequestMapping("/api/telephony/webhooks")
public class TelephonyWebhookController {
    private static final Logger log = Logger.getLogger(TelephonyWebhookController.class.getName());

    private final SessionOrchestrator sessionOrchestrator;
    private final ObjectMapper objectMapper;

    public TelephonyWebhookController(SessionOrchestrator sessionOrchestrator, ObjectMapper objectMapper) {
        this.sessionOrchestrator = sessionOrchestrator;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void receive(@Valid @RequestBody TelephonyWebhookRequest request) {
        TelephonyWebhookRequest.Data data = request.getData();
        TelephonyWebhookRequest.Payload payload = data.getPayload();
        TelephonyEventType eventType = TelephonyEventType.fromCode(data.getEventType());
        if (eventType == TelephonyEventType.UNKNOWN) {
            log.fine(() -> "telephony.webhook.ignored eventType=" + data.getEventType()
                    + " callId=" + payload.getCallControlId());
            return;
        }

        TelephonyEventCommand command = new TelephonyEventCommand();
        command.setEventId(data.getId());
        command.setEventType(eventType);
        command.setCallId(payload.getCallControlId());
        command.setPlaybackId(payload.getPlaybackId());
        applyClientState(command, payload.getClientState());
        sessionOrchestrator.onTelephonyEvent(command);
    }

    // client_state is base64 JSON: {"agent_id": "...", "variables": {...}}
    private void applyClientState(TelephonyEventCommand command, String clientState) {
        if (clientState == null || clientState.isBlank()) {
            return;
        }
        JsonNode root;
        try {
            String decoded = new String(Base64.getDecoder().decode(clientState.trim()), StandardCharsets.UTF_8);
            root = objectMapper.readTree(decoded);
        } catch (Exception e) {
            log.warning(() -> "telephony.webhook.client_state_invalid callId=" + command.getCallId()
                    + " error=" + e.getMessage());
            return;
        }
        String agentId = root.path("agent_id").asText("");
        if (!agentId.isBlank()) {
            command.setAgentId(agentId);
        }
        Map<String, String> variables = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("variables").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            variables.put(field.getKey(), field.getValue().isTextual() ? field.getValue().asText() : field.getValue().toString());
        }
        command.setVariables(variables);
    }
}
