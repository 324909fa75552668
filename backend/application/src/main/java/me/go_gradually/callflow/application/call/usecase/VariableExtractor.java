package me.go_gradually.callflow.application.call.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.llm.model.LlmMessage;
import me.go_gradually.callflow.application.llm.model.LlmRequest;
import me.go_gradually.callflow.application.llm.port.LlmClient;
import me.go_gradually.callflow.application.shared.port.AsyncExecutor;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.flow.VariableSpec;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Pulls declared variables out of the caller's reply. Mandatory variables are extracted inline
 * before routing; optional ones are filled in the background.
 */
public class VariableExtractor {
    private static final Logger log = Logger.getLogger(VariableExtractor.class.getName());

    private final LlmClient llmClient;
    private final AsyncExecutor asyncExecutor;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration timeout;

    public VariableExtractor(LlmClient llmClient,
                             AsyncExecutor asyncExecutor,
                             ObjectMapper objectMapper,
                             String model,
                             Duration timeout) {
        this.llmClient = llmClient;
        this.asyncExecutor = asyncExecutor;
        this.objectMapper = objectMapper;
        this.model = model;
        this.timeout = timeout;
    }

    public Map<String, String> extractMandatory(CallSession session, List<VariableSpec> specs, String utterance) {
        Map<String, String> values = extract(session, specs, utterance);
        session.putVariables(values);
        return values;
    }

    public void extractOptionalAsync(CallSession session, List<VariableSpec> specs, String utterance) {
        if (specs.isEmpty()) {
            return;
        }
        asyncExecutor.execute(() -> session.putVariables(extract(session, specs, utterance)));
    }

    Map<String, String> extract(CallSession session, List<VariableSpec> specs, String utterance) {
        if (specs == null || specs.isEmpty() || utterance == null || utterance.isBlank()) {
            return Map.of();
        }
        try {
            String answer = llmClient.complete(buildRequest(specs, utterance), timeout);
            return parse(answer, specs);
        } catch (Exception e) {
            log.warning("variables.extract.failed callId=" + session.getCallId().value() + " error=" + e.getMessage());
            return Map.of();
        }
    }

    Map<String, String> parse(String answer, List<VariableSpec> specs) throws Exception {
        if (answer == null) {
            return Map.of();
        }
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Map.of();
        }
        JsonNode root = objectMapper.readTree(answer.substring(start, end + 1));
        Map<String, String> values = new LinkedHashMap<>();
        for (VariableSpec spec : specs) {
            JsonNode value = root.get(spec.name());
            if (value == null || value.isNull() || value.isContainerNode()) {
                continue;
            }
            String text = value.asText().trim();
            if (!text.isEmpty() && !"null".equalsIgnoreCase(text)) {
                values.put(spec.name(), text);
            }
        }
        return values;
    }

    private LlmRequest buildRequest(List<VariableSpec> specs, String utterance) {
        StringBuilder fields = new StringBuilder();
        for (VariableSpec spec : specs) {
            fields.append("- ").append(spec.name()).append(": ").append(spec.description()).append('\n');
        }
        String system = "Extract values from the caller's reply. Respond with a JSON object only, "
                + "using the field names below. Use null when a value is not stated.";
        String user = "Fields:\n" + fields + "\nCaller's reply: " + utterance;
        return new LlmRequest(model, List.of(LlmMessage.system(system), LlmMessage.user(user)), 200, 0.0);
    }
}
