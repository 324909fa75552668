package me.go_gradually.callflow.domain.flow;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

public record Transition(String condition, String targetNodeId, Set<String> requiredVariables) {
    private static final Set<String> DEFAULT_CONDITIONS = Set.of("default", "otherwise", "else", "always");

    public Transition {
        if (targetNodeId == null || targetNodeId.isBlank()) {
            throw new IllegalArgumentException("Transition target is required");
        }
        condition = condition == null ? "" : condition.trim();
        requiredVariables = requiredVariables == null ? Set.of() : Set.copyOf(requiredVariables);
    }

    public static Transition of(String condition, String targetNodeId) {
        return new Transition(condition, targetNodeId, Set.of());
    }

    public boolean isSatisfiedBy(Map<String, String> variables) {
        for (String name : requiredVariables) {
            String value = variables == null ? null : variables.get(name);
            if (value == null || value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    public boolean isDefault() {
        return condition.isEmpty() || DEFAULT_CONDITIONS.contains(condition.toLowerCase(Locale.ROOT));
    }
}
