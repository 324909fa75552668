package me.go_gradually.callflow.domain.flow;

import java.util.Map;

public record LogicCondition(String variable, LogicOperator operator, String value, String targetNodeId) {
    public LogicCondition {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("Condition variable is required");
        }
        operator = operator == null ? LogicOperator.EQUALS : operator;
        value = value == null ? "" : value;
    }

    public boolean matches(Map<String, String> variables) {
        return operator.test(variables.get(variable), value);
    }
}
