package me.go_gradually.callflow.domain.flow;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record LogicSplit(List<LogicCondition> conditions, String defaultTargetNodeId) {
    public LogicSplit {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public Optional<String> route(Map<String, String> variables) {
        for (LogicCondition condition : conditions) {
            if (condition.targetNodeId() != null && !condition.targetNodeId().isBlank()
                    && condition.matches(variables)) {
                return Optional.of(condition.targetNodeId());
            }
        }
        if (defaultTargetNodeId == null || defaultTargetNodeId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(defaultTargetNodeId);
    }
}
