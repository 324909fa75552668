package me.go_gradually.callflow.application.transition.model;

public record TransitionDecision(String targetNodeId, TransitionOutcome outcome, boolean stay) {
    public static TransitionDecision move(String targetNodeId, TransitionOutcome outcome) {
        if (targetNodeId == null || targetNodeId.isBlank()) {
            throw new IllegalArgumentException("targetNodeId is required");
        }
        return new TransitionDecision(targetNodeId, outcome, false);
    }

    public static TransitionDecision stay(String currentNodeId, TransitionOutcome outcome) {
        return new TransitionDecision(currentNodeId, outcome, true);
    }
}
