package me.go_gradually.callflow.domain.flow;

public record VariableSpec(String name, String description, boolean mandatory) {
    public VariableSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name is required");
        }
        description = description == null ? "" : description.trim();
    }
}
