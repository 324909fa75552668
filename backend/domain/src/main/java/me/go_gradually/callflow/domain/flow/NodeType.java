package me.go_gradually.callflow.domain.flow;

import java.util.Locale;

public enum NodeType {
    START("start"),
    CONVERSATION("conversation"),
    COLLECT_INPUT("collectInput"),
    EXTRACT_VARIABLE("extractVariable"),
    FUNCTION_CALL("functionCall"),
    LOGIC_SPLIT("logicSplit"),
    PRESS_DIGIT("pressDigit"),
    TRANSFER("transfer"),
    ENDING("ending");

    private final String code;

    NodeType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static NodeType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return CONVERSATION;
        }
        String normalized = code.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.code.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        if ("webhook".equals(normalized) || "function".equals(normalized)) {
            return FUNCTION_CALL;
        }
        throw new IllegalArgumentException("Unknown node type: " + code);
    }

    /**
     * Node types that are resolved without waiting for the caller to speak.
     */
    public boolean isImmediate() {
        return this == LOGIC_SPLIT || this == TRANSFER || this == ENDING;
    }
}
