package me.go_gradually.callflow.domain.flow;

import java.util.Locale;

public enum ContentMode {
    SCRIPT,
    PROMPT;

    public static ContentMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            return SCRIPT;
        }
        String normalized = code.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("prompt")) {
            return PROMPT;
        }
        if ("script".equals(normalized)) {
            return SCRIPT;
        }
        throw new IllegalArgumentException("Unknown content mode: " + code);
    }
}
