package me.go_gradually.callflow.application.interruption.model;

import me.go_gradually.callflow.domain.call.UtteranceClass;

public record InterruptionOutcome(UtteranceClass utteranceClass, boolean playbackCancelled, boolean cancellationSuppressed) {
    public boolean accepted() {
        return utteranceClass.accepted();
    }
}
