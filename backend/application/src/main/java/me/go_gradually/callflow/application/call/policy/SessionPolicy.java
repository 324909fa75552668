package me.go_gradually.callflow.application.call.policy;

import java.time.Duration;

public interface SessionPolicy {
    int historyLimit();

    Duration sessionTtl();

    Duration flagTtl();

    Duration readyWaitTimeout();

    String defaultAgentId();

    String contentModel();

    Duration contentTimeout();

    Duration extractionTimeout();

    Duration webhookTimeout();

    int webhookAttempts();

    String closingLine();

    String fallbackLine();

    String holdOnReply();

    String transferMessage();

    String digitPrompt();

    Duration teardownDrainTimeout();

    int maxNodeHops();
}
