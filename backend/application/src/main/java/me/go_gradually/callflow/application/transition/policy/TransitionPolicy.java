package me.go_gradually.callflow.application.transition.policy;

import java.time.Duration;
import java.util.List;

public interface TransitionPolicy {
    Duration transitionTimeout();

    int historyWindow();

    String transitionModel();

    List<String> affirmativePrefixes();

    List<String> negativePrefixes();
}
