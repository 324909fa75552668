package me.go_gradually.callflow.application.support;

import me.go_gradually.callflow.application.call.policy.SessionPolicy;
import me.go_gradually.callflow.application.interruption.policy.InterruptionPolicy;
import me.go_gradually.callflow.application.silence.policy.SilencePolicy;
import me.go_gradually.callflow.application.stream.policy.StreamingPolicy;
import me.go_gradually.callflow.application.transition.policy.TransitionPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Policy values used across use case tests. Fields are public so a test can tweak one knob.
 */
public class TestPolicies implements SilencePolicy, InterruptionPolicy, TransitionPolicy, StreamingPolicy, SessionPolicy {
    public Duration silenceTimeout = Duration.ofSeconds(7);
    public Duration holdOnSilenceTimeout = Duration.ofSeconds(25);
    public int maxCheckins = 2;
    public Duration minCheckinInterval = Duration.ofSeconds(3);
    public Duration maxCallDuration = Duration.ofSeconds(1500);
    public Duration transitionTimeout = Duration.ofMillis(1500);
    public Duration playbackStartBuffer = Duration.ofMillis(500);
    public Duration agentQuietGrace = Duration.ofMillis(1500);
    public int playbackAttempts = 2;

    @Override
    public Duration silenceTimeout() {
        return silenceTimeout;
    }

    @Override
    public Duration holdOnSilenceTimeout() {
        return holdOnSilenceTimeout;
    }

    @Override
    public int maxCheckins() {
        return maxCheckins;
    }

    @Override
    public String checkinMessage() {
        return "Are you still there?";
    }

    @Override
    public Duration minCheckinInterval() {
        return minCheckinInterval;
    }

    @Override
    public Duration maxCallDuration() {
        return maxCallDuration;
    }

    @Override
    public Duration tickInterval() {
        return Duration.ofMillis(500);
    }

    @Override
    public List<String> acknowledgementWords() {
        return List.of("yeah", "yes", "okay", "ok", "yep", "sure", "uh-huh", "mhm", "go ahead");
    }

    @Override
    public int acknowledgementMaxWords() {
        return 2;
    }

    @Override
    public int minInterruptWords() {
        return 2;
    }

    @Override
    public Duration agentQuietGrace() {
        return agentQuietGrace;
    }

    @Override
    public double echoOverlapThreshold() {
        return 0.3;
    }

    @Override
    public Duration playbackStartBuffer() {
        return playbackStartBuffer;
    }

    @Override
    public List<String> holdOnPhrases() {
        return List.of("hold on", "wait", "one moment", "give me a second", "hang on", "just a sec", "one sec", "hold please");
    }

    @Override
    public Duration transitionTimeout() {
        return transitionTimeout;
    }

    @Override
    public int historyWindow() {
        return 10;
    }

    @Override
    public String transitionModel() {
        return "gpt-4o-mini";
    }

    @Override
    public List<String> affirmativePrefixes() {
        return List.of("yes", "yeah", "yep", "yup", "sure", "absolutely", "definitely", "of course", "okay", "ok", "correct", "sounds good", "that's right");
    }

    @Override
    public List<String> negativePrefixes() {
        return List.of("no", "nope", "nah", "not really", "not interested", "no thanks", "never");
    }

    @Override
    public int maxFragmentChars() {
        return 180;
    }

    @Override
    public Duration synthesisTimeout() {
        return Duration.ofSeconds(5);
    }

    @Override
    public int playbackAttempts() {
        return playbackAttempts;
    }

    @Override
    public Duration keepAliveInterval() {
        return Duration.ofSeconds(10);
    }

    @Override
    public int historyLimit() {
        return 20;
    }

    @Override
    public Duration sessionTtl() {
        return Duration.ofHours(1);
    }

    @Override
    public Duration flagTtl() {
        return Duration.ofSeconds(10);
    }

    @Override
    public Duration readyWaitTimeout() {
        return Duration.ofMillis(200);
    }

    @Override
    public String defaultAgentId() {
        return "default";
    }

    @Override
    public String contentModel() {
        return "gpt-4o-mini";
    }

    @Override
    public Duration contentTimeout() {
        return Duration.ofSeconds(5);
    }

    @Override
    public Duration extractionTimeout() {
        return Duration.ofSeconds(2);
    }

    @Override
    public Duration webhookTimeout() {
        return Duration.ofSeconds(5);
    }

    @Override
    public int webhookAttempts() {
        return 2;
    }

    @Override
    public String closingLine() {
        return "Sorry, something went wrong on our side. Goodbye.";
    }

    @Override
    public String fallbackLine() {
        return "Sorry, could you say that again?";
    }

    @Override
    public String holdOnReply() {
        return "Sure, take your time.";
    }

    @Override
    public String transferMessage() {
        return "Please hold while I transfer your call...";
    }

    @Override
    public String digitPrompt() {
        return "Please press a digit from 0 to 9, * or #.";
    }

    @Override
    public Duration teardownDrainTimeout() {
        return Duration.ofSeconds(30);
    }

    @Override
    public int maxNodeHops() {
        return 10;
    }
}
