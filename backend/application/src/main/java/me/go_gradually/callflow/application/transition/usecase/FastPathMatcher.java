package me.go_gradually.callflow.application.transition.usecase;

import me.go_gradually.callflow.application.transition.model.Polarity;
import me.go_gradually.callflow.domain.flow.Transition;
import me.go_gradually.callflow.domain.util.TextUtils;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves plainly affirmative or negative replies against transitions whose condition wording
 * has the same polarity, without a model call.
 */
public class FastPathMatcher {
    private static final Set<String> NEGATIVE_CONDITION_WORDS = Set.of(
            "no", "not", "don't", "doesn't", "isn't", "won't", "never", "decline", "declines", "declined",
            "refuse", "refuses", "reject", "rejects", "negative", "disagree", "disagrees", "uninterested", "denies"
    );
    private static final Set<String> AFFIRMATIVE_CONDITION_WORDS = Set.of(
            "yes", "agree", "agrees", "agreed", "affirm", "affirms", "affirmative", "interested", "accept",
            "accepts", "confirm", "confirms", "confirmed", "positive", "positively", "okay", "sure", "wants"
    );
    // "not sure", "don't know", "no idea" ask for help rather than decline
    private static final Set<String> HEDGE_WORDS = Set.of("sure", "know", "idea", "certain", "unsure");

    private final List<String> affirmativePrefixes;
    private final List<String> negativePrefixes;

    public FastPathMatcher(List<String> affirmativePrefixes, List<String> negativePrefixes) {
        this.affirmativePrefixes = List.copyOf(affirmativePrefixes);
        this.negativePrefixes = List.copyOf(negativePrefixes);
    }

    public Optional<Transition> match(String utterance, List<Transition> candidates) {
        Polarity polarity = utterancePolarity(utterance);
        if (polarity == Polarity.NEUTRAL) {
            return Optional.empty();
        }
        for (Transition candidate : candidates) {
            if (conditionPolarity(candidate.condition()) == polarity) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public Polarity utterancePolarity(String utterance) {
        String normalized = TextUtils.normalize(utterance);
        if (normalized.isEmpty()) {
            return Polarity.NEUTRAL;
        }
        for (String prefix : negativePrefixes) {
            if (TextUtils.startsWithPhrase(normalized, prefix)) {
                return isHedge(normalized) ? Polarity.NEUTRAL : Polarity.NEGATIVE;
            }
        }
        for (String prefix : affirmativePrefixes) {
            if (TextUtils.startsWithPhrase(normalized, prefix)) {
                return Polarity.AFFIRMATIVE;
            }
        }
        return Polarity.NEUTRAL;
    }

    private boolean isHedge(String normalized) {
        return TextUtils.words(normalized).stream().anyMatch(HEDGE_WORDS::contains);
    }

    public Polarity conditionPolarity(String condition) {
        List<String> words = TextUtils.words(condition);
        for (String word : words) {
            if (NEGATIVE_CONDITION_WORDS.contains(word)) {
                return Polarity.NEGATIVE;
            }
        }
        for (String word : words) {
            if (AFFIRMATIVE_CONDITION_WORDS.contains(word)) {
                return Polarity.AFFIRMATIVE;
            }
        }
        return Polarity.NEUTRAL;
    }
}
