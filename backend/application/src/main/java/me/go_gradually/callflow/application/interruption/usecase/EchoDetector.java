package me.go_gradually.callflow.application.interruption.usecase;

import me.go_gradually.callflow.domain.util.TextUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class EchoDetector {
    private static final Set<String> FUNCTION_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "to", "of", "in", "on", "for", "at", "is", "are",
            "was", "it", "i", "you", "we", "me", "my", "your", "our", "this", "that", "so", "do", "be"
    );

    private final double overlapThreshold;

    public EchoDetector(double overlapThreshold) {
        this.overlapThreshold = overlapThreshold;
    }

    public boolean isEcho(String utterance, List<String> agentTexts) {
        List<String> utteranceWords = TextUtils.words(utterance);
        if (utteranceWords.size() < 2 || agentTexts == null) {
            return false;
        }
        String normalizedUtterance = String.join(" ", utteranceWords);
        for (String agentText : agentTexts) {
            if (matches(normalizedUtterance, utteranceWords, agentText)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String normalizedUtterance, List<String> utteranceWords, String agentText) {
        List<String> agentWords = TextUtils.words(agentText);
        if (agentWords.isEmpty()) {
            return false;
        }
        if (TextUtils.containsPhrase(String.join(" ", agentWords), normalizedUtterance)) {
            return true;
        }
        Set<String> sharedTrigrams = TextUtils.trigrams(utteranceWords);
        sharedTrigrams.retainAll(TextUtils.trigrams(agentWords));
        if (!sharedTrigrams.isEmpty()) {
            return true;
        }
        Set<String> content = contentWords(utteranceWords);
        if (content.isEmpty()) {
            return false;
        }
        Set<String> shared = new HashSet<>(content);
        shared.retainAll(contentWords(agentWords));
        return (double) shared.size() / content.size() >= overlapThreshold;
    }

    private Set<String> contentWords(List<String> words) {
        Set<String> content = new HashSet<>();
        for (String word : words) {
            if (!FUNCTION_WORDS.contains(word)) {
                content.add(word);
            }
        }
        return content;
    }
}
