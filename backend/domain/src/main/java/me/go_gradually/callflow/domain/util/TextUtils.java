package me.go_gradually.callflow.domain.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}'\\-\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
    }

    public static String trimToLength(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, Math.max(0, maxChars - 1)).trim();
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        String stripped = NON_WORD.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static List<String> words(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    public static Set<String> wordSet(String text) {
        return new LinkedHashSet<>(words(text));
    }

    public static Set<String> trigrams(List<String> words) {
        Set<String> trigrams = new LinkedHashSet<>();
        for (int i = 0; i + 2 < words.size(); i += 1) {
            trigrams.add(words.get(i) + " " + words.get(i + 1) + " " + words.get(i + 2));
        }
        return trigrams;
    }

    public static boolean startsWithPhrase(String normalizedText, String phrase) {
        String normalizedPhrase = normalize(phrase);
        if (normalizedPhrase.isEmpty()) {
            return false;
        }
        return normalizedText.equals(normalizedPhrase) || normalizedText.startsWith(normalizedPhrase + " ");
    }

    public static boolean containsPhrase(String normalizedText, String phrase) {
        String normalizedPhrase = normalize(phrase);
        if (normalizedPhrase.isEmpty()) {
            return false;
        }
        return (" " + normalizedText + " ").contains(" " + normalizedPhrase + " ");
    }

    public static List<String> splitChunks(String text, int maxChunkSize) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }
        int index = 0;
        while (index < text.length()) {
            while (index < text.length() && text.charAt(index) == ' ') {
                index += 1;
            }
            if (index >= text.length()) {
                break;
            }
            int end = Math.min(text.length(), index + maxChunkSize);
            if (end < text.length() && text.charAt(end) != ' ') {
                int space = text.lastIndexOf(' ', end);
                if (space > index) {
                    end = space;
                }
            }
            String chunk = text.substring(index, end).trim();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            index = end;
        }
        return chunks;
    }
}
