package me.go_gradually.callflow.domain.speech;

import me.go_gradually.callflow.domain.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits speakable text on sentence boundaries, falling back to commas and dashes for long sentences.
 */
public final class SentenceSegmenter {
    private static final Pattern STRONG_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern SOFT_BOUNDARY = Pattern.compile("(?<=[,;:—])\\s+|\\s+[-–]\\s+");

    private final int maxFragmentChars;

    public SentenceSegmenter(int maxFragmentChars) {
        if (maxFragmentChars < 20) {
            throw new IllegalArgumentException("maxFragmentChars must be at least 20");
        }
        this.maxFragmentChars = maxFragmentChars;
    }

    public List<String> segment(String text) {
        List<String> fragments = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return fragments;
        }
        for (String sentence : STRONG_BOUNDARY.split(text.trim())) {
            appendBounded(fragments, sentence.trim());
        }
        return fragments;
    }

    /**
     * Returns the index just past the last strong boundary in the text, or -1 when none is complete yet.
     */
    public int lastCompleteBoundary(CharSequence text) {
        Matcher matcher = STRONG_BOUNDARY.matcher(text);
        int end = -1;
        while (matcher.find()) {
            end = matcher.end();
        }
        return end;
    }

    public int maxFragmentChars() {
        return maxFragmentChars;
    }

    private void appendBounded(List<String> fragments, String sentence) {
        if (sentence.isEmpty()) {
            return;
        }
        if (sentence.length() <= maxFragmentChars) {
            fragments.add(sentence);
            return;
        }
        StringBuilder current = new StringBuilder();
        for (String part : SOFT_BOUNDARY.split(sentence)) {
            String piece = part.trim();
            if (piece.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 1 + piece.length() > maxFragmentChars) {
                flushWords(fragments, current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(piece);
        }
        if (current.length() > 0) {
            flushWords(fragments, current.toString());
        }
    }

    private void flushWords(List<String> fragments, String piece) {
        if (piece.length() <= maxFragmentChars) {
            fragments.add(piece);
            return;
        }
        fragments.addAll(TextUtils.splitChunks(piece, maxFragmentChars));
    }
}
