package me.go_gradually.callflow.domain.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest {

    @Test
    void normalize_lowercasesAndStripsPunctuation() {
        assertEquals("yes what's this about", TextUtils.normalize("Yes, what’s this about?!"));
        assertEquals("", TextUtils.normalize(null));
    }

    @Test
    void words_andTrigrams() {
        List<String> words = TextUtils.words("passive income websites today");

        assertEquals(4, words.size());
        assertEquals(Set.of("passive income websites", "income websites today"), TextUtils.trigrams(words));
    }

    @Test
    void phraseMatching_respectsWordBoundaries() {
        assertTrue(TextUtils.startsWithPhrase("yeah sure", "yeah"));
        assertFalse(TextUtils.startsWithPhrase("yeahhh", "yeah"));
        assertTrue(TextUtils.containsPhrase("can you hold on a second", "hold on"));
        assertFalse(TextUtils.containsPhrase("household", "hold"));
    }

    @Test
    void splitChunks_breaksAtWordBoundaries() {
        List<String> chunks = TextUtils.splitChunks("alpha beta gamma delta", 11);

        assertEquals(List.of("alpha beta", "gamma delta"), chunks);
    }

    @Test
    void trimToLength_truncates() {
        assertEquals("abc", TextUtils.trimToLength("abcdef", 4));
        assertEquals("", TextUtils.trimToLength(null, 4));
    }

    @Test
    void numericValues_parseShorthandAndCurrency() {
        assertEquals(10000d, NumericValues.parse("$10,000").orElseThrow());
        assertEquals(8000d, NumericValues.parse("8k a month").orElseThrow());
        assertEquals(1_500_000d, NumericValues.parse("1.5M").orElseThrow());
        assertTrue(NumericValues.parse("none").isEmpty());
    }

    @Test
    void templateRenderer_substitutesKnownAndBlanksUnknown() {
        String rendered = TemplateRenderer.render("Hi {{ first_name }}, this is {{agent}} {{missing}} calling.",
                Map.of("first_name", "Dana", "agent", "Sam"));

        assertEquals("Hi Dana, this is Sam calling.", rendered);
    }
}
