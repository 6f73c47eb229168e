package com.owldsl.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnglishPhrasesTest {

    @Test
    void testIndefiniteArticle() {
        assertEquals("a", EnglishPhrases.indefiniteArticle("foramen"));
        assertEquals("an", EnglishPhrases.indefiniteArticle("organ"));
        assertEquals("an", EnglishPhrases.indefiniteArticle("Eye"));
        assertEquals("something", EnglishPhrases.withIndefiniteArticle(null));
        assertEquals("an anatomical structure", EnglishPhrases.withIndefiniteArticle("anatomical structure"));
    }

    @Test
    void testJoins() {
        assertEquals("", EnglishPhrases.joinWithAnd(List.of()));
        assertEquals("a bone", EnglishPhrases.joinWithOr(List.of("a bone")));
        assertEquals("a bone and a vein", EnglishPhrases.joinWithAnd(List.of("a bone", "a vein")));
        assertEquals("a A, a B, or a C", EnglishPhrases.joinWithOr(List.of("a A", "a B", "a C")));
    }

    @Test
    void testNumberWords() {
        assertEquals("two", EnglishPhrases.numberWord(2));
        assertEquals("twelve", EnglishPhrases.numberWord(12));
        assertEquals("27", EnglishPhrases.numberWord(27));
    }

    @Test
    void testCasingAndSentences() {
        assertEquals("vestibular aqueduct", EnglishPhrases.lowerCaseFirst("Vestibular aqueduct"));
        assertEquals("mRNA", EnglishPhrases.lowerCaseFirst("mRNA"));
        assertEquals("It is", EnglishPhrases.capitalize("it is"));
        assertEquals("A canal.", EnglishPhrases.asSentence("A canal "));
        assertEquals("A canal?", EnglishPhrases.asSentence("A canal?"));
        assertEquals("", EnglishPhrases.asSentence("  "));
    }
}
