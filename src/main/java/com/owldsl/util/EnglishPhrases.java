// com/owldsl/util/EnglishPhrases.java
package com.owldsl.util;

import java.util.List;

/**
 * Small English surface-grammar helpers used when assembling CNL sentences
 */
public final class EnglishPhrases {

    private static final String VOWELS = "aeiou";

    private static final String[] NUMBER_WORDS = {
            "zero", "one", "two", "three", "four", "five", "six",
            "seven", "eight", "nine", "ten", "eleven", "twelve"
    };

    private EnglishPhrases() {
    }

    /**
     * Indefinite article for a term ("a" or "an"), decided by its first letter
     */
    public static String indefiniteArticle(String term) {
        if (term == null || term.isEmpty()) {
            return "a";
        }
        return VOWELS.indexOf(Character.toLowerCase(term.charAt(0))) >= 0 ? "an" : "a";
    }

    /**
     * Prefix a term with its indefinite article. A missing term becomes "something".
     */
    public static String withIndefiniteArticle(String term) {
        if (term == null || term.isBlank()) {
            return "something";
        }
        return indefiniteArticle(term) + " " + term;
    }

    /**
     * Join items as an English list: "A", "A and B", "A, B, and C"
     */
    public static String joinWithAnd(List<String> items) {
        return join(items, "and");
    }

    /**
     * Join items as an English disjunction: "A", "A or B", "A, B, or C"
     */
    public static String joinWithOr(List<String> items) {
        return join(items, "or");
    }

    private static String join(List<String> items, String conjunction) {
        if (items.isEmpty()) {
            return "";
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        if (items.size() == 2) {
            return items.get(0) + " " + conjunction + " " + items.get(1);
        }
        String head = String.join(", ", items.subList(0, items.size() - 1));
        return head + ", " + conjunction + " " + items.get(items.size() - 1);
    }

    /**
     * Spell out small cardinalities ("two"); larger numbers stay as digits
     */
    public static String numberWord(int number) {
        if (number >= 0 && number < NUMBER_WORDS.length) {
            return NUMBER_WORDS[number];
        }
        return Integer.toString(number);
    }

    /**
     * Lower-case the first character of a label, leaving the rest as authored
     */
    public static String lowerCaseFirst(String label) {
        if (label == null || label.isEmpty()) {
            return label;
        }
        return Character.toLowerCase(label.charAt(0)) + label.substring(1);
    }

    /**
     * Upper-case the first character of a sentence
     */
    public static String capitalize(String sentence) {
        if (sentence == null || sentence.isEmpty()) {
            return sentence;
        }
        return Character.toUpperCase(sentence.charAt(0)) + sentence.substring(1);
    }

    /**
     * Terminate a sentence with a period unless it already ends with punctuation
     */
    public static String asSentence(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        char last = trimmed.charAt(trimmed.length() - 1);
        return (last == '.' || last == '?' || last == '!') ? trimmed : trimmed + ".";
    }
}
