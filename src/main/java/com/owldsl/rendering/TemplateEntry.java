// com/owldsl/rendering/TemplateEntry.java
package com.owldsl.rendering;

import java.util.Objects;

/**
 * Phrase templates for one property. Each phrase carries a single {@code {}} placeholder that is
 * replaced by the rendered filler (or, for the prompt, by the name of the defined class).
 */
public final class TemplateEntry {

    public static final String PLACEHOLDER = "{}";

    private final String singular;
    private final String plural;
    private final String definitionPrompt;

    public TemplateEntry(String singular, String plural, String definitionPrompt) {
        this.singular = Objects.requireNonNull(singular, "singular");
        this.plural = Objects.requireNonNull(plural, "plural");
        this.definitionPrompt = Objects.requireNonNull(definitionPrompt, "definitionPrompt");
    }

    /**
     * The "is {label} {}" convention shared by standard roles and the unconfigured fallback
     */
    public static TemplateEntry isPhrasing(String propertyLabel) {
        String phrase = "is " + propertyLabel + " " + PLACEHOLDER;
        return new TemplateEntry(phrase, phrase, "What is " + PLACEHOLDER + " " + propertyLabel + "?");
    }

    public String getSingular() { return singular; }
    public String getPlural() { return plural; }
    public String getDefinitionPrompt() { return definitionPrompt; }

    public String phraseFor(Multiplicity multiplicity) {
        return multiplicity == Multiplicity.PLURAL ? plural : singular;
    }

    /**
     * Substitute the filler text into the phrase for the given multiplicity
     */
    public String apply(Multiplicity multiplicity, String fillerText) {
        return substitute(phraseFor(multiplicity), fillerText);
    }

    public String prompt(String subjectName) {
        return substitute(definitionPrompt, subjectName);
    }

    static String substitute(String phrase, String value) {
        int index = phrase.indexOf(PLACEHOLDER);
        if (index < 0) {
            return phrase;
        }
        return phrase.substring(0, index) + value + phrase.substring(index + PLACEHOLDER.length());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        TemplateEntry that = (TemplateEntry) obj;
        return singular.equals(that.singular) && plural.equals(that.plural)
                && definitionPrompt.equals(that.definitionPrompt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(singular, plural, definitionPrompt);
    }

    @Override
    public String toString() {
        return "TemplateEntry{singular='" + singular + "', plural='" + plural
                + "', prompt='" + definitionPrompt + "'}";
    }
}
