// com/owldsl/expression/Quantifier.java
package com.owldsl.expression;

/**
 * Quantification of a role restriction
 */
public enum Quantifier {
    EXISTENTIAL("∃"),
    UNIVERSAL("∀"),
    EXACT_CARDINALITY("="),
    MIN_CARDINALITY("≥"),
    MAX_CARDINALITY("≤"),
    // ObjectHasSelf: the filler is the subject itself
    SELF("∃");

    private final String symbol;

    Quantifier(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isCardinality() {
        return this == EXACT_CARDINALITY || this == MIN_CARDINALITY || this == MAX_CARDINALITY;
    }
}
