// com/owldsl/expression/Restriction.java
package com.owldsl.expression;

import java.util.Objects;

/**
 * Role restriction: a property, a quantifier, an optional cardinality and a filler
 */
public final class Restriction extends ClassExpression {

    private final PropertyRef property;
    private final Quantifier quantifier;
    private final Integer cardinality;
    private final ClassExpression filler;

    public Restriction(PropertyRef property, Quantifier quantifier, Integer cardinality, ClassExpression filler) {
        this.property = Objects.requireNonNull(property, "property");
        this.quantifier = Objects.requireNonNull(quantifier, "quantifier");
        this.filler = Objects.requireNonNull(filler, "filler");
        if (quantifier.isCardinality() && cardinality == null) {
            throw new IllegalArgumentException(quantifier + " restriction on " + property + " needs a cardinality");
        }
        if (cardinality != null && cardinality < 0) {
            throw new IllegalArgumentException("Negative cardinality " + cardinality + " on " + property);
        }
        this.cardinality = cardinality;
    }

    public static Restriction some(PropertyRef property, ClassExpression filler) {
        return new Restriction(property, Quantifier.EXISTENTIAL, null, filler);
    }

    public static Restriction only(PropertyRef property, ClassExpression filler) {
        return new Restriction(property, Quantifier.UNIVERSAL, null, filler);
    }

    public static Restriction exactly(int cardinality, PropertyRef property, ClassExpression filler) {
        return new Restriction(property, Quantifier.EXACT_CARDINALITY, cardinality, filler);
    }

    public PropertyRef getProperty() { return property; }
    public Quantifier getQuantifier() { return quantifier; }

    /**
     * Cardinality of a cardinality restriction, null for the other quantifiers
     */
    public Integer getCardinality() { return cardinality; }

    public ClassExpression getFiller() { return filler; }

    @Override
    public <T, E extends Exception> T accept(ClassExpressionVisitor<T, E> visitor) throws E {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Restriction that = (Restriction) obj;
        return property.equals(that.property) && quantifier == that.quantifier
                && Objects.equals(cardinality, that.cardinality) && filler.equals(that.filler);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, quantifier, cardinality, filler);
    }

    @Override
    public String toString() {
        String card = cardinality != null ? cardinality + " " : "";
        if (quantifier == Quantifier.SELF) {
            return "∃ " + property + ".Self";
        }
        return quantifier.getSymbol() + " " + card + property + "." + filler;
    }
}
