// com/owldsl/expression/AtomicClass.java
package com.owldsl.expression;

import java.util.Objects;

/**
 * Reference to a named class together with its human-readable label
 */
public final class AtomicClass extends ClassExpression {

    public static final String OWL_THING = "http://www.w3.org/2002/07/owl#Thing";
    public static final String OWL_NOTHING = "http://www.w3.org/2002/07/owl#Nothing";

    private final String iri;
    private final String label;

    public AtomicClass(String iri, String label) {
        this.iri = Objects.requireNonNull(iri, "iri");
        this.label = label;
    }

    public static AtomicClass thing() {
        return new AtomicClass(OWL_THING, "thing");
    }

    public String getIri() { return iri; }

    /**
     * The rdfs:label of the class, or null when the ontology gives none
     */
    public String getLabel() { return label; }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }

    public boolean isOwlThing() {
        return OWL_THING.equals(iri);
    }

    public boolean isOwlNothing() {
        return OWL_NOTHING.equals(iri);
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public AtomicClass asAtomic() {
        return this;
    }

    @Override
    public <T, E extends Exception> T accept(ClassExpressionVisitor<T, E> visitor) throws E {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        AtomicClass that = (AtomicClass) obj;
        return iri.equals(that.iri) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(iri, label);
    }

    @Override
    public String toString() {
        return hasLabel() ? "'" + label + "'" : "<" + iri + ">";
    }
}
