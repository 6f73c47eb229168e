// com/owldsl/expression/PropertyRef.java
package com.owldsl.expression;

import com.owldsl.util.URIUtils;

import java.util.Objects;

/**
 * An object property used in a restriction: stable IRI, human label and whether the property
 * is asserted reflexive
 */
public final class PropertyRef {

    private final String iri;
    private final String label;
    private final boolean reflexive;

    public PropertyRef(String iri, String label, boolean reflexive) {
        this.iri = Objects.requireNonNull(iri, "iri");
        this.label = label;
        this.reflexive = reflexive;
    }

    public PropertyRef(String iri, String label) {
        this(iri, label, false);
    }

    public String getIri() { return iri; }
    public String getLabel() { return label; }
    public boolean isReflexive() { return reflexive; }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }

    public String getLocalName() {
        return URIUtils.getLocalName(iri);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        PropertyRef that = (PropertyRef) obj;
        return reflexive == that.reflexive && iri.equals(that.iri) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(iri, label, reflexive);
    }

    @Override
    public String toString() {
        return hasLabel() ? label : getLocalName();
    }
}
