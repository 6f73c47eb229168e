// com/owldsl/explanation/ProofStep.java
package com.owldsl.explanation;

import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.PropertyRef;

import java.util.Objects;

/**
 * One link of a justification chain. Class steps carry a subject and a superclass; property
 * steps carry the property (and, for sub-property steps, its super property). Domain and range
 * steps keep the domain or range class in {@code superclass}.
 */
public final class ProofStep {

    private final ProofStepType type;
    private final ClassExpression subject;
    private final ClassExpression superclass;
    private final PropertyRef property;
    private final PropertyRef superProperty;
    private final int depth;

    private ProofStep(ProofStepType type, ClassExpression subject, ClassExpression superclass,
                      PropertyRef property, PropertyRef superProperty, int depth) {
        this.type = Objects.requireNonNull(type, "type");
        this.subject = subject;
        this.superclass = superclass;
        this.property = property;
        this.superProperty = superProperty;
        this.depth = Math.max(0, depth);
    }

    public static ProofStep subClassOf(ClassExpression subject, ClassExpression superclass, int depth) {
        return new ProofStep(ProofStepType.SUBCLASS, Objects.requireNonNull(subject),
                Objects.requireNonNull(superclass), null, null, depth);
    }

    public static ProofStep equivalentTo(ClassExpression subject, ClassExpression superclass, int depth) {
        return new ProofStep(ProofStepType.EQUIVALENCE, Objects.requireNonNull(subject),
                Objects.requireNonNull(superclass), null, null, depth);
    }

    public static ProofStep transitive(PropertyRef property, int depth) {
        return new ProofStep(ProofStepType.TRANSITIVE, null, null, Objects.requireNonNull(property), null, depth);
    }

    public static ProofStep domain(PropertyRef property, ClassExpression domain, int depth) {
        return new ProofStep(ProofStepType.DOMAIN, null, Objects.requireNonNull(domain),
                Objects.requireNonNull(property), null, depth);
    }

    public static ProofStep range(PropertyRef property, ClassExpression range, int depth) {
        return new ProofStep(ProofStepType.RANGE, null, Objects.requireNonNull(range),
                Objects.requireNonNull(property), null, depth);
    }

    public static ProofStep subPropertyOf(PropertyRef subProperty, PropertyRef superProperty, int depth) {
        return new ProofStep(ProofStepType.SUB_PROPERTY, null, null, Objects.requireNonNull(subProperty),
                Objects.requireNonNull(superProperty), depth);
    }

    public ProofStepType getType() { return type; }
    public ClassExpression getSubject() { return subject; }
    public ClassExpression getSuperclass() { return superclass; }
    public PropertyRef getProperty() { return property; }
    public PropertyRef getSuperProperty() { return superProperty; }
    public int getDepth() { return depth; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ProofStep that = (ProofStep) obj;
        return depth == that.depth && type == that.type
                && Objects.equals(subject, that.subject) && Objects.equals(superclass, that.superclass)
                && Objects.equals(property, that.property) && Objects.equals(superProperty, that.superProperty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, subject, superclass, property, superProperty, depth);
    }

    @Override
    public String toString() {
        switch (type) {
            case SUBCLASS:
                return depth + ": " + subject + " ⊑ " + superclass;
            case EQUIVALENCE:
                return depth + ": " + subject + " ≡ " + superclass;
            case SUB_PROPERTY:
                return depth + ": " + property + " ⊑ " + superProperty;
            case DOMAIN:
                return depth + ": domain(" + property + ") = " + superclass;
            case RANGE:
                return depth + ": range(" + property + ") = " + superclass;
            default:
                return depth + ": Transitive(" + property + ")";
        }
    }
}
