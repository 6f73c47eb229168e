// com/owldsl/explanation/ProofStepType.java
package com.owldsl.explanation;

/**
 * Kinds of steps in a justification chain
 */
public enum ProofStepType {
    SUBCLASS("Subsumption"),
    EQUIVALENCE("Equivalent Class"),
    TRANSITIVE("Transitive Property"),
    DOMAIN("Domain"),
    RANGE("Range"),
    SUB_PROPERTY("Subproperty");

    private final String displayName;

    ProofStepType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isClassStep() {
        return this == SUBCLASS || this == EQUIVALENCE;
    }
}
