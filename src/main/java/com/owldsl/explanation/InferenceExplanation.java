// com/owldsl/explanation/InferenceExplanation.java
package com.owldsl.explanation;

import java.util.List;

/**
 * A rendered justification for one entailed subsumption
 */
public class InferenceExplanation {

    private final String subClassIri;
    private final String superClassIri;
    private final String header;
    private final List<ProofStep> steps;
    private final String proof;
    private final String error;

    public InferenceExplanation(String subClassIri, String superClassIri, String header,
                                List<ProofStep> steps, String proof, String error) {
        this.subClassIri = subClassIri;
        this.superClassIri = superClassIri;
        this.header = header;
        this.steps = List.copyOf(steps);
        this.proof = proof;
        this.error = error;
    }

    public String getSubClassIri() { return subClassIri; }

    /**
     * IRI of the superclass, or the Manchester text of the class expression for a justified GCI
     */
    public String getSuperClassIri() { return superClassIri; }

    public String getHeader() { return header; }
    public List<ProofStep> getSteps() { return steps; }
    public String getProof() { return proof; }

    /**
     * Rendering failure message, null when the proof rendered
     */
    public String getError() { return error; }

    public boolean hasError() {
        return error != null;
    }

    /**
     * False when every step was elided, i.e. there is no informative justification
     */
    public boolean isInformative() {
        return proof != null && !proof.isEmpty();
    }

    @Override
    public String toString() {
        return header + "\n\n" + (hasError() ? "[" + error + "]" : proof);
    }
}
