package com.owldsl.explanation;

import openllet.owlapi.OpenlletReasoner;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLClass;
import org.semanticweb.owlapi.model.OWLSubClassOfAxiom;

import java.util.Set;

public interface ExplanationService {

    void initializeExplanations(OpenlletReasoner reasoner);

    /**
     * One justification (minimal set of axioms) for {@code subClass ⊑ superClass}. Empty when the
     * subsumption is not entailed.
     */
    Set<OWLAxiom> explainSubsumption(OWLClass subClass, OWLClass superClass);

    /**
     * One justification for an arbitrary class inclusion, either side possibly anonymous. Empty when the
     * axiom is not entailed.
     */
    Set<OWLAxiom> explainEntailment(OWLSubClassOfAxiom axiom);

    /**
     * Whether the subsumption is asserted directly, in which case there is nothing to explain
     */
    boolean isAsserted(OWLClass subClass, OWLClass superClass);
}
