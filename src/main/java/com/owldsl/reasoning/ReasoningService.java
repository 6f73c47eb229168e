package com.owldsl.reasoning;

import openllet.owlapi.OpenlletReasoner;
import org.semanticweb.owlapi.model.*;

import java.util.Set;

public interface ReasoningService extends AutoCloseable {

    /**
     * Initialize the reasoner with an ontology
     */
    void initializeReasoner(OWLOntology ontology);

    /**
     * Get the underlying Pellet reasoner
     */
    OpenlletReasoner getReasoner();

    boolean isConsistent();

    /**
     * Precompute the class hierarchy
     */
    void precomputeInferences();

    boolean isEntailed(OWLAxiom axiom);

    /**
     * Named superclasses entailed for a class, owl:Thing excluded
     */
    Set<OWLClass> getSuperClasses(OWLClass owlClass, boolean direct);

    /**
     * Named subclasses entailed for a class, owl:Nothing excluded
     */
    Set<OWLClass> getSubClasses(OWLClass owlClass, boolean direct);
}
