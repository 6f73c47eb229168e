package com.owldsl.reasoning;

import openllet.owlapi.OpenlletReasoner;
import openllet.owlapi.OpenlletReasonerFactory;
import org.semanticweb.owlapi.model.*;
import org.semanticweb.owlapi.reasoner.InferenceType;
import org.semanticweb.owlapi.reasoner.OWLReasonerConfiguration;
import org.semanticweb.owlapi.reasoner.SimpleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pellet-based reasoning service. Subsumptions are computed here and only rendered by the
 * CNL layer.
 */
public class PelletReasoningService implements ReasoningService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PelletReasoningService.class);

    private OpenlletReasoner reasoner;

    @Override
    public void initializeReasoner(OWLOntology ontology) {
        OpenlletReasonerFactory factory = new OpenlletReasonerFactory();

        OWLReasonerConfiguration config = new SimpleConfiguration();
        this.reasoner = factory.createReasoner(ontology, config);

        // justifications are requested later through PelletExplanation
        reasoner.getKB().setDoExplanation(true);

        reasoner.prepareReasoner();
        LOGGER.info("Pellet reasoner initialized with explanation support");
    }

    @Override
    public void precomputeInferences() {
        if (reasoner == null) {
            LOGGER.warn("Cannot precompute inferences - reasoner not initialized");
            return;
        }

        LOGGER.info("Precomputing class hierarchy...");
        long startTime = System.currentTimeMillis();

        try {
            reasoner.precomputeInferences(InferenceType.CLASS_HIERARCHY);
            LOGGER.info("Class hierarchy precomputed in {} ms", System.currentTimeMillis() - startTime);
        } catch (OutOfMemoryError e) {
            LOGGER.error("Out of memory during class hierarchy precomputation - using on-demand reasoning", e);
        }
    }

    @Override
    public OpenlletReasoner getReasoner() {
        if (reasoner == null) {
            throw new IllegalStateException("Reasoner not initialized. Call initializeReasoner() first.");
        }
        return reasoner;
    }

    @Override
    public boolean isConsistent() {
        if (reasoner == null) {
            return false;
        }

        boolean consistent = reasoner.isConsistent();
        LOGGER.info("Ontology consistency check: {}", consistent ? "CONSISTENT" : "INCONSISTENT");
        return consistent;
    }

    @Override
    public boolean isEntailed(OWLAxiom axiom) {
        return getReasoner().isEntailed(axiom);
    }

    @Override
    public Set<OWLClass> getSuperClasses(OWLClass owlClass, boolean direct) {
        if (reasoner == null) {
            return Collections.emptySet();
        }
        Set<OWLClass> superClasses = new TreeSet<>(reasoner.getSuperClasses(owlClass, direct).getFlattened());
        superClasses.removeIf(OWLClass::isOWLThing);
        return superClasses;
    }

    @Override
    public Set<OWLClass> getSubClasses(OWLClass owlClass, boolean direct) {
        if (reasoner == null) {
            return Collections.emptySet();
        }
        Set<OWLClass> subClasses = new TreeSet<>(reasoner.getSubClasses(owlClass, direct).getFlattened());
        subClasses.removeIf(OWLClass::isOWLNothing);
        return subClasses;
    }

    @Override
    public void close() {
        if (reasoner != null) {
            try {
                reasoner.dispose();
                LOGGER.info("Reasoner disposed successfully");
            } finally {
                reasoner = null;
            }
        }
    }
}
