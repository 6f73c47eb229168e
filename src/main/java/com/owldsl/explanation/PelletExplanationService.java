package com.owldsl.explanation;

import openllet.owlapi.OpenlletReasoner;
import openllet.owlapi.explanation.PelletExplanation;
import org.semanticweb.owlapi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class PelletExplanationService implements ExplanationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PelletExplanationService.class);

    private PelletExplanation explanation;
    private OWLOntology ontology;
    private OpenlletReasoner reasoner;
    private OWLDataFactory dataFactory;
    private final Map<String, Set<OWLAxiom>> explanationCache = new ConcurrentHashMap<>();

    @Override
    public void initializeExplanations(OpenlletReasoner reasoner) {
        this.reasoner = reasoner;
        this.ontology = reasoner.getRootOntology();
        this.dataFactory = ontology.getOWLOntologyManager().getOWLDataFactory();
        LOGGER.info("Initializing Pellet explanation service");
        PelletExplanation.setup();
        this.explanation = new PelletExplanation(reasoner);
        explanationCache.clear();
    }

    @Override
    public Set<OWLAxiom> explainSubsumption(OWLClass subClass, OWLClass superClass) {
        if (explanation == null) {
            throw new IllegalStateException("Explanations not initialized. Call initializeExplanations() first.");
        }
        String cacheKey = subClass.getIRI() + "|" + superClass.getIRI();
        Set<OWLAxiom> cached = explanationCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        OWLAxiom axiom = dataFactory.getOWLSubClassOfAxiom(subClass, superClass);
        if (!reasoner.isEntailed(axiom)) {
            LOGGER.debug("Not entailed: {}", axiom);
            return Collections.emptySet();
        }

        Set<OWLAxiom> justification = explanation.getSubClassExplanation(subClass, superClass);
        if (justification == null) {
            justification = Collections.emptySet();
        }
        LOGGER.debug("Justification for {} has {} axioms", axiom, justification.size());
        explanationCache.put(cacheKey, justification);
        return justification;
    }

    @Override
    public Set<OWLAxiom> explainEntailment(OWLSubClassOfAxiom axiom) {
        if (explanation == null) {
            throw new IllegalStateException("Explanations not initialized. Call initializeExplanations() first.");
        }
        if (!axiom.getSubClass().isAnonymous() && !axiom.getSuperClass().isAnonymous()) {
            return explainSubsumption(axiom.getSubClass().asOWLClass(), axiom.getSuperClass().asOWLClass());
        }
        String cacheKey = axiom.toString();
        Set<OWLAxiom> cached = explanationCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }
        if (!reasoner.isEntailed(axiom)) {
            LOGGER.debug("Not entailed: {}", axiom);
            return Collections.emptySet();
        }

        Set<OWLAxiom> justification = explanation.getEntailmentExplanation(axiom);
        if (justification == null) {
            justification = Collections.emptySet();
        }
        LOGGER.debug("Justification for {} has {} axioms", axiom, justification.size());
        explanationCache.put(cacheKey, justification);
        return justification;
    }

    @Override
    public boolean isAsserted(OWLClass subClass, OWLClass superClass) {
        return ontology != null && ontology.containsAxiom(dataFactory.getOWLSubClassOfAxiom(subClass, superClass));
    }
}
