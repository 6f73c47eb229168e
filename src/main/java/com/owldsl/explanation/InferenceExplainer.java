// com/owldsl/explanation/InferenceExplainer.java
package com.owldsl.explanation;

import com.owldsl.expression.AtomicClass;
import com.owldsl.ontology.ManchesterExpressionParser;
import com.owldsl.ontology.OntologyService;
import com.owldsl.reasoning.ReasoningService;
import com.owldsl.rendering.RenderingException;
import com.owldsl.rendering.TemplateRegistry;
import com.owldsl.util.EnglishPhrases;
import com.owldsl.util.URIUtils;
import org.semanticweb.owlapi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explains the non-asserted subsumptions of a class: its inferred superclasses and inferred
 * subclasses, each with a rendered justification chain.
 */
public class InferenceExplainer {

    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceExplainer.class);

    private final OntologyService ontologyService;
    private final ReasoningService reasoningService;
    private final ExplanationService explanationService;
    private final ProofExtractor proofExtractor;
    private final JustificationTreeRenderer treeRenderer;
    private final TemplateRegistry registry;

    public InferenceExplainer(OntologyService ontologyService,
                              ReasoningService reasoningService,
                              ExplanationService explanationService,
                              ProofExtractor proofExtractor,
                              JustificationTreeRenderer treeRenderer,
                              TemplateRegistry registry) {
        this.ontologyService = ontologyService;
        this.reasoningService = reasoningService;
        this.explanationService = explanationService;
        this.proofExtractor = proofExtractor;
        this.treeRenderer = treeRenderer;
        this.registry = registry;
    }

    public List<InferenceExplanation> explainInferences(AtomicClass atomicClass) {
        OWLOntology ontology = ontologyService.getOntology();
        OWLClass owlClass = owlClass(ontology, atomicClass.getIri());
        List<InferenceExplanation> explanations = new ArrayList<>();

        Set<OWLClass> asserted = assertedSuperClasses(ontology, owlClass);
        for (OWLClass superClass : reasoningService.getSuperClasses(owlClass, false)) {
            if (asserted.contains(superClass) || superClass.equals(owlClass)) {
                continue;
            }
            String label = ontologyService.labelOf(superClass.getIRI().toString());
            if (registry.isIgnoredInference(label)) {
                LOGGER.debug("Skipping ignored inference {} for {}", label, atomicClass);
                continue;
            }
            explanations.add(explain(owlClass, superClass));
        }

        for (OWLClass subClass : reasoningService.getSubClasses(owlClass, false)) {
            if (subClass.equals(owlClass) || explanationService.isAsserted(subClass, owlClass)) {
                continue;
            }
            explanations.add(explain(subClass, owlClass));
        }
        LOGGER.info("Explained {} inferences for {}", explanations.size(), atomicClass);
        return explanations;
    }

    public InferenceExplanation explain(OWLClass subClass, OWLClass superClass) {
        String subIri = subClass.getIRI().toString();
        String superIri = superClass.getIRI().toString();
        String header = "How is every '" + labelOrLocalName(subIri) + "' "
                + EnglishPhrases.withIndefiniteArticle(labelOrLocalName(superIri)) + "?";

        Set<OWLAxiom> justification = explanationService.explainSubsumption(subClass, superClass);
        List<ProofStep> steps = justification.isEmpty()
                ? Collections.emptyList()
                : proofExtractor.extract(subClass, justification);
        return rendered(subIri, superIri, header, steps);
    }

    /**
     * Justify {@code atomicClass ⊑ expression} for a Manchester-syntax class expression such as
     * {@code 'part of' some 'temporal bone'}. A non-entailed inclusion yields an explanation carrying
     * an error.
     *
     * @throws IllegalArgumentException when the expression cannot be parsed
     */
    public InferenceExplanation explainGci(AtomicClass atomicClass, String manchesterExpression) {
        OWLOntology ontology = ontologyService.getOntology();
        OWLClass owlClass = owlClass(ontology, atomicClass.getIri());
        OWLClassExpression superExpression = new ManchesterExpressionParser(ontology).parse(manchesterExpression);

        String subIri = atomicClass.getIri();
        String expression = manchesterExpression.trim();
        String header = "How is every '" + labelOrLocalName(subIri) + "' "
                + EnglishPhrases.withIndefiniteArticle(expression) + "?";

        OWLSubClassOfAxiom axiom = ontology.getOWLOntologyManager().getOWLDataFactory()
                .getOWLSubClassOfAxiom(owlClass, superExpression);
        if (!reasoningService.isEntailed(axiom)) {
            LOGGER.info("Not entailed: {}", axiom);
            return new InferenceExplanation(subIri, expression, header, Collections.emptyList(), "",
                    "Not entailed by the ontology");
        }
        Set<OWLAxiom> justification = explanationService.explainEntailment(axiom);
        List<ProofStep> steps = justification.isEmpty()
                ? Collections.emptyList()
                : proofExtractor.extract(owlClass, justification);
        return rendered(subIri, expression, header, steps);
    }

    private InferenceExplanation rendered(String subIri, String superClass, String header, List<ProofStep> steps) {
        try {
            String proof = treeRenderer.renderProof(steps);
            return new InferenceExplanation(subIri, superClass, header, steps, proof, null);
        } catch (RenderingException e) {
            LOGGER.warn("Could not render justification of {} ⊑ {}: {}", subIri, superClass, e.getMessage());
            return new InferenceExplanation(subIri, superClass, header, steps, "", e.getKind().getDisplayName()
                    + ": " + e.getMessage());
        }
    }

    private String labelOrLocalName(String iri) {
        return Optional.ofNullable(ontologyService.labelOf(iri)).orElse(URIUtils.getLocalName(iri));
    }

    private static Set<OWLClass> assertedSuperClasses(OWLOntology ontology, OWLClass owlClass) {
        return ontology.subClassAxiomsForSubClass(owlClass)
                .map(OWLSubClassOfAxiom::getSuperClass)
                .filter(ce -> !ce.isAnonymous())
                .map(OWLClassExpression::asOWLClass)
                .collect(Collectors.toSet());
    }

    private static OWLClass owlClass(OWLOntology ontology, String iri) {
        return ontology.getOWLOntologyManager().getOWLDataFactory().getOWLClass(IRI.create(iri));
    }
}
