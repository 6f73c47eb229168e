package com.owldsl.explanation;

import com.owldsl.config.CnlConfiguration;
import com.owldsl.expression.AtomicClass;
import com.owldsl.ontology.DefaultOntologyService;
import com.owldsl.ontology.TestOntologies;
import com.owldsl.reasoning.PelletReasoningService;
import com.owldsl.rendering.ExpressionRenderer;
import com.owldsl.rendering.TemplateRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.model.OWLClass;
import org.semanticweb.owlapi.model.OWLObjectProperty;

import java.util.List;

import static com.owldsl.ontology.TestOntologies.NS;
import static org.junit.jupiter.api.Assertions.*;

class InferenceExplainerTest {

    private PelletReasoningService reasoningService;
    private InferenceExplainer explainer;

    @BeforeEach
    void setUp() throws Exception {
        TestOntologies fixture = TestOntologies.create();
        OWLClass alpha = fixture.cls("alpha", "alpha");
        OWLClass beta = fixture.cls("beta", "beta");
        OWLClass gamma = fixture.cls("gamma", "gamma");
        OWLClass structure = fixture.cls("anatomical_structure", "anatomical structure");
        fixture.subClassOf(alpha, beta);
        fixture.subClassOf(beta, gamma);
        fixture.subClassOf(gamma, structure);

        DefaultOntologyService ontologyService = new DefaultOntologyService();
        ontologyService.setOntology(fixture.getOntology());

        reasoningService = new PelletReasoningService();
        reasoningService.initializeReasoner(fixture.getOntology());
        PelletExplanationService explanationService = new PelletExplanationService();
        explanationService.initializeExplanations(reasoningService.getReasoner());

        TemplateRegistry registry = new TemplateRegistry(CnlConfiguration.builder()
                .ignoreInference("anatomical structure")
                .build());
        explainer = new InferenceExplainer(ontologyService, reasoningService, explanationService,
                new ProofExtractor(ontologyService.getConverter()),
                new JustificationTreeRenderer(new ExpressionRenderer(registry)), registry);
    }

    @AfterEach
    void tearDown() {
        reasoningService.close();
    }

    @Test
    void testInferredSuperclassIsExplained() {
        List<InferenceExplanation> explanations = explainer.explainInferences(new AtomicClass(NS + "alpha", "alpha"));

        assertEquals(1, explanations.size());
        InferenceExplanation explanation = explanations.get(0);
        assertEquals(NS + "gamma", explanation.getSuperClassIri());
        assertEquals("How is every 'alpha' a gamma?", explanation.getHeader());
        assertFalse(explanation.hasError());
        assertEquals("Every alpha is a beta.\n  Every beta is a gamma.", explanation.getProof());
        assertEquals(2, explanation.getSteps().size());
    }

    @Test
    void testInferredSubclassIsExplained() {
        List<InferenceExplanation> explanations = explainer.explainInferences(new AtomicClass(NS + "gamma", "gamma"));

        assertEquals(1, explanations.size());
        assertEquals(NS + "alpha", explanations.get(0).getSubClassIri());
        assertEquals(NS + "gamma", explanations.get(0).getSuperClassIri());
        assertTrue(explanations.get(0).isInformative());
    }

    @Nested
    class GeneralClassInclusions {

        private PelletReasoningService gciReasoning;
        private InferenceExplainer gciExplainer;

        @BeforeEach
        void setUp() throws Exception {
            TestOntologies fixture = TestOntologies.create();
            OWLClass alpha = fixture.cls("alpha", "alpha");
            OWLClass beta = fixture.cls("beta", "beta");
            OWLClass gamma = fixture.cls("gamma", "gamma");
            fixture.cls("delta", "delta");
            OWLObjectProperty partOf = fixture.property("part_of", "part of");
            fixture.subClassOf(alpha, beta);
            fixture.subClassOf(beta, fixture.getDataFactory().getOWLObjectSomeValuesFrom(partOf, gamma));

            DefaultOntologyService ontologyService = new DefaultOntologyService();
            ontologyService.setOntology(fixture.getOntology());

            gciReasoning = new PelletReasoningService();
            gciReasoning.initializeReasoner(fixture.getOntology());
            PelletExplanationService explanationService = new PelletExplanationService();
            explanationService.initializeExplanations(gciReasoning.getReasoner());

            TemplateRegistry registry = new TemplateRegistry(CnlConfiguration.builder().build());
            gciExplainer = new InferenceExplainer(ontologyService, gciReasoning, explanationService,
                    new ProofExtractor(ontologyService.getConverter()),
                    new JustificationTreeRenderer(new ExpressionRenderer(registry)), registry);
        }

        @AfterEach
        void tearDown() {
            gciReasoning.close();
        }

        @Test
        void testEntailedExpressionIsJustified() {
            InferenceExplanation explanation = gciExplainer.explainGci(new AtomicClass(NS + "alpha", "alpha"),
                    "'part of' some gamma");

            assertFalse(explanation.hasError());
            assertTrue(explanation.getHeader().startsWith("How is every 'alpha' "));
            assertTrue(explanation.getHeader().endsWith("'part of' some gamma?"));
            assertEquals("'part of' some gamma", explanation.getSuperClassIri());
            assertEquals(2, explanation.getSteps().size());
            assertTrue(explanation.getProof().startsWith("Every alpha is a beta.\n  Every beta "));
        }

        @Test
        void testExpressionThatIsNotEntailed() {
            InferenceExplanation explanation = gciExplainer.explainGci(new AtomicClass(NS + "alpha", "alpha"),
                    "'part of' some delta");

            assertTrue(explanation.hasError());
            assertEquals("Not entailed by the ontology", explanation.getError());
            assertTrue(explanation.getSteps().isEmpty());
        }

        @Test
        void testUnknownNameIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> gciExplainer.explainGci(
                    new AtomicClass(NS + "alpha", "alpha"), "'part of' some epsilon"));
        }
    }
}
