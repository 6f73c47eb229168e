package com.owldsl.explanation;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.Conjunction;
import com.owldsl.expression.PropertyRef;
import com.owldsl.ontology.DefaultOntologyService;
import com.owldsl.ontology.TestOntologies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.model.*;

import java.util.List;
import java.util.Set;

import static com.owldsl.ontology.TestOntologies.NS;
import static org.junit.jupiter.api.Assertions.*;

class ProofExtractorTest {

    private TestOntologies fixture;
    private OWLDataFactory df;
    private ProofExtractor extractor;

    private OWLClass alpha;
    private OWLClass beta;
    private OWLClass gamma;
    private OWLObjectProperty partOf;

    @BeforeEach
    void setUp() throws Exception {
        fixture = TestOntologies.create();
        df = fixture.getDataFactory();
        alpha = fixture.cls("alpha", "alpha");
        beta = fixture.cls("beta", "beta");
        gamma = fixture.cls("gamma", "gamma");
        partOf = fixture.property("part_of", "part of");

        DefaultOntologyService service = new DefaultOntologyService();
        service.setOntology(fixture.getOntology());
        extractor = new ProofExtractor(service.getConverter());
    }

    private static AtomicClass atomic(String localName) {
        return new AtomicClass(NS + localName, localName);
    }

    @Test
    void testChainIsOrderedFromSubclass() {
        Set<OWLAxiom> justification = Set.of(
                df.getOWLSubClassOfAxiom(beta, gamma),
                df.getOWLSubClassOfAxiom(alpha, beta));

        List<ProofStep> steps = extractor.extract(alpha, justification);

        assertEquals(List.of(
                ProofStep.subClassOf(atomic("alpha"), atomic("beta"), 0),
                ProofStep.subClassOf(atomic("beta"), atomic("gamma"), 1)), steps);
    }

    @Test
    void testPropertyAxiomsComeFirst() {
        Set<OWLAxiom> justification = Set.of(
                df.getOWLSubClassOfAxiom(alpha, beta),
                df.getOWLTransitiveObjectPropertyAxiom(partOf));

        List<ProofStep> steps = extractor.extract(alpha, justification);

        assertEquals(2, steps.size());
        assertEquals(ProofStepType.TRANSITIVE, steps.get(0).getType());
        assertEquals("part of", steps.get(0).getProperty().getLabel());
        assertEquals(ProofStepType.SUBCLASS, steps.get(1).getType());
        assertEquals(0, steps.get(1).getDepth());
    }

    @Test
    void testEquivalenceFollowsConjuncts() {
        OWLClassExpression definition = df.getOWLObjectIntersectionOf(beta,
                df.getOWLObjectSomeValuesFrom(partOf, gamma));
        Set<OWLAxiom> justification = Set.of(
                df.getOWLEquivalentClassesAxiom(alpha, definition),
                df.getOWLSubClassOfAxiom(beta, gamma));

        List<ProofStep> steps = extractor.extract(alpha, justification);

        assertEquals(2, steps.size());
        ProofStep equivalence = steps.get(0);
        assertEquals(ProofStepType.EQUIVALENCE, equivalence.getType());
        assertEquals(atomic("alpha"), equivalence.getSubject());
        assertTrue(equivalence.getSuperclass() instanceof Conjunction);
        assertEquals(0, equivalence.getDepth());

        assertEquals(ProofStep.subClassOf(atomic("beta"), atomic("gamma"), 1), steps.get(1));
    }

    @Test
    void testUnreachableAxiomsAreAppendedAtDepthZero() {
        OWLClass delta = fixture.cls("delta", "delta");
        Set<OWLAxiom> justification = Set.of(
                df.getOWLSubClassOfAxiom(alpha, beta),
                df.getOWLSubClassOfAxiom(gamma, delta));

        List<ProofStep> steps = extractor.extract(alpha, justification);

        assertEquals(List.of(
                ProofStep.subClassOf(atomic("alpha"), atomic("beta"), 0),
                ProofStep.subClassOf(atomic("gamma"), atomic("delta"), 0)), steps);
    }

    @Test
    void testUnsupportedStepsAreDropped() {
        OWLDataProperty weight = df.getOWLDataProperty(IRI.create(NS + "weight"));
        Set<OWLAxiom> justification = Set.of(
                df.getOWLSubClassOfAxiom(alpha, df.getOWLDataSomeValuesFrom(weight, df.getIntegerOWLDatatype())),
                df.getOWLObjectPropertyDomainAxiom(partOf, gamma));

        List<ProofStep> steps = extractor.extract(alpha, justification);

        assertEquals(List.of(ProofStep.domain(new PropertyRef(NS + "part_of", "part of"),
                atomic("gamma"), 0)), steps);
    }
}
