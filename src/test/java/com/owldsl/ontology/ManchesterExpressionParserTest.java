package com.owldsl.ontology;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLClassExpression;
import org.semanticweb.owlapi.model.OWLDataFactory;
import org.semanticweb.owlapi.model.OWLObjectIntersectionOf;
import org.semanticweb.owlapi.model.OWLObjectSomeValuesFrom;

import static com.owldsl.ontology.TestOntologies.NS;
import static org.junit.jupiter.api.Assertions.*;

class ManchesterExpressionParserTest {

    private TestOntologies fixture;
    private ManchesterExpressionParser parser;

    @BeforeEach
    void setUp() throws Exception {
        fixture = TestOntologies.vestibularAqueduct();
        parser = new ManchesterExpressionParser(fixture.getOntology());
    }

    @Test
    void testQuotedLabels() {
        OWLClassExpression parsed = parser.parse("'conduit for' some 'vein of vestibular aqueduct'");

        OWLDataFactory df = fixture.getDataFactory();
        assertEquals(df.getOWLObjectSomeValuesFrom(df.getOWLObjectProperty(IRI.create(NS + "conduit_for")),
                df.getOWLClass(IRI.create(NS + "vein_of_vestibular_aqueduct"))), parsed);
    }

    @Test
    void testConjunctionWithUnlabelledClass() {
        OWLClassExpression parsed = parser.parse("unlabelled_class and ('part of' some 'Temporal bone')");

        assertTrue(parsed instanceof OWLObjectIntersectionOf);
        assertTrue(parsed.asConjunctSet().stream().anyMatch(ce -> ce instanceof OWLObjectSomeValuesFrom));
        assertTrue(parsed.asConjunctSet().contains(
                fixture.getDataFactory().getOWLClass(IRI.create(NS + "unlabelled_class"))));
    }

    @Test
    void testUnknownNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("'conduit for' some cochlea"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("'conduit for' some"));
    }

    @Test
    void testUnquote() {
        assertEquals("part of", ManchesterExpressionParser.UnquotingEntityChecker.unquote("'part of'"));
        assertEquals("gamma", ManchesterExpressionParser.UnquotingEntityChecker.unquote("gamma"));
        assertEquals("'", ManchesterExpressionParser.UnquotingEntityChecker.unquote("'"));
    }
}
