package com.owldsl.ontology;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.Complement;
import com.owldsl.expression.Conjunction;
import com.owldsl.expression.Disjunction;
import com.owldsl.expression.Quantifier;
import com.owldsl.expression.Restriction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.semanticweb.owlapi.model.*;

import static com.owldsl.ontology.TestOntologies.NS;
import static org.junit.jupiter.api.Assertions.*;

class OwlExpressionConverterTest {

    private TestOntologies fixture;
    private OWLDataFactory df;
    private OwlExpressionConverter converter;

    private OWLClass bone;
    private OWLClass cartilage;
    private OWLObjectProperty hasPart;

    @BeforeEach
    void setUp() throws Exception {
        fixture = TestOntologies.create();
        df = fixture.getDataFactory();
        bone = fixture.cls("bone", "bone");
        cartilage = fixture.cls("cartilage", "cartilage");
        hasPart = fixture.property("has_part", "has part");

        DefaultOntologyService service = new DefaultOntologyService();
        service.setOntology(fixture.getOntology());
        converter = service.getConverter();
    }

    @Test
    void testBooleanConstructs() {
        ClassExpression union = converter.convert(df.getOWLObjectUnionOf(bone, cartilage)).orElseThrow();
        assertTrue(union instanceof Disjunction);
        assertEquals(2, ((Disjunction) union).getOperands().size());

        ClassExpression intersection = converter.convert(
                df.getOWLObjectIntersectionOf(bone, df.getOWLObjectSomeValuesFrom(hasPart, cartilage))).orElseThrow();
        assertTrue(intersection instanceof Conjunction);

        ClassExpression complement = converter.convert(df.getOWLObjectComplementOf(bone)).orElseThrow();
        assertEquals(new Complement(new AtomicClass(NS + "bone", "bone")), complement);
    }

    @Test
    void testRestrictions() {
        Restriction some = (Restriction) converter.convert(df.getOWLObjectSomeValuesFrom(hasPart, bone)).orElseThrow();
        assertEquals(Quantifier.EXISTENTIAL, some.getQuantifier());
        assertEquals("has part", some.getProperty().getLabel());

        Restriction only = (Restriction) converter.convert(df.getOWLObjectAllValuesFrom(hasPart, bone)).orElseThrow();
        assertEquals(Quantifier.UNIVERSAL, only.getQuantifier());

        Restriction exactly = (Restriction) converter.convert(
                df.getOWLObjectExactCardinality(2, hasPart, bone)).orElseThrow();
        assertEquals(Quantifier.EXACT_CARDINALITY, exactly.getQuantifier());
        assertEquals(Integer.valueOf(2), exactly.getCardinality());

        Restriction max = (Restriction) converter.convert(df.getOWLObjectMaxCardinality(3, hasPart, bone)).orElseThrow();
        assertEquals(Quantifier.MAX_CARDINALITY, max.getQuantifier());
    }

    @Test
    void testSelfAndValueRestrictions() {
        Restriction self = (Restriction) converter.convert(df.getOWLObjectHasSelf(hasPart)).orElseThrow();
        assertEquals(Quantifier.SELF, self.getQuantifier());

        OWLNamedIndividual left = df.getOWLNamedIndividual(IRI.create(NS + "left"));
        fixture.label(left.getIRI(), "left");
        Restriction value = (Restriction) converter.convert(df.getOWLObjectHasValue(hasPart, left)).orElseThrow();
        assertEquals(Quantifier.EXISTENTIAL, value.getQuantifier());
        assertEquals("left", value.getFiller().asAtomic().getLabel());
    }

    @Test
    void testUnsupportedConstructsAreDropped() {
        OWLDataProperty weight = df.getOWLDataProperty(IRI.create(NS + "weight"));
        assertFalse(converter.convert(df.getOWLDataSomeValuesFrom(weight, df.getIntegerOWLDatatype())).isPresent());
        assertFalse(converter.convert(
                df.getOWLObjectSomeValuesFrom(df.getOWLObjectInverseOf(hasPart), bone)).isPresent());

        OWLNamedIndividual a = df.getOWLNamedIndividual(IRI.create(NS + "a"));
        OWLNamedIndividual b = df.getOWLNamedIndividual(IRI.create(NS + "b"));
        assertFalse(converter.convert(df.getOWLObjectOneOf(a, b)).isPresent());
    }

    @Test
    void testUnsupportedOperandIsLeftOutOfIntersection() {
        OWLDataProperty weight = df.getOWLDataProperty(IRI.create(NS + "weight"));
        ClassExpression converted = converter.convert(df.getOWLObjectIntersectionOf(bone,
                df.getOWLDataSomeValuesFrom(weight, df.getIntegerOWLDatatype()))).orElseThrow();

        assertEquals(new AtomicClass(NS + "bone", "bone"), converted);
    }

    @Test
    void testThing() {
        assertTrue(converter.convert(df.getOWLThing()).orElseThrow().asAtomic().isOwlThing());
    }
}
