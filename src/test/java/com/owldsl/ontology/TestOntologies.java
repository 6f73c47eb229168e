package com.owldsl.ontology;

import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;

/**
 * Small in-memory ontologies shared by the ontology, processing and explanation tests
 */
public final class TestOntologies {

    public static final String NS = "http://example.org/fma#";
    public static final String DEFINITION = "http://purl.obolibrary.org/obo/IAO_0000115";
    public static final String DC_TITLE = "http://purl.org/dc/elements/1.1/title";

    private final OWLOntologyManager manager;
    private final OWLDataFactory df;
    private final OWLOntology ontology;

    private TestOntologies(String ontologyIri) throws OWLOntologyCreationException {
        this.manager = OWLManager.createOWLOntologyManager();
        this.df = manager.getOWLDataFactory();
        this.ontology = manager.createOntology(IRI.create(ontologyIri));
    }

    public static TestOntologies create() throws OWLOntologyCreationException {
        return new TestOntologies("http://example.org/fma");
    }

    /**
     * Vestibular aqueduct: a foramen of skull that is a conduit for a vein of vestibular aqueduct
     */
    public static TestOntologies vestibularAqueduct() throws OWLOntologyCreationException {
        TestOntologies t = create();
        t.title("FMA");
        OWLClass aqueduct = t.cls("vestibular_aqueduct", "vestibular aqueduct");
        OWLClass foramen = t.cls("foramen_of_skull", "foramen of skull");
        OWLClass vein = t.cls("vein_of_vestibular_aqueduct", "vein of vestibular aqueduct");
        OWLObjectProperty conduitFor = t.property("conduit_for", "conduit for");
        OWLObjectProperty partOf = t.property("part_of", "part of");
        OWLClass temporalBone = t.cls("temporal_bone", "Temporal bone");
        t.cls("unlabelled_class", null);

        t.subClassOf(aqueduct, foramen);
        t.subClassOf(aqueduct, t.df.getOWLObjectSomeValuesFrom(conduitFor, vein));
        t.subClassOf(foramen, t.df.getOWLObjectSomeValuesFrom(partOf, temporalBone));
        t.add(t.df.getOWLReflexiveObjectPropertyAxiom(partOf));
        t.add(t.df.getOWLObjectPropertyDomainAxiom(conduitFor, foramen));
        t.add(t.df.getOWLObjectPropertyRangeAxiom(conduitFor, vein));
        t.annotate(aqueduct.getIRI(), DEFINITION, "Canal in the petrous part of the temporal bone");
        return t;
    }

    public OWLOntology getOntology() { return ontology; }
    public OWLOntologyManager getManager() { return manager; }
    public OWLDataFactory getDataFactory() { return df; }

    public OWLClass cls(String localName, String label) {
        OWLClass owlClass = df.getOWLClass(IRI.create(NS + localName));
        add(df.getOWLDeclarationAxiom(owlClass));
        if (label != null) {
            label(owlClass.getIRI(), label);
        }
        return owlClass;
    }

    public OWLObjectProperty property(String localName, String label) {
        OWLObjectProperty property = df.getOWLObjectProperty(IRI.create(NS + localName));
        add(df.getOWLDeclarationAxiom(property));
        if (label != null) {
            label(property.getIRI(), label);
        }
        return property;
    }

    public void label(IRI subject, String label) {
        add(df.getOWLAnnotationAssertionAxiom(df.getRDFSLabel(), subject, df.getOWLLiteral(label)));
    }

    public void annotate(IRI subject, String propertyIri, String value) {
        add(df.getOWLAnnotationAssertionAxiom(df.getOWLAnnotationProperty(IRI.create(propertyIri)), subject,
                df.getOWLLiteral(value)));
    }

    public void title(String title) {
        manager.applyChange(new AddOntologyAnnotation(ontology,
                df.getOWLAnnotation(df.getOWLAnnotationProperty(IRI.create(DC_TITLE)), df.getOWLLiteral(title))));
    }

    public OWLSubClassOfAxiom subClassOf(OWLClassExpression sub, OWLClassExpression sup) {
        OWLSubClassOfAxiom axiom = df.getOWLSubClassOfAxiom(sub, sup);
        add(axiom);
        return axiom;
    }

    public OWLEquivalentClassesAxiom equivalent(OWLClassExpression first, OWLClassExpression second) {
        OWLEquivalentClassesAxiom axiom = df.getOWLEquivalentClassesAxiom(first, second);
        add(axiom);
        return axiom;
    }

    public void add(OWLAxiom axiom) {
        manager.addAxiom(ontology, axiom);
    }
}
