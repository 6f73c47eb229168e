package com.owldsl.ontology;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.PropertyRef;
import com.owldsl.expression.Restriction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.semanticweb.owlapi.formats.FunctionalSyntaxDocumentFormat;
import org.semanticweb.owlapi.model.OWLOntology;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.owldsl.ontology.TestOntologies.NS;
import static org.junit.jupiter.api.Assertions.*;

class DefaultOntologyServiceTest {

    private TestOntologies fixture;
    private DefaultOntologyService service;

    @BeforeEach
    void setUp() throws Exception {
        fixture = TestOntologies.vestibularAqueduct();
        service = new DefaultOntologyService();
        service.setOntology(fixture.getOntology());
    }

    @Test
    void testLabels() {
        assertEquals("vestibular aqueduct", service.labelOf(NS + "vestibular_aqueduct"));
        assertNull(service.labelOf(NS + "unlabelled_class"));
    }

    @Test
    void testSuperClassExpressions() {
        List<ClassExpression> superClasses = service.superClassExpressionsOf(NS + "vestibular_aqueduct");

        assertEquals(2, superClasses.size());
        assertEquals(new AtomicClass(NS + "foramen_of_skull", "foramen of skull"), superClasses.get(0));
        Restriction restriction = (Restriction) superClasses.get(1);
        assertEquals("conduit for", restriction.getProperty().getLabel());
        assertEquals("vein of vestibular aqueduct", restriction.getFiller().asAtomic().getLabel());
        assertTrue(service.equivalentClassExpressionsOf(NS + "vestibular_aqueduct").isEmpty());
    }

    @Test
    void testEquivalentClassExpressions() {
        fixture.equivalent(fixture.cls("skull_foramen", "skull foramen"), fixture.cls("foramen_of_skull", "foramen of skull"));
        service.setOntology(fixture.getOntology());

        List<ClassExpression> equivalents = service.equivalentClassExpressionsOf(NS + "skull_foramen");
        assertEquals(List.of(new AtomicClass(NS + "foramen_of_skull", "foramen of skull")), equivalents);
    }

    @Test
    void testPropertyLookups() {
        assertTrue(service.isReflexive(NS + "part_of"));
        assertFalse(service.isReflexive(NS + "conduit_for"));

        PropertyRef partOf = service.propertyRef(NS + "part_of");
        assertEquals("part of", partOf.getLabel());
        assertTrue(partOf.isReflexive());

        assertEquals(List.of("foramen of skull"), service.domainLabels(NS + "conduit_for"));
        assertEquals(List.of("vein of vestibular aqueduct"), service.rangeLabels(NS + "conduit_for"));
    }

    @Test
    void testExpertDefinitionAndTitle() {
        assertEquals(Optional.of("Canal in the petrous part of the temporal bone"),
                service.expertDefinitionValue(NS + "vestibular_aqueduct", TestOntologies.DEFINITION));
        assertFalse(service.expertDefinitionValue(NS + "foramen_of_skull", TestOntologies.DEFINITION).isPresent());
        assertEquals(Optional.of("FMA"), service.ontologyLabel());
    }

    @Test
    void testFindClasses() {
        assertEquals(NS + "vestibular_aqueduct", service.findClass("vestibular aqueduct").orElseThrow().getIri());
        assertEquals("foramen of skull", service.findClass(NS + "foramen_of_skull").orElseThrow().getLabel());
        assertFalse(service.findClass("cochlea").isPresent());

        List<String> substring = service.findClasses("VEIN", false).stream()
                .map(AtomicClass::getLabel)
                .collect(Collectors.toList());
        assertEquals(List.of("vein of vestibular aqueduct"), substring);

        List<String> regex = service.findClasses("^(foramen|Temporal)", true).stream()
                .map(AtomicClass::getLabel)
                .collect(Collectors.toList());
        assertEquals(List.of("Temporal bone", "foramen of skull"), regex);
    }

    @Test
    void testListObjectProperties() {
        assertEquals(2, service.listObjectProperties(null, null).size());
        assertEquals(List.of(NS + "part_of"), service.listObjectProperties(NS + "part", null).stream()
                .map(PropertyRef::getIri).collect(Collectors.toList()));
        assertEquals(List.of(NS + "conduit_for"), service.listObjectProperties(null, "conduit").stream()
                .map(PropertyRef::getIri).collect(Collectors.toList()));
    }

    @Test
    void testClassesUsingProperty() {
        assertEquals(List.of(new AtomicClass(NS + "vestibular_aqueduct", "vestibular aqueduct")),
                service.classesUsingProperty(NS + "conduit_for", 5));
        assertEquals(List.of("foramen of skull"), service.classesUsingProperty(NS + "part_of", 5).stream()
                .map(AtomicClass::getLabel).collect(Collectors.toList()));
        assertTrue(service.classesUsingProperty(NS + "conduit_for", 0).isEmpty());
    }

    @Test
    void testClassesUsingPropertyRespectsLimit() {
        fixture.subClassOf(fixture.cls("cochlear_aqueduct", "cochlear aqueduct"),
                fixture.getDataFactory().getOWLObjectSomeValuesFrom(fixture.property("conduit_for", "conduit for"),
                        fixture.cls("perilymphatic_duct", "perilymphatic duct")));
        service.setOntology(fixture.getOntology());

        assertEquals(2, service.classesUsingProperty(NS + "conduit_for", 5).size());
        assertEquals(1, service.classesUsingProperty(NS + "conduit_for", 1).size());
    }

    @Test
    void testStats() {
        OntologyStats stats = service.getStats();

        assertEquals(5, stats.getClassCount());
        assertEquals(4, stats.getLabelledClassCount());
        assertEquals(2, stats.getObjectPropertyCount());
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("fma.ofn");
        try (OutputStream out = Files.newOutputStream(file)) {
            fixture.getManager().saveOntology(fixture.getOntology(), new FunctionalSyntaxDocumentFormat(), out);
        }

        DefaultOntologyService loaded = new DefaultOntologyService();
        OWLOntology ontology = loaded.loadOntology(file.toFile());
        assertEquals(fixture.getOntology().getAxiomCount(), ontology.getAxiomCount());
        assertEquals("vestibular aqueduct", loaded.labelOf(NS + "vestibular_aqueduct"));
    }

    @Test
    void testLoadFailureAndMissingOntology(@TempDir Path dir) {
        DefaultOntologyService empty = new DefaultOntologyService();

        assertThrows(IllegalStateException.class, empty::getOntology);
        assertThrows(RuntimeException.class, () -> empty.loadOntology(dir.resolve("missing.owl").toFile()));
    }

    @Test
    void testClose() {
        service.close();

        assertThrows(IllegalStateException.class, service::listClasses);
    }
}
