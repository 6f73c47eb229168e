// com/owldsl/ontology/OntologyService.java
package com.owldsl.ontology;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.PropertyRef;
import org.semanticweb.owlapi.model.OWLOntology;

import java.io.File;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the ontology being rendered. All lookups work on the current ontology,
 * set by {@link #loadOntology(File)} or {@link #setOntology(OWLOntology)}.
 */
public interface OntologyService extends AutoCloseable {

    /**
     * Load a single ontology from file and make it current
     */
    OWLOntology loadOntology(File ontologyFile);

    void setOntology(OWLOntology ontology);

    OWLOntology getOntology();

    /**
     * rdfs:label of an entity, or null when it has none
     */
    String labelOf(String entityIri);

    List<ClassExpression> superClassExpressionsOf(String classIri);

    List<ClassExpression> equivalentClassExpressionsOf(String classIri);

    boolean isReflexive(String propertyIri);

    Optional<String> expertDefinitionValue(String entityIri, String propertyIri);

    /**
     * Title of the ontology (dc:title, falling back to rdfs:label)
     */
    Optional<String> ontologyLabel();

    PropertyRef propertyRef(String propertyIri);

    /**
     * Resolve a class by IRI or, failing that, by exact label
     */
    Optional<AtomicClass> findClass(String iriOrLabel);

    /**
     * Named classes other than owl:Thing and owl:Nothing, ordered by IRI
     */
    List<AtomicClass> listClasses();

    /**
     * Classes whose label contains the query (case-insensitive) or matches it as a regular expression
     */
    List<AtomicClass> findClasses(String query, boolean regex);

    /**
     * Object properties whose IRI starts with the prefix and whose label matches the pattern;
     * null arguments match everything
     */
    List<PropertyRef> listObjectProperties(String iriPrefix, String labelPattern);

    /**
     * Labelled classes with a stated superclass restriction on the property, at most {@code limit} of them,
     * in IRI order
     */
    List<AtomicClass> classesUsingProperty(String propertyIri, int limit);

    List<String> domainLabels(String propertyIri);

    List<String> rangeLabels(String propertyIri);

    OntologyStats getStats();
}
