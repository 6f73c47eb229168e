// com/owldsl/ontology/DefaultOntologyService.java
package com.owldsl.ontology;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.PropertyRef;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.*;
import org.semanticweb.owlapi.vocab.OWLRDFVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * OWL API backed ontology service. Label lookups are cached per loaded ontology.
 */
public class DefaultOntologyService implements OntologyService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultOntologyService.class);

    static final String DC_TITLE = "http://purl.org/dc/elements/1.1/title";
    static final String DCTERMS_TITLE = "http://purl.org/dc/terms/title";

    private final OwlExpressionConverter converter = new OwlExpressionConverter(this);
    private final Map<String, Optional<String>> labelCache = new ConcurrentHashMap<>();

    private OWLOntology ontology;

    public DefaultOntologyService() {
        LOGGER.info("DefaultOntologyService initialized");
    }

    @Override
    public OWLOntology loadOntology(File ontologyFile) {
        // fresh manager per file so reloading the same ontology IRI does not clash
        OWLOntologyManager manager = OWLManager.createOWLOntologyManager();

        try {
            LOGGER.info("Loading ontology from file: {}", ontologyFile.getAbsolutePath());

            OWLOntology loaded = manager.loadOntologyFromOntologyDocument(ontologyFile);

            LOGGER.info("Loaded ontology: {} with {} axioms",
                    loaded.getOntologyID().getOntologyIRI().orElse(null),
                    loaded.getAxiomCount());

            setOntology(loaded);
            return loaded;

        } catch (OWLOntologyCreationException e) {
            LOGGER.error("Failed to load ontology from file: {}", ontologyFile.getAbsolutePath(), e);
            throw new RuntimeException("Failed to load ontology: " + e.getMessage(), e);
        }
    }

    @Override
    public void setOntology(OWLOntology ontology) {
        this.ontology = ontology;
        labelCache.clear();
    }

    @Override
    public OWLOntology getOntology() {
        if (ontology == null) {
            throw new IllegalStateException("No ontology loaded. Call loadOntology() first.");
        }
        return ontology;
    }

    public OwlExpressionConverter getConverter() {
        return converter;
    }

    @Override
    public String labelOf(String entityIri) {
        return labelCache.computeIfAbsent(entityIri, iri -> literalValues(IRI.create(iri),
                OWLRDFVocabulary.RDFS_LABEL.getIRI().toString()).findFirst()).orElse(null);
    }

    @Override
    public List<ClassExpression> superClassExpressionsOf(String classIri) {
        OWLClass owlClass = owlClass(classIri);
        List<OWLClassExpression> superClasses = getOntology().subClassAxiomsForSubClass(owlClass)
                .map(OWLSubClassOfAxiom::getSuperClass)
                .filter(ce -> !ce.isOWLThing())
                .sorted()
                .collect(Collectors.toList());
        return convertAll(superClasses);
    }

    @Override
    public List<ClassExpression> equivalentClassExpressionsOf(String classIri) {
        OWLClass owlClass = owlClass(classIri);
        List<OWLClassExpression> equivalents = getOntology().equivalentClassesAxioms(owlClass)
                .flatMap(OWLEquivalentClassesAxiom::classExpressions)
                .filter(ce -> !ce.equals(owlClass))
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        return convertAll(equivalents);
    }

    @Override
    public boolean isReflexive(String propertyIri) {
        IRI iri = IRI.create(propertyIri);
        return getOntology().axioms(AxiomType.REFLEXIVE_OBJECT_PROPERTY)
                .anyMatch(ax -> !ax.getProperty().isAnonymous()
                        && ax.getProperty().asOWLObjectProperty().getIRI().equals(iri));
    }

    @Override
    public Optional<String> expertDefinitionValue(String entityIri, String propertyIri) {
        return literalValues(IRI.create(entityIri), propertyIri).findFirst();
    }

    @Override
    public Optional<String> ontologyLabel() {
        List<OWLAnnotation> annotations = getOntology().annotations().sorted().collect(Collectors.toList());
        for (String property : List.of(DC_TITLE, DCTERMS_TITLE, OWLRDFVocabulary.RDFS_LABEL.getIRI().toString())) {
            Optional<String> title = annotations.stream()
                    .filter(a -> a.getProperty().getIRI().toString().equals(property))
                    .map(OWLAnnotation::getValue)
                    .map(OWLAnnotationValue::asLiteral)
                    .flatMap(literal -> literal.map(Stream::of).orElseGet(Stream::empty))
                    .map(OWLLiteral::getLiteral)
                    .findFirst();
            if (title.isPresent()) {
                return title;
            }
        }
        return Optional.empty();
    }

    @Override
    public PropertyRef propertyRef(String propertyIri) {
        return new PropertyRef(propertyIri, labelOf(propertyIri), isReflexive(propertyIri));
    }

    @Override
    public Optional<AtomicClass> findClass(String iriOrLabel) {
        IRI iri = IRI.create(iriOrLabel);
        if (getOntology().containsClassInSignature(iri)) {
            return Optional.of(converter.atomic(owlClass(iriOrLabel)));
        }
        return listClasses().stream()
                .filter(c -> iriOrLabel.equals(c.getLabel()))
                .findFirst();
    }

    @Override
    public List<AtomicClass> listClasses() {
        return getOntology().classesInSignature()
                .filter(c -> !c.isOWLThing() && !c.isOWLNothing())
                .sorted()
                .map(converter::atomic)
                .collect(Collectors.toList());
    }

    @Override
    public List<AtomicClass> findClasses(String query, boolean regex) {
        java.util.function.Predicate<String> matcher;
        if (regex) {
            Pattern pattern = Pattern.compile(query);
            matcher = label -> pattern.matcher(label).find();
        } else {
            String needle = query.toLowerCase(Locale.ROOT);
            matcher = label -> label.toLowerCase(Locale.ROOT).contains(needle);
        }
        return listClasses().stream()
                .filter(AtomicClass::hasLabel)
                .filter(c -> matcher.test(c.getLabel()))
                .sorted(Comparator.comparing(AtomicClass::getLabel))
                .collect(Collectors.toList());
    }

    @Override
    public List<PropertyRef> listObjectProperties(String iriPrefix, String labelPattern) {
        Pattern pattern = labelPattern != null ? Pattern.compile(labelPattern) : null;
        return getOntology().objectPropertiesInSignature()
                .sorted()
                .map(p -> propertyRef(p.getIRI().toString()))
                .filter(p -> iriPrefix == null || p.getIri().startsWith(iriPrefix))
                .filter(p -> pattern == null || (p.hasLabel() && pattern.matcher(p.getLabel()).find()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AtomicClass> classesUsingProperty(String propertyIri, int limit) {
        OWLObjectProperty property = objectProperty(propertyIri);
        return getOntology().classesInSignature()
                .sorted()
                .filter(c -> getOntology().subClassAxiomsForSubClass(c)
                        .flatMap(ax -> ax.getSuperClass().asConjunctSet().stream())
                        .anyMatch(ce -> restricts(ce, property)))
                .map(converter::atomic)
                .filter(AtomicClass::hasLabel)
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    private static boolean restricts(OWLClassExpression expression, OWLObjectProperty property) {
        return expression instanceof OWLRestriction
                && property.equals(((OWLRestriction) expression).getProperty());
    }

    @Override
    public List<String> domainLabels(String propertyIri) {
        OWLObjectProperty property = objectProperty(propertyIri);
        return classLabels(getOntology().objectPropertyDomainAxioms(property)
                .map(OWLObjectPropertyDomainAxiom::getDomain));
    }

    @Override
    public List<String> rangeLabels(String propertyIri) {
        OWLObjectProperty property = objectProperty(propertyIri);
        return classLabels(getOntology().objectPropertyRangeAxioms(property)
                .map(OWLObjectPropertyRangeAxiom::getRange));
    }

    @Override
    public OntologyStats getStats() {
        List<AtomicClass> classes = listClasses();
        int labelled = (int) classes.stream().filter(AtomicClass::hasLabel).count();
        int objectProperties = (int) getOntology().objectPropertiesInSignature().count();
        return new OntologyStats(classes.size(), labelled, objectProperties, getOntology().getAxiomCount());
    }

    private List<String> classLabels(Stream<OWLClassExpression> expressions) {
        return expressions
                .filter(ce -> !ce.isAnonymous())
                .map(ce -> ce.asOWLClass().getIRI().toString())
                .map(iri -> Optional.ofNullable(labelOf(iri)).orElse(iri))
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Literal values of an annotation property on a subject; untagged and English literals first
     */
    private Stream<String> literalValues(IRI subject, String propertyIri) {
        if (ontology == null) {
            return Stream.empty();
        }
        return ontology.annotationAssertionAxioms(subject)
                .filter(ax -> ax.getProperty().getIRI().toString().equals(propertyIri))
                .map(OWLAnnotationAssertionAxiom::getValue)
                .map(OWLAnnotationValue::asLiteral)
                .flatMap(literal -> literal.map(Stream::of).orElseGet(Stream::empty))
                .sorted(Comparator.comparing((OWLLiteral l) -> languageRank(l.getLang()))
                        .thenComparing(OWLLiteral::getLiteral))
                .map(OWLLiteral::getLiteral);
    }

    private static int languageRank(String lang) {
        if (lang == null || lang.isEmpty()) {
            return 0;
        }
        return lang.toLowerCase(Locale.ROOT).startsWith("en") ? 1 : 2;
    }

    private List<ClassExpression> convertAll(List<OWLClassExpression> expressions) {
        List<ClassExpression> converted = new ArrayList<>(expressions.size());
        for (OWLClassExpression expression : expressions) {
            converter.convert(expression).ifPresent(converted::add);
        }
        return converted;
    }

    private OWLClass owlClass(String iri) {
        return getOntology().getOWLOntologyManager().getOWLDataFactory().getOWLClass(IRI.create(iri));
    }

    private OWLObjectProperty objectProperty(String iri) {
        return getOntology().getOWLOntologyManager().getOWLDataFactory().getOWLObjectProperty(IRI.create(iri));
    }

    @Override
    public void close() {
        labelCache.clear();
        ontology = null;
        LOGGER.info("Ontology service closed successfully");
    }
}
