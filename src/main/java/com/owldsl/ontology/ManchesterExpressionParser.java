// com/owldsl/ontology/ManchesterExpressionParser.java
package com.owldsl.ontology;

import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.expression.OWLEntityChecker;
import org.semanticweb.owlapi.expression.ShortFormEntityChecker;
import org.semanticweb.owlapi.io.OWLParserException;
import org.semanticweb.owlapi.model.*;
import org.semanticweb.owlapi.util.AnnotationValueShortFormProvider;
import org.semanticweb.owlapi.util.BidirectionalShortFormProvider;
import org.semanticweb.owlapi.util.BidirectionalShortFormProviderAdapter;
import org.semanticweb.owlapi.util.OWLOntologyImportsClosureSetProvider;
import org.semanticweb.owlapi.util.mansyntax.ManchesterOWLSyntaxParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses Manchester-syntax class expressions against an ontology. Entities are named by their
 * rdfs:label, or by their IRI fragment when they have none; labels with spaces are quoted
 * ({@code 'part of' some 'temporal bone'}).
 */
public class ManchesterExpressionParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManchesterExpressionParser.class);

    private final OWLOntology ontology;
    private final OWLEntityChecker entityChecker;

    public ManchesterExpressionParser(OWLOntology ontology) {
        this.ontology = ontology;
        OWLOntologyManager manager = ontology.getOWLOntologyManager();
        OWLDataFactory dataFactory = manager.getOWLDataFactory();
        Set<OWLOntology> importsClosure = ontology.importsClosure().collect(Collectors.toSet());

        AnnotationValueShortFormProvider labels = new AnnotationValueShortFormProvider(
                List.of(dataFactory.getRDFSLabel()),
                Collections.emptyMap(),
                new OWLOntologyImportsClosureSetProvider(manager, ontology));
        BidirectionalShortFormProvider shortForms =
                new BidirectionalShortFormProviderAdapter(manager, importsClosure, labels);
        this.entityChecker = new UnquotingEntityChecker(new ShortFormEntityChecker(shortForms));
    }

    /**
     * @throws IllegalArgumentException when the text is malformed or names an unknown entity
     */
    public OWLClassExpression parse(String expression) {
        ManchesterOWLSyntaxParser parser = OWLManager.createManchesterParser();
        parser.setStringToParse(expression);
        parser.setDefaultOntology(ontology);
        parser.setOWLEntityChecker(entityChecker);
        try {
            OWLClassExpression parsed = parser.parseClassExpression();
            LOGGER.debug("Parsed '{}' as {}", expression, parsed);
            return parsed;
        } catch (OWLParserException e) {
            throw new IllegalArgumentException("Could not parse class expression '" + expression + "': "
                    + e.getMessage(), e);
        }
    }

    /**
     * Looks a name up as written and then without its surrounding single quotes
     */
    static final class UnquotingEntityChecker implements OWLEntityChecker {

        private final OWLEntityChecker delegate;

        UnquotingEntityChecker(OWLEntityChecker delegate) {
            this.delegate = delegate;
        }

        static String unquote(String name) {
            if (name.length() >= 2 && name.startsWith("'") && name.endsWith("'")) {
                return name.substring(1, name.length() - 1);
            }
            return name;
        }

        @Override
        public OWLClass getOWLClass(String name) {
            OWLClass found = delegate.getOWLClass(name);
            return found != null ? found : delegate.getOWLClass(unquote(name));
        }

        @Override
        public OWLObjectProperty getOWLObjectProperty(String name) {
            OWLObjectProperty found = delegate.getOWLObjectProperty(name);
            return found != null ? found : delegate.getOWLObjectProperty(unquote(name));
        }

        @Override
        public OWLDataProperty getOWLDataProperty(String name) {
            OWLDataProperty found = delegate.getOWLDataProperty(name);
            return found != null ? found : delegate.getOWLDataProperty(unquote(name));
        }

        @Override
        public OWLNamedIndividual getOWLIndividual(String name) {
            OWLNamedIndividual found = delegate.getOWLIndividual(name);
            return found != null ? found : delegate.getOWLIndividual(unquote(name));
        }

        @Override
        public OWLDatatype getOWLDatatype(String name) {
            OWLDatatype found = delegate.getOWLDatatype(name);
            return found != null ? found : delegate.getOWLDatatype(unquote(name));
        }

        @Override
        public OWLAnnotationProperty getOWLAnnotationProperty(String name) {
            OWLAnnotationProperty found = delegate.getOWLAnnotationProperty(name);
            return found != null ? found : delegate.getOWLAnnotationProperty(unquote(name));
        }
    }
}
