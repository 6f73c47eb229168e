// com/owldsl/ontology/OwlExpressionConverter.java
package com.owldsl.ontology;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.Complement;
import com.owldsl.expression.Conjunction;
import com.owldsl.expression.Disjunction;
import com.owldsl.expression.PropertyRef;
import com.owldsl.expression.Quantifier;
import com.owldsl.expression.Restriction;
import org.semanticweb.owlapi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts OWL API class expressions into {@link ClassExpression} trees, attaching labels and
 * reflexivity from the ontology. Constructs without a counterpart (data restrictions, inverse
 * properties, enumerations of several individuals) are dropped with a warning.
 */
public class OwlExpressionConverter implements OWLClassExpressionVisitorEx<ClassExpression> {

    private static final Logger LOGGER = LoggerFactory.getLogger(OwlExpressionConverter.class);

    private final OntologyService ontologyService;

    public OwlExpressionConverter(OntologyService ontologyService) {
        this.ontologyService = ontologyService;
    }

    public Optional<ClassExpression> convert(OWLClassExpression expression) {
        return Optional.ofNullable(expression.accept(this));
    }

    public AtomicClass atomic(OWLClass owlClass) {
        String iri = owlClass.getIRI().toString();
        if (owlClass.isOWLThing()) {
            return AtomicClass.thing();
        }
        if (owlClass.isOWLNothing()) {
            return new AtomicClass(iri, "nothing");
        }
        return new AtomicClass(iri, ontologyService.labelOf(iri));
    }

    public Optional<PropertyRef> property(OWLObjectPropertyExpression expression) {
        if (expression.isAnonymous()) {
            LOGGER.warn("Skipping restriction on inverse property {}", expression);
            return Optional.empty();
        }
        return Optional.of(ontologyService.propertyRef(expression.asOWLObjectProperty().getIRI().toString()));
    }

    @Override
    public ClassExpression visit(OWLClass ce) {
        return atomic(ce);
    }

    @Override
    public ClassExpression visit(OWLObjectIntersectionOf ce) {
        List<ClassExpression> operands = operands(ce.getOperandsAsList());
        if (operands.isEmpty()) {
            return null;
        }
        return operands.size() == 1 ? operands.get(0) : new Conjunction(operands);
    }

    @Override
    public ClassExpression visit(OWLObjectUnionOf ce) {
        List<ClassExpression> operands = operands(ce.getOperandsAsList());
        if (operands.isEmpty()) {
            return null;
        }
        return operands.size() == 1 ? operands.get(0) : new Disjunction(operands);
    }

    @Override
    public ClassExpression visit(OWLObjectComplementOf ce) {
        ClassExpression operand = ce.getOperand().accept(this);
        return operand == null ? null : new Complement(operand);
    }

    @Override
    public ClassExpression visit(OWLObjectSomeValuesFrom ce) {
        return restriction(ce.getProperty(), Quantifier.EXISTENTIAL, null, ce.getFiller());
    }

    @Override
    public ClassExpression visit(OWLObjectAllValuesFrom ce) {
        return restriction(ce.getProperty(), Quantifier.UNIVERSAL, null, ce.getFiller());
    }

    @Override
    public ClassExpression visit(OWLObjectHasValue ce) {
        Optional<PropertyRef> property = property(ce.getProperty());
        if (!property.isPresent()) {
            return null;
        }
        return Restriction.some(property.get(), individual(ce.getFiller()));
    }

    @Override
    public ClassExpression visit(OWLObjectMinCardinality ce) {
        return restriction(ce.getProperty(), Quantifier.MIN_CARDINALITY, ce.getCardinality(), ce.getFiller());
    }

    @Override
    public ClassExpression visit(OWLObjectExactCardinality ce) {
        return restriction(ce.getProperty(), Quantifier.EXACT_CARDINALITY, ce.getCardinality(), ce.getFiller());
    }

    @Override
    public ClassExpression visit(OWLObjectMaxCardinality ce) {
        return restriction(ce.getProperty(), Quantifier.MAX_CARDINALITY, ce.getCardinality(), ce.getFiller());
    }

    @Override
    public ClassExpression visit(OWLObjectHasSelf ce) {
        Optional<PropertyRef> property = property(ce.getProperty());
        return property.map(p -> new Restriction(p, Quantifier.SELF, null, AtomicClass.thing())).orElse(null);
    }

    @Override
    public ClassExpression visit(OWLObjectOneOf ce) {
        List<OWLIndividual> individuals = ce.getOperandsAsList();
        if (individuals.size() != 1) {
            LOGGER.warn("Skipping enumeration of {} individuals: {}", individuals.size(), ce);
            return null;
        }
        return individual(individuals.get(0));
    }

    @Override
    public ClassExpression visit(OWLDataSomeValuesFrom ce) {
        return unsupported(ce);
    }

    @Override
    public ClassExpression visit(OWLDataAllValuesFrom ce) {
        return unsupported(ce);
    }

    @Override
    public ClassExpression visit(OWLDataHasValue ce) {
        return unsupported(ce);
    }

    @Override
    public ClassExpression visit(OWLDataMinCardinality ce) {
        return unsupported(ce);
    }

    @Override
    public ClassExpression visit(OWLDataExactCardinality ce) {
        return unsupported(ce);
    }

    @Override
    public ClassExpression visit(OWLDataMaxCardinality ce) {
        return unsupported(ce);
    }

    private ClassExpression restriction(OWLObjectPropertyExpression propertyExpression, Quantifier quantifier,
                                        Integer cardinality, OWLClassExpression fillerExpression) {
        Optional<PropertyRef> property = property(propertyExpression);
        if (!property.isPresent()) {
            return null;
        }
        ClassExpression filler = fillerExpression.accept(this);
        if (filler == null) {
            LOGGER.warn("Skipping restriction on {} with unsupported filler {}", property.get(), fillerExpression);
            return null;
        }
        return new Restriction(property.get(), quantifier, cardinality, filler);
    }

    private AtomicClass individual(OWLIndividual individual) {
        if (individual.isAnonymous()) {
            return new AtomicClass(individual.toStringID(), null);
        }
        String iri = individual.asOWLNamedIndividual().getIRI().toString();
        return new AtomicClass(iri, ontologyService.labelOf(iri));
    }

    private List<ClassExpression> operands(List<OWLClassExpression> owlOperands) {
        List<ClassExpression> operands = new ArrayList<>(owlOperands.size());
        for (OWLClassExpression operand : owlOperands) {
            ClassExpression converted = operand.accept(this);
            if (converted != null) {
                operands.add(converted);
            }
        }
        return operands;
    }

    private ClassExpression unsupported(OWLClassExpression ce) {
        LOGGER.warn("Skipping unsupported class expression {}", ce);
        return null;
    }
}
