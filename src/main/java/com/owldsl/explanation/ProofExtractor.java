// com/owldsl/explanation/ProofExtractor.java
package com.owldsl.explanation;

import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.PropertyRef;
import com.owldsl.ontology.OwlExpressionConverter;
import org.semanticweb.owlapi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders the axioms of a justification into a chain of proof steps.
 *
 * <p>Property axioms come first, at depth 0. Class axioms are then followed breadth-first from the
 * explained subclass: each step's superclass (and its conjuncts) becomes the frontier one level deeper.
 * Class axioms that cannot be reached this way are appended at depth 0.</p>
 */
public class ProofExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProofExtractor.class);

    private final OwlExpressionConverter converter;

    public ProofExtractor(OwlExpressionConverter converter) {
        this.converter = converter;
    }

    public List<ProofStep> extract(OWLClassExpression subClass, Set<OWLAxiom> justification) {
        List<OWLAxiom> remaining = justification.stream().sorted().collect(Collectors.toList());
        List<ProofStep> steps = new ArrayList<>();

        for (Iterator<OWLAxiom> it = remaining.iterator(); it.hasNext(); ) {
            OWLAxiom axiom = it.next();
            if (isPropertyAxiom(axiom)) {
                propertyStep(axiom).ifPresent(steps::add);
                it.remove();
            }
        }

        Deque<Frontier> queue = new ArrayDeque<>();
        Set<OWLClassExpression> visited = new HashSet<>();
        queue.add(new Frontier(subClass, 0));
        while (!queue.isEmpty()) {
            Frontier frontier = queue.poll();
            if (!visited.add(frontier.expression)) {
                continue;
            }
            for (Iterator<OWLAxiom> it = remaining.iterator(); it.hasNext(); ) {
                OWLAxiom axiom = it.next();
                if (axiom instanceof OWLSubClassOfAxiom) {
                    OWLSubClassOfAxiom subClassAxiom = (OWLSubClassOfAxiom) axiom;
                    if (subClassAxiom.getSubClass().equals(frontier.expression)) {
                        classStep(frontier.expression, subClassAxiom.getSuperClass(), false, frontier.depth)
                                .ifPresent(steps::add);
                        enqueue(queue, subClassAxiom.getSuperClass(), frontier.depth + 1);
                        it.remove();
                    }
                } else if (axiom instanceof OWLEquivalentClassesAxiom) {
                    OWLEquivalentClassesAxiom equivalence = (OWLEquivalentClassesAxiom) axiom;
                    if (equivalence.contains(frontier.expression)) {
                        for (OWLClassExpression other : otherSides(equivalence, frontier.expression)) {
                            classStep(frontier.expression, other, true, frontier.depth).ifPresent(steps::add);
                            enqueue(queue, other, frontier.depth + 1);
                        }
                        it.remove();
                    }
                }
            }
        }

        for (OWLAxiom axiom : remaining) {
            if (axiom instanceof OWLSubClassOfAxiom) {
                OWLSubClassOfAxiom subClassAxiom = (OWLSubClassOfAxiom) axiom;
                classStep(subClassAxiom.getSubClass(), subClassAxiom.getSuperClass(), false, 0).ifPresent(steps::add);
            } else if (axiom instanceof OWLEquivalentClassesAxiom) {
                List<OWLClassExpression> sides = ((OWLEquivalentClassesAxiom) axiom).classExpressions()
                        .sorted()
                        .collect(Collectors.toList());
                for (OWLClassExpression other : sides.subList(1, sides.size())) {
                    classStep(sides.get(0), other, true, 0).ifPresent(steps::add);
                }
            } else {
                LOGGER.debug("Justification axiom without a proof step form: {}", axiom);
            }
        }
        return steps;
    }

    private static boolean isPropertyAxiom(OWLAxiom axiom) {
        return axiom instanceof OWLTransitiveObjectPropertyAxiom
                || axiom instanceof OWLObjectPropertyDomainAxiom
                || axiom instanceof OWLObjectPropertyRangeAxiom
                || axiom instanceof OWLSubObjectPropertyOfAxiom;
    }

    private Optional<ProofStep> propertyStep(OWLAxiom axiom) {
        if (axiom instanceof OWLTransitiveObjectPropertyAxiom) {
            return converter.property(((OWLTransitiveObjectPropertyAxiom) axiom).getProperty())
                    .map(p -> ProofStep.transitive(p, 0));
        }
        if (axiom instanceof OWLObjectPropertyDomainAxiom) {
            OWLObjectPropertyDomainAxiom domainAxiom = (OWLObjectPropertyDomainAxiom) axiom;
            Optional<PropertyRef> property = converter.property(domainAxiom.getProperty());
            Optional<ClassExpression> domain = converter.convert(domainAxiom.getDomain());
            if (property.isPresent() && domain.isPresent()) {
                return Optional.of(ProofStep.domain(property.get(), domain.get(), 0));
            }
            return Optional.empty();
        }
        if (axiom instanceof OWLObjectPropertyRangeAxiom) {
            OWLObjectPropertyRangeAxiom rangeAxiom = (OWLObjectPropertyRangeAxiom) axiom;
            Optional<PropertyRef> property = converter.property(rangeAxiom.getProperty());
            Optional<ClassExpression> range = converter.convert(rangeAxiom.getRange());
            if (property.isPresent() && range.isPresent()) {
                return Optional.of(ProofStep.range(property.get(), range.get(), 0));
            }
            return Optional.empty();
        }
        OWLSubObjectPropertyOfAxiom subPropertyAxiom = (OWLSubObjectPropertyOfAxiom) axiom;
        Optional<PropertyRef> sub = converter.property(subPropertyAxiom.getSubProperty());
        Optional<PropertyRef> sup = converter.property(subPropertyAxiom.getSuperProperty());
        if (sub.isPresent() && sup.isPresent()) {
            return Optional.of(ProofStep.subPropertyOf(sub.get(), sup.get(), 0));
        }
        return Optional.empty();
    }

    private Optional<ProofStep> classStep(OWLClassExpression subject, OWLClassExpression superclass,
                                          boolean equivalence, int depth) {
        Optional<ClassExpression> from = converter.convert(subject);
        Optional<ClassExpression> to = converter.convert(superclass);
        if (!from.isPresent() || !to.isPresent()) {
            LOGGER.warn("Dropping proof step {} -> {}: unsupported construct", subject, superclass);
            return Optional.empty();
        }
        return Optional.of(equivalence
                ? ProofStep.equivalentTo(from.get(), to.get(), depth)
                : ProofStep.subClassOf(from.get(), to.get(), depth));
    }

    private static List<OWLClassExpression> otherSides(OWLEquivalentClassesAxiom axiom, OWLClassExpression side) {
        return axiom.classExpressions()
                .sorted()
                .filter(ce -> !ce.equals(side))
                .collect(Collectors.toList());
    }

    private static void enqueue(Deque<Frontier> queue, OWLClassExpression expression, int depth) {
        queue.add(new Frontier(expression, depth));
        if (expression instanceof OWLObjectIntersectionOf) {
            for (OWLClassExpression conjunct : ((OWLObjectIntersectionOf) expression).getOperandsAsList()) {
                queue.add(new Frontier(conjunct, depth));
            }
        }
    }

    private static final class Frontier {
        private final OWLClassExpression expression;
        private final int depth;

        private Frontier(OWLClassExpression expression, int depth) {
            this.expression = expression;
            this.depth = depth;
        }
    }
}
