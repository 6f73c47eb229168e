// com/owldsl/rendering/ExpressionRenderer.java
package com.owldsl.rendering;

import com.owldsl.config.CnlConfiguration;
import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.ClassExpressionVisitor;
import com.owldsl.expression.Complement;
import com.owldsl.expression.Conjunction;
import com.owldsl.expression.Disjunction;
import com.owldsl.expression.PropertyRef;
import com.owldsl.expression.Quantifier;
import com.owldsl.expression.Restriction;
import com.owldsl.util.EnglishPhrases;
import com.owldsl.util.URIUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Renders class expression trees to controlled English.
 *
 * <p>Two surface forms are produced for every expression: a noun phrase ("a foramen of skull that is
 * a conduit for a vein") and a predicate ("is a foramen of skull", "has a vein as a part"). Each public
 * call works on its own {@link Session}, so a renderer can be shared between threads.</p>
 */
public class ExpressionRenderer {

    public static final String VICE_VERSA = " and vice versa";
    public static final String TRUNCATION_MARKER = "...";

    private final TemplateRegistry registry;
    private final CnlConfiguration configuration;

    public ExpressionRenderer(TemplateRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.configuration = registry.getConfiguration();
    }

    public TemplateRegistry getRegistry() {
        return registry;
    }

    /**
     * Noun phrase for the expression, e.g. "a foramen of skull that is a conduit for a vein"
     */
    public RenderResult render(ClassExpression expression) throws RenderingException {
        Session session = new Session();
        String text = session.nounPhrase(expression);
        return session.result(text);
    }

    /**
     * Without a subject this is {@link #render(ClassExpression)}; with one, the subject followed by
     * the predicate form ("vestibular aqueduct is a foramen of skull")
     */
    public RenderResult render(ClassExpression expression, String subjectLabel) throws RenderingException {
        if (subjectLabel == null || subjectLabel.isBlank()) {
            return render(expression);
        }
        Session session = new Session();
        String text = subjectLabel + " " + session.predicate(expression);
        return session.result(text);
    }

    /**
     * Subject and predicate for an equivalence axiom; the biconditional suffix is always appended
     */
    public RenderResult renderEquivalence(ClassExpression expression, String subjectLabel) throws RenderingException {
        RenderResult result = render(expression, subjectLabel);
        return new RenderResult(result.getText() + VICE_VERSA, result.getDiagnostics());
    }

    /**
     * Predicate form, e.g. "is a foramen of skull" or "has a vein as a part"
     */
    public RenderResult renderPredicate(ClassExpression expression) throws RenderingException {
        Session session = new Session();
        String text = session.predicate(expression);
        return session.result(text);
    }

    /**
     * Predicate for several restrictions on the same property, with their fillers joined under the
     * plural template ("has an apex and a base as parts"). A single restriction renders as
     * {@link #renderPredicate(ClassExpression)}.
     */
    public RenderResult renderGroupPredicate(List<Restriction> restrictions) throws RenderingException {
        if (restrictions.isEmpty()) {
            throw new IllegalArgumentException("No restrictions to render");
        }
        Session session = new Session();
        String text = restrictions.size() == 1
                ? session.predicate(restrictions.get(0))
                : session.groupPhrase(restrictions);
        return session.result(text);
    }

    /**
     * Definition prompt of a restriction applied to the subject name ("What are the parts of the heart?")
     */
    public String definitionPrompt(Restriction restriction, String subjectName) throws RenderingException {
        return registry.resolve(restriction.getProperty()).getEntry().prompt(subjectName);
    }

    /**
     * Top-level conjuncts of an expression in source order; a non-conjunction is its own single conjunct
     */
    public static List<ClassExpression> conjuncts(ClassExpression expression) {
        if (expression instanceof Conjunction) {
            return ((Conjunction) expression).getOperands();
        }
        return List.of(expression);
    }

    /**
     * Class label as it appears in text, lower-cased on its first character unless exact labels are kept
     */
    public String className(AtomicClass atomicClass) {
        String label = atomicClass.hasLabel() ? atomicClass.getLabel() : URIUtils.getLocalName(atomicClass.getIri());
        return configuration.isExactClassLabels() ? label : EnglishPhrases.lowerCaseFirst(label);
    }

    /**
     * Singular when the cardinality is exactly one or the quantifier is existential over a filler
     * that denotes a single instance; plural otherwise
     */
    public static Multiplicity multiplicityOf(Restriction restriction) {
        Integer cardinality = restriction.getCardinality();
        if (cardinality != null) {
            return cardinality == 1 ? Multiplicity.SINGULAR : Multiplicity.PLURAL;
        }
        Quantifier quantifier = restriction.getQuantifier();
        if ((quantifier == Quantifier.EXISTENTIAL || quantifier == Quantifier.SELF)
                && !isPluralFiller(restriction.getFiller())) {
            return Multiplicity.SINGULAR;
        }
        return Multiplicity.PLURAL;
    }

    static boolean isPluralFiller(ClassExpression filler) {
        if (filler instanceof Disjunction) {
            return ((Disjunction) filler).getOperands().size() > 1;
        }
        if (filler instanceof Conjunction) {
            long atomic = ((Conjunction) filler).getOperands().stream().filter(ClassExpression::isAtomic).count();
            return atomic > 1;
        }
        return false;
    }

    /**
     * State of one rendering call: nesting depth and the diagnostics gathered so far
     */
    final class Session {

        private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();
        private final NounPhrase nounPhrase = new NounPhrase();
        private final Predicate predicate = new Predicate();
        private int depth = 0;

        RenderResult result(String text) {
            return new RenderResult(text, new ArrayList<>(diagnostics));
        }

        String nounPhrase(ClassExpression expression) throws RenderingException {
            enter();
            try {
                return expression.accept(nounPhrase);
            } finally {
                depth--;
            }
        }

        String predicate(ClassExpression expression) throws RenderingException {
            enter();
            try {
                return expression.accept(predicate);
            } finally {
                depth--;
            }
        }

        String groupPhrase(List<Restriction> restrictions) throws RenderingException {
            enter();
            try {
                PropertyRef property = restrictions.get(0).getProperty();
                Optional<String> reflexive = registry.reflexivePhrase(property);
                if (reflexive.isPresent()) {
                    return reflexive.get();
                }
                TemplateResolution resolution = registry.resolve(property);
                if (resolution.isUnconfigured()) {
                    diagnostics.add(Diagnostic.unconfigured(property.getIri()));
                }
                List<String> fillers = new ArrayList<>(restrictions.size());
                for (Restriction restriction : restrictions) {
                    fillers.add(fillerText(restriction));
                }
                return resolution.getEntry().apply(Multiplicity.PLURAL, EnglishPhrases.joinWithAnd(fillers));
            } finally {
                depth--;
            }
        }

        private void enter() throws RenderingException {
            if (++depth > configuration.getMaxRenderDepth()) {
                depth--;
                throw RenderingException.depthExceeded(configuration.getMaxRenderDepth());
            }
        }

        private List<ClassExpression> withoutSkipped(List<ClassExpression> operands) {
            List<ClassExpression> kept = new ArrayList<>(operands.size());
            for (ClassExpression operand : operands) {
                if (operand instanceof Restriction && registry.isSkipped(((Restriction) operand).getProperty())) {
                    PropertyRef property = ((Restriction) operand).getProperty();
                    diagnostics.add(new Diagnostic(DiagnosticKind.SKIPPED_PROPERTY, property.getIri(),
                            "Restriction on skipped property " + property + " left out"));
                    continue;
                }
                kept.add(operand);
            }
            return kept;
        }

        private List<String> predicates(List<ClassExpression> operands) throws RenderingException {
            List<String> phrases = new ArrayList<>(operands.size());
            for (ClassExpression operand : operands) {
                phrases.add(predicate(operand));
            }
            return phrases;
        }

        private String restrictionPhrase(Restriction restriction) throws RenderingException {
            PropertyRef property = restriction.getProperty();
            Optional<String> reflexive = registry.reflexivePhrase(property);
            if (reflexive.isPresent()) {
                return reflexive.get();
            }
            if (restriction.getQuantifier() == Quantifier.SELF) {
                Optional<String> selfPhrase = configuration.reflexivePhraseFor(property);
                if (selfPhrase.isPresent()) {
                    return selfPhrase.get();
                }
            }
            TemplateResolution resolution = registry.resolve(property);
            if (resolution.isUnconfigured()) {
                diagnostics.add(Diagnostic.unconfigured(property.getIri()));
            }
            return resolution.getEntry().apply(multiplicityOf(restriction), fillerText(restriction));
        }

        private String fillerText(Restriction restriction) throws RenderingException {
            ClassExpression filler = restriction.getFiller();
            boolean bare = registry.omitsArticle(restriction.getProperty());
            switch (restriction.getQuantifier()) {
                case SELF:
                    return "itself";
                case UNIVERSAL:
                    return "only " + (bare ? bareNoun(filler) : nounPhrase(filler));
                case EXACT_CARDINALITY:
                    return "exactly " + counted(restriction.getCardinality(), filler);
                case MIN_CARDINALITY:
                    return "at least " + counted(restriction.getCardinality(), filler);
                case MAX_CARDINALITY:
                    return "at most " + counted(restriction.getCardinality(), filler);
                case EXISTENTIAL:
                default:
                    return bare ? bareNoun(filler) : nounPhrase(filler);
            }
        }

        private String counted(int cardinality, ClassExpression filler) throws RenderingException {
            return EnglishPhrases.numberWord(cardinality) + " " + bareNoun(filler);
        }

        private String bareNoun(ClassExpression filler) throws RenderingException {
            if (filler.isAtomic()) {
                return className(filler.asAtomic());
            }
            return nounPhrase(filler);
        }

        private final class NounPhrase implements ClassExpressionVisitor<String, RenderingException> {

            @Override
            public String visit(AtomicClass atomicClass) {
                if (atomicClass.isOwlThing()) {
                    return "something";
                }
                if (atomicClass.isOwlNothing()) {
                    return "nothing";
                }
                return EnglishPhrases.withIndefiniteArticle(className(atomicClass));
            }

            @Override
            public String visit(Conjunction conjunction) throws RenderingException {
                List<ClassExpression> operands = withoutSkipped(conjunction.getOperands());
                if (operands.isEmpty()) {
                    return "something";
                }
                if (operands.size() == 1) {
                    return nounPhrase(operands.get(0));
                }
                ClassExpression head = operands.get(0);
                if (head.isAtomic() && !head.asAtomic().isOwlThing()) {
                    return nounPhrase(head) + " that "
                            + EnglishPhrases.joinWithAnd(predicates(operands.subList(1, operands.size())));
                }
                List<ClassExpression> rest = head.isAtomic() ? operands.subList(1, operands.size()) : operands;
                return "something that " + EnglishPhrases.joinWithAnd(predicates(rest));
            }

            @Override
            public String visit(Disjunction disjunction) throws RenderingException {
                List<String> alternatives = new ArrayList<>();
                for (ClassExpression operand : disjunction.getOperands()) {
                    alternatives.add(nounPhrase(operand));
                }
                return EnglishPhrases.joinWithOr(alternatives);
            }

            @Override
            public String visit(Restriction restriction) throws RenderingException {
                return "something that " + restrictionPhrase(restriction);
            }

            @Override
            public String visit(Complement complement) throws RenderingException {
                return "something that is not " + nounPhrase(complement.getOperand());
            }
        }

        private final class Predicate implements ClassExpressionVisitor<String, RenderingException> {

            @Override
            public String visit(AtomicClass atomicClass) throws RenderingException {
                return "is " + atomicClass.accept(nounPhrase);
            }

            @Override
            public String visit(Conjunction conjunction) throws RenderingException {
                List<ClassExpression> operands = withoutSkipped(conjunction.getOperands());
                if (operands.isEmpty()) {
                    return "is something";
                }
                if (operands.size() == 1) {
                    return predicate(operands.get(0));
                }
                ClassExpression head = operands.get(0);
                if (head.isAtomic() && !head.asAtomic().isOwlThing()) {
                    return "is " + conjunction.accept(nounPhrase);
                }
                List<ClassExpression> rest = head.isAtomic() ? operands.subList(1, operands.size()) : operands;
                return EnglishPhrases.joinWithAnd(predicates(rest));
            }

            @Override
            public String visit(Disjunction disjunction) throws RenderingException {
                return "is " + disjunction.accept(nounPhrase);
            }

            @Override
            public String visit(Restriction restriction) throws RenderingException {
                return restrictionPhrase(restriction);
            }

            @Override
            public String visit(Complement complement) throws RenderingException {
                return "is not " + nounPhrase(complement.getOperand());
            }
        }
    }
}
