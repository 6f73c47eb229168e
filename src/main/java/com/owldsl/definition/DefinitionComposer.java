// com/owldsl/definition/DefinitionComposer.java
package com.owldsl.definition;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.Conjunction;
import com.owldsl.expression.PropertyRef;
import com.owldsl.expression.Quantifier;
import com.owldsl.expression.Restriction;
import com.owldsl.rendering.Diagnostic;
import com.owldsl.rendering.DiagnosticKind;
import com.owldsl.rendering.ExpressionRenderer;
import com.owldsl.rendering.RenderResult;
import com.owldsl.rendering.RenderingErrorKind;
import com.owldsl.rendering.RenderingException;
import com.owldsl.rendering.TemplateRegistry;
import com.owldsl.util.EnglishPhrases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles the textual and logical definition of a class.
 *
 * <p>Output shape: the expert definition as a sentence (when present), then
 * "The {class} is defined in {ontology} as {noun phrase}." and one "It {predicate}." sentence per
 * top-level conjunct. Restrictions on the same property share one sentence under the plural template. Parts are rendered one at a time so a single bad restriction only costs that
 * part: an unresolved property drops it, an over-deep part is replaced by "...".</p>
 */
public class DefinitionComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefinitionComposer.class);

    public static final String TRUNCATION_MARKER = ExpressionRenderer.TRUNCATION_MARKER;

    private final ExpressionRenderer renderer;
    private final TemplateRegistry registry;

    public DefinitionComposer(ExpressionRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.registry = renderer.getRegistry();
    }

    /**
     * Definition from a single subsumption expression
     */
    public ClassDefinition composeDefinition(AtomicClass atomicClass, String textualDefinition,
                                             ClassExpression logicalExpression, String ontologyLabel) {
        List<ClassExpression> superClasses = logicalExpression == null ? List.of() : List.of(logicalExpression);
        return composeDefinition(atomicClass, textualDefinition, List.of(), superClasses, ontologyLabel);
    }

    /**
     * Definition from equivalent-class and superclass expressions. When equivalents exist they form the
     * inline definition (marked "and vice versa"); superclass parts are still enumerated.
     */
    public ClassDefinition composeDefinition(AtomicClass atomicClass, String textualDefinition,
                                             List<ClassExpression> equivalents, List<ClassExpression> superClasses,
                                             String ontologyLabel) {
        String name = renderer.className(atomicClass);
        String subjectName = "the " + name;
        Set<Diagnostic> diagnostics = new LinkedHashSet<>();

        List<Part> parts = new ArrayList<>();
        Set<ClassExpression> seen = new LinkedHashSet<>();
        collectParts(equivalents, true, parts, seen, diagnostics);
        collectParts(superClasses, false, parts, seen, diagnostics);
        boolean hasEquivalents = parts.stream().anyMatch(p -> p.fromEquivalence);

        for (Part part : parts) {
            try {
                RenderResult predicate = part.isGroup()
                        ? renderer.renderGroupPredicate(part.restrictions())
                        : renderer.renderPredicate(part.expressions.get(0));
                part.predicate = predicate.getText();
                diagnostics.addAll(predicate.getDiagnostics());
            } catch (RenderingException e) {
                diagnostics.add(Diagnostic.from(e));
                if (e.getKind() == RenderingErrorKind.DEPTH_EXCEEDED) {
                    LOGGER.warn("Truncating part of the definition of {}: {}", atomicClass.getIri(), e.getMessage());
                    part.truncated = true;
                } else {
                    LOGGER.warn("Leaving out part of the definition of {}: {}", atomicClass.getIri(), e.getMessage());
                    part.dropped = true;
                }
            }
        }

        List<String> sentences = new ArrayList<>();
        List<Part> inlineGroup = new ArrayList<>();
        for (Part part : parts) {
            if (!part.dropped && (part.fromEquivalence || !hasEquivalents)) {
                inlineGroup.add(part);
            }
        }
        if (!inlineGroup.isEmpty()) {
            String definedAs = ontologyLabel == null || ontologyLabel.isBlank()
                    ? " is defined as "
                    : " is defined in " + ontologyLabel + " as ";
            String inline = "The " + name + definedAs + inlinePhrase(atomicClass, inlineGroup, diagnostics)
                    + (hasEquivalents ? ExpressionRenderer.VICE_VERSA : "");
            sentences.add(inline.endsWith(TRUNCATION_MARKER) ? inline : inline + ".");
        }

        Map<String, String> prompts = new LinkedHashMap<>();
        for (Part part : parts) {
            if (part.dropped) {
                continue;
            }
            if (part.truncated) {
                sentences.add("It " + TRUNCATION_MARKER);
                continue;
            }
            String sentence = "It " + part.predicate + ".";
            sentences.add(sentence);
            if (part.expressions.get(0) instanceof Restriction) {
                addPrompt(prompts, (Restriction) part.expressions.get(0), subjectName, sentence);
            }
        }

        String logical = String.join(" ", sentences);
        String textual = textualDefinition == null || textualDefinition.isBlank() ? null : textualDefinition.trim();
        String text;
        if (textual == null) {
            text = logical;
        } else {
            text = logical.isEmpty() ? EnglishPhrases.asSentence(textual) : EnglishPhrases.asSentence(textual) + " " + logical;
        }
        if (!text.isEmpty()) {
            prompts.put("What is " + subjectName + "?", text);
        }

        return new ClassDefinition(atomicClass.getIri(), atomicClass.getLabel(), textual, logical, text,
                prompts, new ArrayList<>(diagnostics));
    }

    private void collectParts(List<ClassExpression> expressions, boolean fromEquivalence, List<Part> parts,
                              Set<ClassExpression> seen, Set<Diagnostic> diagnostics) {
        for (ClassExpression expression : expressions) {
            for (ClassExpression conjunct : ExpressionRenderer.conjuncts(expression)) {
                if (conjunct instanceof Restriction && registry.isSkipped(((Restriction) conjunct).getProperty())) {
                    PropertyRef property = ((Restriction) conjunct).getProperty();
                    diagnostics.add(new Diagnostic(DiagnosticKind.SKIPPED_PROPERTY, property.getIri(),
                            "Restriction on skipped property " + property + " left out"));
                    continue;
                }
                if (!seen.add(conjunct)) {
                    continue;
                }
                Part group = groupFor(parts, conjunct, fromEquivalence);
                if (group != null) {
                    group.expressions.add(conjunct);
                } else {
                    parts.add(new Part(conjunct, fromEquivalence));
                }
            }
        }
    }

    /**
     * Earlier part from the same axiom kind holding restrictions on the same property, if any
     */
    private static Part groupFor(List<Part> parts, ClassExpression conjunct, boolean fromEquivalence) {
        PropertyRef property = groupingProperty(conjunct);
        if (property == null) {
            return null;
        }
        for (Part part : parts) {
            if (part.fromEquivalence == fromEquivalence && property.equals(groupingProperty(part.expressions.get(0)))) {
                return part;
            }
        }
        return null;
    }

    private static PropertyRef groupingProperty(ClassExpression expression) {
        if (!(expression instanceof Restriction)) {
            return null;
        }
        Restriction restriction = (Restriction) expression;
        return restriction.getQuantifier() == Quantifier.SELF ? null : restriction.getProperty();
    }

    private String inlinePhrase(AtomicClass atomicClass, List<Part> group, Set<Diagnostic> diagnostics) {
        List<ClassExpression> rendered = new ArrayList<>();
        boolean truncated = false;
        for (Part part : group) {
            if (part.truncated) {
                truncated = true;
            } else {
                rendered.addAll(part.expressions);
            }
        }
        if (rendered.isEmpty()) {
            return TRUNCATION_MARKER;
        }
        ClassExpression expression = rendered.size() == 1 ? rendered.get(0) : new Conjunction(rendered);
        String phrase;
        try {
            RenderResult result = renderer.render(expression);
            diagnostics.addAll(result.getDiagnostics());
            phrase = result.getText();
        } catch (RenderingException e) {
            LOGGER.warn("Truncating inline definition of {}: {}", atomicClass.getIri(), e.getMessage());
            diagnostics.add(Diagnostic.from(e));
            return TRUNCATION_MARKER;
        }
        return truncated ? phrase + " " + TRUNCATION_MARKER : phrase;
    }

    private void addPrompt(Map<String, String> prompts, Restriction restriction, String subjectName, String sentence) {
        try {
            String prompt = renderer.definitionPrompt(restriction, subjectName);
            prompts.merge(prompt, sentence, (existing, added) -> existing + " " + added);
        } catch (RenderingException e) {
            LOGGER.debug("No prompt for restriction on {}: {}", restriction.getProperty(), e.getMessage());
        }
    }

    /**
     * One top-level conjunct, or several restrictions on the same property rendered together
     */
    private static final class Part {
        private final List<ClassExpression> expressions = new ArrayList<>();
        private final boolean fromEquivalence;
        private String predicate;
        private boolean truncated;
        private boolean dropped;

        private Part(ClassExpression expression, boolean fromEquivalence) {
            this.expressions.add(expression);
            this.fromEquivalence = fromEquivalence;
        }

        private boolean isGroup() {
            return expressions.size() > 1;
        }

        private List<Restriction> restrictions() {
            List<Restriction> restrictions = new ArrayList<>(expressions.size());
            for (ClassExpression expression : expressions) {
                restrictions.add((Restriction) expression);
            }
            return restrictions;
        }
    }
}
