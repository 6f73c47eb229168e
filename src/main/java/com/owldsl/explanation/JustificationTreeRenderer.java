// com/owldsl/explanation/JustificationTreeRenderer.java
package com.owldsl.explanation;

import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.PropertyRef;
import com.owldsl.rendering.ExpressionRenderer;
import com.owldsl.rendering.RenderingErrorKind;
import com.owldsl.rendering.RenderingException;
import com.owldsl.rendering.TemplateRegistry;
import com.owldsl.util.EnglishPhrases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an ordered justification chain into indented English sentences, one per informative step.
 *
 * <p>A class step whose superclass is a named class on the inference ignore list is elided. The chain
 * stays connected: the next step that starts from the elided class is rendered from the last subject
 * that was printed, so {@code A ⊑ B, B ⊑ C} with B ignored reads "Every a is a c." A step nested deeper
 * than the render depth limit is cut to "Every a ..." and the rest of the chain is still rendered.</p>
 */
public class JustificationTreeRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(JustificationTreeRenderer.class);

    public static final String INDENT = "  ";

    private final ExpressionRenderer renderer;
    private final TemplateRegistry registry;

    public JustificationTreeRenderer(ExpressionRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.registry = renderer.getRegistry();
    }

    /**
     * Render the chain as newline-separated sentences. An empty string means no step was informative.
     */
    public String renderProof(List<ProofStep> steps) throws RenderingException {
        return String.join("\n", renderLines(steps));
    }

    public List<String> renderLines(List<ProofStep> steps) throws RenderingException {
        List<String> lines = new ArrayList<>();
        Map<ClassExpression, ClassExpression> carriedSubjects = new HashMap<>();
        int elided = 0;
        int level = 0;

        for (ProofStep step : steps) {
            if (isElided(step)) {
                ClassExpression subject = carriedSubjects.getOrDefault(step.getSubject(), step.getSubject());
                carriedSubjects.put(step.getSuperclass(), subject);
                elided++;
                LOGGER.debug("Eliding uninformative step {}", step);
                continue;
            }
            level = Math.max(level, step.getDepth() - elided);
            try {
                lines.add(indent(level) + sentence(step, carriedSubjects));
            } catch (RenderingException e) {
                if (e.getKind() != RenderingErrorKind.DEPTH_EXCEEDED) {
                    throw e;
                }
                LOGGER.warn("Truncating proof step {}: {}", step, e.getMessage());
                lines.add(indent(level) + truncatedSentence(step, carriedSubjects));
            }
        }
        if (lines.isEmpty() && !steps.isEmpty()) {
            LOGGER.debug("All {} steps of the justification were elided", steps.size());
        }
        return lines;
    }

    boolean isElided(ProofStep step) {
        if (!step.getType().isClassStep() || !step.getSuperclass().isAtomic()) {
            return false;
        }
        return registry.isIgnoredInference(step.getSuperclass().asAtomic().getLabel());
    }

    private String sentence(ProofStep step, Map<ClassExpression, ClassExpression> carriedSubjects)
            throws RenderingException {
        PropertyRef property = step.getProperty();
        switch (step.getType()) {
            case TRANSITIVE:
                return "'" + label(property) + "' is a transitive property.";
            case DOMAIN:
                return "If A is related to B via '" + label(property) + "' then A is "
                        + quotedClass(step.getSuperclass()) + ".";
            case RANGE:
                return "If " + registry.renderRole(property, "A", "B") + ", then B is "
                        + quotedClass(step.getSuperclass()) + ".";
            case SUB_PROPERTY:
                PropertyRef superProperty = step.getSuperProperty();
                return "If " + registry.renderRole(property, "A", "B") + ", then "
                        + registry.renderRole(superProperty, "A", "B") + " also ('" + label(property)
                        + "' is a subproperty of '" + label(superProperty) + "').";
            case EQUIVALENCE:
            case SUBCLASS:
            default:
                ClassExpression subject = carriedSubjects.getOrDefault(step.getSubject(), step.getSubject());
                String text = subjectPhrase(subject) + " "
                        + renderer.renderPredicate(step.getSuperclass()).getText();
                if (step.getType() == ProofStepType.EQUIVALENCE) {
                    text += ExpressionRenderer.VICE_VERSA;
                }
                return text + ".";
        }
    }

    /**
     * Subject of the step followed by the truncation marker, or the marker alone when the subject is too deep as well
     */
    private String truncatedSentence(ProofStep step, Map<ClassExpression, ClassExpression> carriedSubjects) {
        if (!step.getType().isClassStep()) {
            return "'" + label(step.getProperty()) + "' " + ExpressionRenderer.TRUNCATION_MARKER;
        }
        ClassExpression subject = carriedSubjects.getOrDefault(step.getSubject(), step.getSubject());
        try {
            return subjectPhrase(subject) + " " + ExpressionRenderer.TRUNCATION_MARKER;
        } catch (RenderingException e) {
            LOGGER.debug("Subject of {} is too deep as well: {}", step, e.getMessage());
            return ExpressionRenderer.TRUNCATION_MARKER;
        }
    }

    private String subjectPhrase(ClassExpression subject) throws RenderingException {
        if (subject.isAtomic()) {
            AtomicClass atomic = subject.asAtomic();
            return atomic.isOwlThing() ? "Everything" : "Every " + renderer.className(atomic);
        }
        return "Anything that " + renderer.renderPredicate(subject).getText();
    }

    private String quotedClass(ClassExpression expression) throws RenderingException {
        if (expression.isAtomic() && expression.asAtomic().hasLabel()) {
            String label = expression.asAtomic().getLabel();
            return EnglishPhrases.indefiniteArticle(label) + " '" + label + "'";
        }
        return renderer.render(expression).getText();
    }

    private static String label(PropertyRef property) {
        return property.hasLabel() ? property.getLabel() : property.getLocalName();
    }

    private static String indent(int level) {
        return INDENT.repeat(level);
    }
}
