// com/owldsl/definition/ClassDefinition.java
package com.owldsl.definition;

import com.owldsl.rendering.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendered definition of one class: the expert text, the logical part, their concatenation and
 * the prompt/completion pairs derived from it
 */
public class ClassDefinition {

    private final String classIri;
    private final String label;
    private final String textualDefinition;
    private final String logicalDefinition;
    private final String text;
    private final Map<String, String> prompts;
    private final List<Diagnostic> diagnostics;

    public ClassDefinition(String classIri, String label, String textualDefinition, String logicalDefinition,
                           String text, Map<String, String> prompts, List<Diagnostic> diagnostics) {
        this.classIri = classIri;
        this.label = label;
        this.textualDefinition = textualDefinition;
        this.logicalDefinition = logicalDefinition;
        this.text = text;
        this.prompts = Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getClassIri() { return classIri; }
    public String getLabel() { return label; }

    /**
     * Expert-authored definition, or null when the class has none
     */
    public String getTextualDefinition() { return textualDefinition; }

    /**
     * The "is defined as" sentence followed by the enumerated restatement; empty without logical parts
     */
    public String getLogicalDefinition() { return logicalDefinition; }

    public String getText() { return text; }

    /**
     * Prompt to completion, in rendering order; the overall "What is the X?" entry comes last
     */
    public Map<String, String> getPrompts() { return prompts; }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public String toString() {
        return "ClassDefinition{" + classIri + ": " + text + "}";
    }
}
