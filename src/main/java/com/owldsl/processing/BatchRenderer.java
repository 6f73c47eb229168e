// com/owldsl/processing/BatchRenderer.java
package com.owldsl.processing;

import com.owldsl.definition.ClassDefinition;
import com.owldsl.definition.DefinitionService;
import com.owldsl.explanation.InferenceExplainer;
import com.owldsl.explanation.InferenceExplanation;
import com.owldsl.expression.AtomicClass;
import com.owldsl.ontology.OntologyService;
import com.owldsl.rendering.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Renders the definition of every labelled class of the current ontology.
 *
 * <p>The batch is a lazy sequence: each call to {@link #iterator()} starts over from the first class
 * and renders a class only when it is reached. A failing class yields a failed
 * {@link ClassRenderResult} and the sequence carries on.</p>
 */
public class BatchRenderer implements Iterable<ClassRenderResult> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRenderer.class);

    private final OntologyService ontologyService;
    private final DefinitionService definitionService;
    private final int progressInterval;

    public BatchRenderer(OntologyService ontologyService, DefinitionService definitionService, int progressInterval) {
        this.ontologyService = ontologyService;
        this.definitionService = definitionService;
        this.progressInterval = Math.max(1, progressInterval);
    }

    @Override
    public Iterator<ClassRenderResult> iterator() {
        Iterator<AtomicClass> classes = labelledClasses().iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return classes.hasNext();
            }

            @Override
            public ClassRenderResult next() {
                if (!classes.hasNext()) {
                    throw new NoSuchElementException();
                }
                return renderOne(classes.next());
            }
        };
    }

    public Stream<ClassRenderResult> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Render every class, handing successful definitions to the sink. Failures and diagnostics are
     * collected in the returned summary rather than thrown.
     */
    public ProcessingResult renderAll(Consumer<ClassDefinition> sink) {
        ProcessingResult result = new ProcessingResult();
        long start = System.currentTimeMillis();
        long seen = 0;

        for (ClassRenderResult rendered : this) {
            seen++;
            if (rendered.isSuccess()) {
                ClassDefinition definition = rendered.getDefinition();
                try {
                    sink.accept(definition);
                    result.incrementRenderedClasses();
                    result.addWrittenPrompts(definition.getPrompts().size());
                } catch (RuntimeException e) {
                    LOGGER.error("Failed to write definition of {}", definition.getClassIri(), e);
                    result.incrementFailedClasses();
                    result.addError(definition.getClassIri() + ": " + e.getMessage());
                }
                for (Diagnostic diagnostic : definition.getDiagnostics()) {
                    result.addWarning(definition.getClassIri() + ": " + diagnostic);
                }
            } else {
                result.incrementFailedClasses();
                result.addError(rendered.getAtomicClass().getIri() + ": " + rendered.getError());
            }
            if (seen % progressInterval == 0) {
                LOGGER.info("Progress: {} classes rendered, {} failed", result.getRenderedClasses(),
                        result.getFailedClasses());
            }
        }

        result.setProcessingTimeMs(System.currentTimeMillis() - start);
        Runtime runtime = Runtime.getRuntime();
        result.setMemoryUsedMB((runtime.totalMemory() - runtime.freeMemory()) / (1024.0 * 1024.0));
        return result;
    }

    /**
     * Explain the inferred subsumptions of every labelled class, handing each informative
     * (header, proof) pair to the sink. Expects the reasoner and explanation services to be initialized.
     */
    public void explainAll(InferenceExplainer explainer, BiConsumer<String, String> sink, ProcessingResult result) {
        long seen = 0;
        for (AtomicClass atomicClass : labelledClasses()) {
            seen++;
            List<InferenceExplanation> explanations;
            try {
                explanations = explainer.explainInferences(atomicClass);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to explain inferences of {}: {}", atomicClass.getIri(), e.getMessage());
                result.addError(atomicClass.getIri() + ": " + e.getMessage());
                continue;
            }
            long written = 0;
            for (InferenceExplanation explanation : explanations) {
                if (explanation.hasError()) {
                    result.addWarning(explanation.getSubClassIri() + " -> " + explanation.getSuperClassIri()
                            + ": " + explanation.getError());
                } else if (explanation.isInformative()) {
                    sink.accept(explanation.getHeader(), explanation.getProof());
                    written++;
                }
            }
            result.addExplainedInferences(written);
            if (seen % progressInterval == 0) {
                LOGGER.info("Progress: {} classes explained, {} explanations", seen, result.getExplainedInferences());
            }
        }
    }

    private List<AtomicClass> labelledClasses() {
        return ontologyService.listClasses().stream()
                .filter(AtomicClass::hasLabel)
                .collect(Collectors.toList());
    }

    private ClassRenderResult renderOne(AtomicClass atomicClass) {
        try {
            return ClassRenderResult.success(atomicClass, definitionService.define(atomicClass));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to render {}: {}", atomicClass.getIri(), e.getMessage());
            return ClassRenderResult.failure(atomicClass, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}
