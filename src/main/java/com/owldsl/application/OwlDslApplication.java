// com/owldsl/application/OwlDslApplication.java
package com.owldsl.application;

import com.owldsl.config.RenderingProperties;
import com.owldsl.definition.ClassDefinition;
import com.owldsl.definition.DefinitionService;
import com.owldsl.explanation.ExplanationService;
import com.owldsl.explanation.InferenceExplainer;
import com.owldsl.explanation.InferenceExplanation;
import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.PropertyRef;
import com.owldsl.ontology.OntologyService;
import com.owldsl.ontology.OntologyStats;
import com.owldsl.output.CorpusOutputService;
import com.owldsl.processing.BatchRenderer;
import com.owldsl.processing.PerformanceTracker;
import com.owldsl.processing.ProcessingResult;
import com.owldsl.reasoning.ReasoningService;
import com.owldsl.rendering.Diagnostic;
import com.owldsl.rendering.TemplateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import jakarta.annotation.PreDestroy;
import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point. Select the work with {@code --action=}:
 * render_class, find_classes, find_properties, explain_inferences, justify_gci or export_corpus
 * (with {@code --explain} to add inference explanations to the corpus).
 * <p>
 * find_properties takes {@code --show-property-definition-usage} with {@code --limit=N} to render
 * the definitions of up to N classes restricting each property. justify_gci takes {@code --class=}
 * and a Manchester-syntax {@code --expression=}.
 */
@SpringBootApplication(scanBasePackages = "com.owldsl")
@EnableConfigurationProperties(RenderingProperties.class)
public class OwlDslApplication implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(OwlDslApplication.class);

    static final String ACTION = "action";

    @Autowired
    private RenderingProperties config;

    @Autowired
    private OntologyService ontologyService;

    @Autowired
    private ReasoningService reasoningService;

    @Autowired
    private ExplanationService explanationService;

    @Autowired
    private TemplateRegistry templateRegistry;

    @Autowired
    private DefinitionService definitionService;

    @Autowired
    private BatchRenderer batchRenderer;

    @Autowired
    private InferenceExplainer inferenceExplainer;

    private final PerformanceTracker tracker = new PerformanceTracker();

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(OwlDslApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String action = option(args, ACTION);
        if (action == null) {
            LOGGER.info("No --action given. Available actions: render_class, find_classes, find_properties, "
                    + "explain_inferences, justify_gci, export_corpus");
            return;
        }

        LOGGER.info("=== OWL CNL renderer: {} ===", action);
        LOGGER.info("Settings: {}", config);
        loadOntology(args);

        try {
            switch (action) {
                case "render_class":
                    renderClass(required(args, "class"));
                    break;
                case "find_classes":
                    findClasses(required(args, "query"), flag(args, "regex"));
                    break;
                case "find_properties":
                    findProperties(option(args, "prefix"), option(args, "label-pattern"),
                            flag(args, "show-property-definition-usage") ? intOption(args, "limit", 1) : 0);
                    break;
                case "explain_inferences":
                    explainInferences(required(args, "class"));
                    break;
                case "justify_gci":
                    justifyGci(required(args, "class"), required(args, "expression"));
                    break;
                case "export_corpus":
                    String output = option(args, "output");
                    exportCorpus(output != null ? output : config.getOutputDirectory(), flag(args, "explain"));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown action: " + action);
            }
        } catch (Exception e) {
            LOGGER.error("Action {} failed", action, e);
            throw e;
        } finally {
            tracker.logSummary();
        }
    }

    private void loadOntology(ApplicationArguments args) {
        String ontologyFile = option(args, "ontology");
        if (ontologyFile == null) {
            ontologyFile = config.getOntologyFile();
        }
        if (ontologyFile == null) {
            throw new IllegalArgumentException("No ontology given: set rendering.ontology-file or --ontology=");
        }
        tracker.start("load ontology");
        ontologyService.loadOntology(new File(ontologyFile));
        tracker.end("load ontology");

        OntologyStats stats = ontologyService.getStats();
        LOGGER.info("Ontology: {}", stats);
    }

    private void renderClass(String iriOrLabel) {
        AtomicClass atomicClass = requireClass(iriOrLabel);
        tracker.start("render");
        ClassDefinition definition = definitionService.define(atomicClass);
        tracker.end("render");

        LOGGER.info("{}", definition.getText().isEmpty() ? "(no definition)" : definition.getText());
        definition.getPrompts().forEach((prompt, completion) -> LOGGER.info("  {} -> {}", prompt, completion));
        logDiagnostics(definition.getDiagnostics());
    }

    private void findClasses(String query, boolean regex) {
        List<AtomicClass> classes = ontologyService.findClasses(query, regex);
        LOGGER.info("{} classes match '{}'", classes.size(), query);
        classes.forEach(c -> LOGGER.info("  {} <{}>", c.getLabel(), c.getIri()));
    }

    private void findProperties(String prefix, String labelPattern, int usageLimit) {
        List<PropertyRef> properties = ontologyService.listObjectProperties(prefix, labelPattern);
        LOGGER.info("{} object properties", properties.size());
        for (PropertyRef property : properties) {
            LOGGER.info("  {} <{}> [{}]", property.hasLabel() ? property.getLabel() : property.getLocalName(),
                    property.getIri(), templateRegistry.sourceOf(property).getDisplayName());
            definitionService.textualDefinitionOf(property.getIri())
                    .ifPresent(text -> LOGGER.info("    definition: {}", text));
            List<String> domain = ontologyService.domainLabels(property.getIri());
            List<String> range = ontologyService.rangeLabels(property.getIri());
            if (!domain.isEmpty() || !range.isEmpty()) {
                LOGGER.info("    domain: {} range: {}", domain, range);
            }
            if (usageLimit > 0) {
                for (AtomicClass user : ontologyService.classesUsingProperty(property.getIri(), usageLimit)) {
                    ClassDefinition definition = definitionService.define(user);
                    LOGGER.info("    used by {}: {}", user.getLabel(), definition.getText());
                }
            }
        }
    }

    private void explainInferences(String iriOrLabel) {
        AtomicClass atomicClass = requireClass(iriOrLabel);
        prepareReasoning();

        tracker.start("explain");
        List<InferenceExplanation> explanations = inferenceExplainer.explainInferences(atomicClass);
        tracker.end("explain");

        for (InferenceExplanation explanation : explanations) {
            logExplanation(explanation);
        }
    }

    private void justifyGci(String iriOrLabel, String expression) {
        AtomicClass atomicClass = requireClass(iriOrLabel);
        prepareReasoning();

        tracker.start("explain");
        InferenceExplanation explanation = inferenceExplainer.explainGci(atomicClass, expression);
        tracker.end("explain");
        logExplanation(explanation);
    }

    private void logExplanation(InferenceExplanation explanation) {
        LOGGER.info("{}", explanation.getHeader());
        if (explanation.hasError()) {
            LOGGER.warn("  {}", explanation.getError());
        } else if (!explanation.isInformative()) {
            LOGGER.info("  (no informative justification)");
        } else {
            for (String line : explanation.getProof().split("\n")) {
                LOGGER.info("  {}", line);
            }
        }
    }

    private void prepareReasoning() {
        tracker.start("reasoning");
        reasoningService.initializeReasoner(ontologyService.getOntology());
        if (!reasoningService.isConsistent()) {
            throw new IllegalStateException("Ontology is inconsistent; inferences cannot be explained");
        }
        reasoningService.precomputeInferences();
        explanationService.initializeExplanations(reasoningService.getReasoner());
        tracker.end("reasoning");
    }

    private void exportCorpus(String outputDirectory, boolean explain) throws Exception {
        ProcessingResult result;
        tracker.start("export");
        try (CorpusOutputService output = new CorpusOutputService(Path.of(outputDirectory),
                config.getPromptField(), config.getCompletionField())) {
            output.initialize();
            result = batchRenderer.renderAll(output::writeDefinition);
            if (explain) {
                prepareReasoning();
                batchRenderer.explainAll(inferenceExplainer, output::writeExplanation, result);
            }
            output.flush();
        }
        tracker.end("export");
        logResults(result);
    }

    private void logResults(ProcessingResult result) {
        LOGGER.info("=== EXPORT COMPLETED ===");
        LOGGER.info("Results Summary:");
        LOGGER.info("  Rendered classes: {}", result.getRenderedClasses());
        LOGGER.info("  Failed classes: {}", result.getFailedClasses());
        LOGGER.info("  Prompts written: {}", result.getWrittenPrompts());
        LOGGER.info("  Inferences explained: {}", result.getExplainedInferences());
        LOGGER.info("  Processing time: {} ms", result.getProcessingTimeMs());
        LOGGER.info("  Memory used: {} MB", String.format("%.2f", result.getMemoryUsedMB()));
        LOGGER.info("  Success: {}", result.isSuccess());

        if (result.hasErrors()) {
            LOGGER.warn("Failures ({}): ", result.getErrorCount());
            result.getErrors().forEach(error -> LOGGER.warn("  - {}", error));
        }

        if (result.hasWarnings()) {
            LOGGER.info("Diagnostics ({}): ", result.getWarningCount());
            result.getWarnings().forEach(warning -> LOGGER.debug("  - {}", warning));
        }
    }

    private void logDiagnostics(List<Diagnostic> diagnostics) {
        if (!diagnostics.isEmpty()) {
            LOGGER.info("Diagnostics ({}):", diagnostics.size());
            diagnostics.forEach(d -> LOGGER.info("  - {}", d));
        }
    }

    private AtomicClass requireClass(String iriOrLabel) {
        Optional<AtomicClass> atomicClass = ontologyService.findClass(iriOrLabel);
        if (!atomicClass.isPresent()) {
            throw new IllegalArgumentException("No class with IRI or label '" + iriOrLabel + "'");
        }
        return atomicClass.get();
    }

    private static String required(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing --" + name + "=");
        }
        return value;
    }

    /**
     * First value of {@code --name=value}, or null when the option is absent or has no value
     */
    static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * A bare {@code --name} is set; {@code --name=false} is not
     */
    static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = option(args, name);
        return value == null || Boolean.parseBoolean(value);
    }

    static int intOption(ApplicationArguments args, String name, int defaultValue) {
        String value = option(args, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number, got '" + value + "'", e);
        }
    }

    @PreDestroy
    public void cleanup() {
        try {
            reasoningService.close();
            ontologyService.close();
        } catch (Exception e) {
            LOGGER.warn("Error during cleanup: {}", e.getMessage());
        }
    }
}
