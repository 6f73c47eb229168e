// com/owldsl/config/AppConfig.java
package com.owldsl.config;

import com.owldsl.definition.DefinitionComposer;
import com.owldsl.definition.DefinitionService;
import com.owldsl.explanation.ExplanationService;
import com.owldsl.explanation.InferenceExplainer;
import com.owldsl.explanation.JustificationTreeRenderer;
import com.owldsl.explanation.PelletExplanationService;
import com.owldsl.explanation.ProofExtractor;
import com.owldsl.ontology.DefaultOntologyService;
import com.owldsl.ontology.OntologyService;
import com.owldsl.ontology.OwlExpressionConverter;
import com.owldsl.processing.BatchRenderer;
import com.owldsl.reasoning.PelletReasoningService;
import com.owldsl.reasoning.ReasoningService;
import com.owldsl.rendering.ExpressionRenderer;
import com.owldsl.rendering.TemplateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class AppConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public OntologyService ontologyService() {
        return new DefaultOntologyService();
    }

    @Bean
    public ReasoningService reasoningService() {
        return new PelletReasoningService();
    }

    @Bean
    public ExplanationService explanationService() {
        return new PelletExplanationService();
    }

    @Bean
    public CnlConfiguration cnlConfiguration(RenderingProperties properties) {
        CnlConfigurationLoader loader = new CnlConfigurationLoader()
                .withDefaultNamespace(properties.getOntologyNamespace())
                .withExactClassLabels(properties.isExactClassLabels())
                .withMaxRenderDepth(properties.getMaxRenderDepth());
        if (properties.getConfigurationFile() == null || properties.getConfigurationFile().isBlank()) {
            LOGGER.warn("No rendering.configuration-file set");
            return loader.fromTree(null);
        }
        Path path = Path.of(properties.getConfigurationFile());
        if (Files.isRegularFile(path)) {
            return loader.load(path);
        }
        // fall back to the copy bundled on the classpath
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(properties.getConfigurationFile())) {
            if (in == null) {
                throw new ConfigException("CNL configuration not found: " + properties.getConfigurationFile());
            }
            LOGGER.info("Loading CNL configuration {} from the classpath", properties.getConfigurationFile());
            return loader.load(in);
        } catch (IOException e) {
            throw new ConfigException("Could not read CNL configuration " + path + ": " + e.getMessage(), e);
        }
    }

    @Bean
    public TemplateRegistry templateRegistry(CnlConfiguration cnlConfiguration) {
        return new TemplateRegistry(cnlConfiguration);
    }

    @Bean
    public ExpressionRenderer expressionRenderer(TemplateRegistry templateRegistry) {
        return new ExpressionRenderer(templateRegistry);
    }

    @Bean
    public DefinitionComposer definitionComposer(ExpressionRenderer expressionRenderer) {
        return new DefinitionComposer(expressionRenderer);
    }

    @Bean
    public DefinitionService definitionService(OntologyService ontologyService, DefinitionComposer definitionComposer,
                                               CnlConfiguration cnlConfiguration, RenderingProperties properties) {
        return new DefinitionService(ontologyService, definitionComposer, cnlConfiguration,
                properties.getOntologyLabel());
    }

    @Bean
    public BatchRenderer batchRenderer(OntologyService ontologyService, DefinitionService definitionService,
                                       RenderingProperties properties) {
        return new BatchRenderer(ontologyService, definitionService, properties.getProgressInterval());
    }

    @Bean
    public JustificationTreeRenderer justificationTreeRenderer(ExpressionRenderer expressionRenderer) {
        return new JustificationTreeRenderer(expressionRenderer);
    }

    @Bean
    public ProofExtractor proofExtractor(OntologyService ontologyService) {
        return new ProofExtractor(new OwlExpressionConverter(ontologyService));
    }

    @Bean
    public InferenceExplainer inferenceExplainer(OntologyService ontologyService,
                                                 ReasoningService reasoningService,
                                                 ExplanationService explanationService,
                                                 ProofExtractor proofExtractor,
                                                 JustificationTreeRenderer justificationTreeRenderer,
                                                 TemplateRegistry templateRegistry) {
        return new InferenceExplainer(ontologyService, reasoningService, explanationService, proofExtractor,
                justificationTreeRenderer, templateRegistry);
    }
}
