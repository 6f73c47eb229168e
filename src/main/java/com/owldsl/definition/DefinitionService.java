// com/owldsl/definition/DefinitionService.java
package com.owldsl.definition;

import com.owldsl.config.CnlConfiguration;
import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.ontology.OntologyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Gathers what the composer needs for a class from the current ontology: the expert definition,
 * the stated equivalent and superclass expressions and the ontology title.
 */
public class DefinitionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefinitionService.class);

    private final OntologyService ontologyService;
    private final DefinitionComposer composer;
    private final CnlConfiguration configuration;
    private final String ontologyLabelOverride;

    public DefinitionService(OntologyService ontologyService, DefinitionComposer composer,
                             CnlConfiguration configuration, String ontologyLabelOverride) {
        this.ontologyService = ontologyService;
        this.composer = composer;
        this.configuration = configuration;
        this.ontologyLabelOverride = ontologyLabelOverride == null || ontologyLabelOverride.isBlank()
                ? null : ontologyLabelOverride;
    }

    public ClassDefinition define(AtomicClass atomicClass) {
        String iri = atomicClass.getIri();
        List<ClassExpression> equivalents = ontologyService.equivalentClassExpressionsOf(iri);
        List<ClassExpression> superClasses = ontologyService.superClassExpressionsOf(iri);
        LOGGER.debug("Defining {} from {} equivalent and {} superclass expressions",
                iri, equivalents.size(), superClasses.size());

        return composer.composeDefinition(atomicClass, textualDefinitionOf(iri).orElse(null),
                equivalents, superClasses, ontologyLabel());
    }

    /**
     * First value of the configured expert definition properties, in configuration order
     */
    public Optional<String> textualDefinitionOf(String entityIri) {
        for (String property : configuration.getExpertDefinitionProperties()) {
            Optional<String> value = ontologyService.expertDefinitionValue(entityIri, property);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public String ontologyLabel() {
        if (ontologyLabelOverride != null) {
            return ontologyLabelOverride;
        }
        return ontologyService.ontologyLabel().orElse(null);
    }
}
