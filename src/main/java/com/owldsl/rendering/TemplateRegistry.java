// com/owldsl/rendering/TemplateRegistry.java
package com.owldsl.rendering;

import com.owldsl.config.CnlConfiguration;
import com.owldsl.expression.PropertyRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides, per property, which phrase template applies.
 *
 * <p>Precedence, first match wins:</p>
 * <ol>
 *     <li>explicit phrasing configured for the property</li>
 *     <li>standard role: {@code "is {label} {}"}, prompt {@code "What is {} {label}?"}</li>
 *     <li>unconfigured: the raw {@code "{label} {}"} phrase, reported once per property</li>
 * </ol>
 * The reflexive override (see {@link #reflexivePhrase(PropertyRef)}) is checked by callers
 * before any of the above.
 */
public class TemplateRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRegistry.class);

    private final CnlConfiguration configuration;
    private final Set<String> reportedUnconfigured = ConcurrentHashMap.newKeySet();

    public TemplateRegistry(CnlConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public CnlConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Rule that would produce the template for a property, without needing its label
     */
    public TemplateSource sourceOf(PropertyRef property) {
        if (configuration.explicitPhrasingFor(property).isPresent()) {
            return TemplateSource.EXPLICIT;
        }
        if (configuration.isStandardRole(property)) {
            return TemplateSource.STANDARD;
        }
        return TemplateSource.UNCONFIGURED;
    }

    public TemplateResolution resolve(PropertyRef property) throws RenderingException {
        Optional<TemplateEntry> explicit = configuration.explicitPhrasingFor(property);
        if (explicit.isPresent()) {
            return new TemplateResolution(explicit.get(), TemplateSource.EXPLICIT);
        }
        if (!property.hasLabel()) {
            throw RenderingException.unresolvedProperty(property.getIri());
        }
        if (configuration.isStandardRole(property)) {
            return new TemplateResolution(TemplateEntry.isPhrasing(property.getLabel()), TemplateSource.STANDARD);
        }
        if (reportedUnconfigured.add(property.getIri())) {
            LOGGER.warn("No CNL phrasing for property '{}' ({}); rendering with its raw label",
                    property.getLabel(), property.getIri());
        }
        return new TemplateResolution(unconfigured(property.getLabel()), TemplateSource.UNCONFIGURED);
    }

    public String resolvePhrase(PropertyRef property, Multiplicity multiplicity) throws RenderingException {
        return resolve(property).getEntry().phraseFor(multiplicity);
    }

    public String definitionPrompt(PropertyRef property) throws RenderingException {
        return resolve(property).getEntry().getDefinitionPrompt();
    }

    /**
     * Fixed phrase for a reflexive property, present only when the property is asserted
     * reflexive and a phrase is configured for it
     */
    public Optional<String> reflexivePhrase(PropertyRef property) {
        if (!property.isReflexive()) {
            return Optional.empty();
        }
        return configuration.reflexivePhraseFor(property);
    }

    /**
     * Relation sentence fragment used by property-axiom proof steps: {@code "A has B as a part"}
     * when explicitly phrased, {@code "A 'has part' B"} otherwise
     */
    public String renderRole(PropertyRef property, String subject, String object) {
        Optional<TemplateEntry> explicit = configuration.explicitPhrasingFor(property);
        if (explicit.isPresent()) {
            return subject + " " + explicit.get().apply(Multiplicity.SINGULAR, object);
        }
        String label = property.hasLabel() ? property.getLabel() : property.getLocalName();
        return subject + " '" + label + "' " + object;
    }

    public boolean isSkipped(PropertyRef property) {
        return configuration.isSkipped(property);
    }

    public boolean omitsArticle(PropertyRef property) {
        return configuration.omitsArticle(property);
    }

    public boolean isIgnoredInference(String classLabel) {
        return configuration.isIgnoredInference(classLabel);
    }

    static TemplateEntry unconfigured(String propertyLabel) {
        String phrase = propertyLabel + " " + TemplateEntry.PLACEHOLDER;
        return new TemplateEntry(phrase, phrase, "What is " + TemplateEntry.PLACEHOLDER + " " + propertyLabel + "?");
    }
}
