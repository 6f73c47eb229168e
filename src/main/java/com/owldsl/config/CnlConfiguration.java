// com/owldsl/config/CnlConfiguration.java
package com.owldsl.config;

import com.owldsl.expression.PropertyRef;
import com.owldsl.rendering.TemplateEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable phrase-template configuration shared by every rendering call.
 *
 * <p>Property keys are stored as given (after namespace expansion by the loader). Lookups match the
 * property IRI first and then its local name, so a configuration written with short role names
 * ({@code part_of}) applies to fully qualified properties as well.</p>
 */
public final class CnlConfiguration {

    public static final int DEFAULT_MAX_RENDER_DEPTH = 64;

    private final Set<String> expertDefinitionProperties;
    private final Set<String> standardRoles;
    private final Map<String, TemplateEntry> explicitPhrasing;
    private final Map<String, String> reflexiveRolePhrasing;
    private final Set<String> classInferenceIgnoreList;
    private final Set<String> skippedRoles;
    private final Set<String> rolesWithoutArticles;
    private final boolean exactClassLabels;
    private final int maxRenderDepth;
    private final String namespace;

    private CnlConfiguration(Builder builder) {
        this.expertDefinitionProperties = Collections.unmodifiableSet(new LinkedHashSet<>(builder.expertDefinitionProperties));
        this.standardRoles = Collections.unmodifiableSet(new LinkedHashSet<>(builder.standardRoles));
        this.explicitPhrasing = Collections.unmodifiableMap(new LinkedHashMap<>(builder.explicitPhrasing));
        this.reflexiveRolePhrasing = Collections.unmodifiableMap(new LinkedHashMap<>(builder.reflexiveRolePhrasing));
        this.classInferenceIgnoreList = Collections.unmodifiableSet(new LinkedHashSet<>(builder.classInferenceIgnoreList));
        this.skippedRoles = Collections.unmodifiableSet(new LinkedHashSet<>(builder.skippedRoles));
        this.rolesWithoutArticles = Collections.unmodifiableSet(new LinkedHashSet<>(builder.rolesWithoutArticles));
        this.exactClassLabels = builder.exactClassLabels;
        this.maxRenderDepth = builder.maxRenderDepth;
        this.namespace = builder.namespace;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CnlConfiguration empty() {
        return builder().build();
    }

    public Set<String> getExpertDefinitionProperties() { return expertDefinitionProperties; }
    public Set<String> getStandardRoles() { return standardRoles; }
    public Map<String, TemplateEntry> getExplicitPhrasing() { return explicitPhrasing; }
    public Map<String, String> getReflexiveRolePhrasing() { return reflexiveRolePhrasing; }
    public Set<String> getClassInferenceIgnoreList() { return classInferenceIgnoreList; }
    public Set<String> getSkippedRoles() { return skippedRoles; }
    public Set<String> getRolesWithoutArticles() { return rolesWithoutArticles; }
    public boolean isExactClassLabels() { return exactClassLabels; }
    public int getMaxRenderDepth() { return maxRenderDepth; }
    public String getNamespace() { return namespace; }

    public Optional<TemplateEntry> explicitPhrasingFor(PropertyRef property) {
        TemplateEntry entry = explicitPhrasing.get(property.getIri());
        if (entry == null) {
            entry = explicitPhrasing.get(property.getLocalName());
        }
        return Optional.ofNullable(entry);
    }

    public boolean isStandardRole(PropertyRef property) {
        return matches(standardRoles, property);
    }

    public Optional<String> reflexivePhraseFor(PropertyRef property) {
        String phrase = reflexiveRolePhrasing.get(property.getIri());
        if (phrase == null) {
            phrase = reflexiveRolePhrasing.get(property.getLocalName());
        }
        return Optional.ofNullable(phrase);
    }

    public boolean isSkipped(PropertyRef property) {
        return matches(skippedRoles, property);
    }

    public boolean omitsArticle(PropertyRef property) {
        return matches(rolesWithoutArticles, property);
    }

    /**
     * Whether a class label is too generic to surface in a justification chain (exact match)
     */
    public boolean isIgnoredInference(String classLabel) {
        return classLabel != null && classInferenceIgnoreList.contains(classLabel);
    }

    private static boolean matches(Set<String> keys, PropertyRef property) {
        return keys.contains(property.getIri()) || keys.contains(property.getLocalName());
    }

    @Override
    public String toString() {
        return "CnlConfiguration{" +
                "expertDefinitionProperties=" + expertDefinitionProperties.size() +
                ", standardRoles=" + standardRoles.size() +
                ", explicitPhrasing=" + explicitPhrasing.size() +
                ", reflexiveRoles=" + reflexiveRolePhrasing.size() +
                ", ignoredInferences=" + classInferenceIgnoreList.size() +
                ", skippedRoles=" + skippedRoles.size() +
                ", exactClassLabels=" + exactClassLabels +
                ", maxRenderDepth=" + maxRenderDepth +
                '}';
    }

    public static final class Builder {
        private final Set<String> expertDefinitionProperties = new LinkedHashSet<>();
        private final Set<String> standardRoles = new LinkedHashSet<>();
        private final Map<String, TemplateEntry> explicitPhrasing = new LinkedHashMap<>();
        private final Map<String, String> reflexiveRolePhrasing = new LinkedHashMap<>();
        private final Set<String> classInferenceIgnoreList = new LinkedHashSet<>();
        private final Set<String> skippedRoles = new LinkedHashSet<>();
        private final Set<String> rolesWithoutArticles = new LinkedHashSet<>();
        private boolean exactClassLabels = false;
        private int maxRenderDepth = DEFAULT_MAX_RENDER_DEPTH;
        private String namespace;

        private Builder() {
        }

        public Builder expertDefinitionProperty(String propertyIri) {
            expertDefinitionProperties.add(propertyIri);
            return this;
        }

        public Builder standardRole(String propertyIri) {
            standardRoles.add(propertyIri);
            return this;
        }

        public Builder explicitPhrasing(String propertyIri, TemplateEntry entry) {
            explicitPhrasing.put(propertyIri, entry);
            return this;
        }

        public Builder reflexivePhrase(String propertyIri, String phrase) {
            reflexiveRolePhrasing.put(propertyIri, phrase);
            return this;
        }

        public Builder ignoreInference(String classLabel) {
            classInferenceIgnoreList.add(classLabel);
            return this;
        }

        public Builder skipRole(String role) {
            skippedRoles.add(role);
            return this;
        }

        public Builder roleWithoutArticle(String propertyIri) {
            rolesWithoutArticles.add(propertyIri);
            return this;
        }

        public Builder exactClassLabels(boolean exactClassLabels) {
            this.exactClassLabels = exactClassLabels;
            return this;
        }

        public Builder maxRenderDepth(int maxRenderDepth) {
            if (maxRenderDepth < 1) {
                throw new ConfigException("max render depth must be positive, got " + maxRenderDepth);
            }
            this.maxRenderDepth = maxRenderDepth;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public CnlConfiguration build() {
            return new CnlConfiguration(this);
        }
    }
}
