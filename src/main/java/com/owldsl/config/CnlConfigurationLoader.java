// com/owldsl/config/CnlConfigurationLoader.java
package com.owldsl.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.owldsl.rendering.TemplateEntry;
import com.owldsl.util.URIUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the CNL phrase configuration (YAML) into an immutable {@link CnlConfiguration}.
 * Any structural problem is reported as a {@link ConfigException}.
 */
public class CnlConfigurationLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CnlConfigurationLoader.class);

    static final String TOOLING = "tooling";
    static final String EXPERT_DEFINITION_PROPERTIES = "expert_definition_properties";
    static final String NAMESPACE = "namespace";
    static final String STANDARD_ROLES = "standard_role_restriction_is_phrasing";
    static final String ROLE_PHRASING = "role_restriction_phrasing";
    static final String REFLEXIVE_ROLES = "reflexive_roles";
    static final String IGNORED_INFERENCES = "class_inference_to_ignore";
    static final String SKIP = "skip";
    static final String ROLES_WITHOUT_ARTICLES = "roles_without_articles";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(TOOLING, STANDARD_ROLES, ROLE_PHRASING,
            REFLEXIVE_ROLES, IGNORED_INFERENCES, SKIP, ROLES_WITHOUT_ARTICLES);
    private static final Set<String> TOOLING_KEYS = Set.of(EXPERT_DEFINITION_PROPERTIES, NAMESPACE);

    private final ObjectMapper yamlMapper = new YAMLMapper();

    private String defaultNamespace;
    private boolean exactClassLabels = false;
    private int maxRenderDepth = CnlConfiguration.DEFAULT_MAX_RENDER_DEPTH;

    public CnlConfigurationLoader withDefaultNamespace(String namespace) {
        this.defaultNamespace = namespace;
        return this;
    }

    public CnlConfigurationLoader withExactClassLabels(boolean exactClassLabels) {
        this.exactClassLabels = exactClassLabels;
        return this;
    }

    public CnlConfigurationLoader withMaxRenderDepth(int maxRenderDepth) {
        this.maxRenderDepth = maxRenderDepth;
        return this;
    }

    public CnlConfiguration load(Path path) {
        LOGGER.info("Loading CNL configuration from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigException("Could not read CNL configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public CnlConfiguration load(InputStream in) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigException("Malformed CNL configuration: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    public CnlConfiguration parse(String yaml) {
        try {
            return fromTree(yamlMapper.readTree(yaml));
        } catch (IOException e) {
            throw new ConfigException("Malformed CNL configuration: " + e.getMessage(), e);
        }
    }

    CnlConfiguration fromTree(JsonNode root) {
        CnlConfiguration.Builder builder = CnlConfiguration.builder()
                .exactClassLabels(exactClassLabels)
                .maxRenderDepth(maxRenderDepth);

        if (root == null || root.isNull() || root.isMissingNode()) {
            LOGGER.warn("CNL configuration is empty; every property will use the fallback phrasing");
            return builder.namespace(defaultNamespace).build();
        }
        if (!root.isObject()) {
            throw new ConfigException("CNL configuration must be a mapping, found " + root.getNodeType());
        }
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!TOP_LEVEL_KEYS.contains(key)) {
                throw new ConfigException("Unknown CNL configuration key '" + key + "'");
            }
        }

        String namespace = defaultNamespace;
        JsonNode tooling = root.get(TOOLING);
        List<String> expertProperties = new ArrayList<>();
        if (tooling != null && !tooling.isNull()) {
            if (!tooling.isObject()) {
                throw new ConfigException("'" + TOOLING + "' must be a mapping");
            }
            for (Iterator<String> it = tooling.fieldNames(); it.hasNext(); ) {
                String key = it.next();
                if (!TOOLING_KEYS.contains(key)) {
                    throw new ConfigException("Unknown key '" + key + "' under '" + TOOLING + "'");
                }
            }
            JsonNode ns = tooling.get(NAMESPACE);
            if (ns != null && !ns.isNull()) {
                namespace = requireText(ns, TOOLING + "." + NAMESPACE);
            }
            expertProperties.addAll(stringList(tooling.get(EXPERT_DEFINITION_PROPERTIES),
                    TOOLING + "." + EXPERT_DEFINITION_PROPERTIES));
        }
        builder.namespace(namespace);

        for (String property : expertProperties) {
            builder.expertDefinitionProperty(URIUtils.resolve(property, namespace));
        }
        for (String role : stringList(root.get(STANDARD_ROLES), STANDARD_ROLES)) {
            builder.standardRole(URIUtils.resolve(role, namespace));
        }
        readExplicitPhrasing(root.get(ROLE_PHRASING), namespace, builder);
        readReflexiveRoles(root.get(REFLEXIVE_ROLES), namespace, builder);
        for (String label : stringList(root.get(IGNORED_INFERENCES), IGNORED_INFERENCES)) {
            builder.ignoreInference(label);
        }
        // skipped roles are matched by IRI or by local name, so both spellings are kept
        for (String role : stringList(root.get(SKIP), SKIP)) {
            builder.skipRole(role);
            builder.skipRole(URIUtils.resolve(role, namespace));
        }
        for (String role : stringList(root.get(ROLES_WITHOUT_ARTICLES), ROLES_WITHOUT_ARTICLES)) {
            builder.roleWithoutArticle(URIUtils.resolve(role, namespace));
        }

        CnlConfiguration configuration = builder.build();
        LOGGER.info("Loaded {}", configuration);
        return configuration;
    }

    private void readExplicitPhrasing(JsonNode node, String namespace, CnlConfiguration.Builder builder) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigException("'" + ROLE_PHRASING + "' must be a mapping of property to phrases");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String property = field.getKey();
            List<String> phrases = stringList(field.getValue(), ROLE_PHRASING + "." + property);
            builder.explicitPhrasing(URIUtils.resolve(property, namespace), toTemplateEntry(property, phrases));
        }
    }

    /**
     * Two phrases mean (singular and plural, prompt); three mean (singular, plural, prompt)
     */
    static TemplateEntry toTemplateEntry(String property, List<String> phrases) {
        TemplateEntry entry;
        if (phrases.size() == 2) {
            entry = new TemplateEntry(phrases.get(0), phrases.get(0), phrases.get(1));
        } else if (phrases.size() == 3) {
            entry = new TemplateEntry(phrases.get(0), phrases.get(1), phrases.get(2));
        } else {
            throw new ConfigException("Phrasing for '" + property + "' must have 2 or 3 entries, found "
                    + phrases.size());
        }
        requirePlaceholder(property, entry.getSingular());
        requirePlaceholder(property, entry.getPlural());
        requirePlaceholder(property, entry.getDefinitionPrompt());
        return entry;
    }

    private static void requirePlaceholder(String property, String phrase) {
        if (!phrase.contains(TemplateEntry.PLACEHOLDER)) {
            throw new ConfigException("Phrase '" + phrase + "' for '" + property + "' has no "
                    + TemplateEntry.PLACEHOLDER + " placeholder");
        }
    }

    private void readReflexiveRoles(JsonNode node, String namespace, CnlConfiguration.Builder builder) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isArray()) {
            throw new ConfigException("'" + REFLEXIVE_ROLES + "' must be a sequence of single-entry mappings");
        }
        for (JsonNode item : node) {
            if (!item.isObject() || item.size() != 1) {
                throw new ConfigException("Each '" + REFLEXIVE_ROLES + "' item must map one property to its phrase");
            }
            Map.Entry<String, JsonNode> field = item.fields().next();
            JsonNode value = field.getValue();
            String phrase;
            if (value.isTextual()) {
                phrase = value.asText();
            } else {
                List<String> phrases = stringList(value, REFLEXIVE_ROLES + "." + field.getKey());
                if (phrases.size() != 1) {
                    throw new ConfigException("Reflexive phrasing for '" + field.getKey()
                            + "' must have exactly one phrase, found " + phrases.size());
                }
                phrase = phrases.get(0);
            }
            builder.reflexivePhrase(URIUtils.resolve(field.getKey(), namespace), phrase);
        }
    }

    private static List<String> stringList(JsonNode node, String key) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isArray()) {
            throw new ConfigException("'" + key + "' must be a sequence, found " + node.getNodeType());
        }
        for (JsonNode item : node) {
            values.add(requireText(item, key));
        }
        return values;
    }

    private static String requireText(JsonNode node, String key) {
        if (!node.isTextual()) {
            throw new ConfigException("'" + key + "' must contain strings, found " + node.getNodeType());
        }
        return node.asText();
    }
}
