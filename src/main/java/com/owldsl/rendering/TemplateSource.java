// com/owldsl/rendering/TemplateSource.java
package com.owldsl.rendering;

/**
 * Where the phrase template of a property came from
 */
public enum TemplateSource {
    EXPLICIT("explicit"),
    STANDARD("standard"),
    UNCONFIGURED("unconfigured");

    private final String displayName;

    TemplateSource(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
