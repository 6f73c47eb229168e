// com/owldsl/rendering/TemplateResolution.java
package com.owldsl.rendering;

import java.util.Objects;

/**
 * A resolved template and the rule that produced it
 */
public final class TemplateResolution {

    private final TemplateEntry entry;
    private final TemplateSource source;

    public TemplateResolution(TemplateEntry entry, TemplateSource source) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.source = Objects.requireNonNull(source, "source");
    }

    public TemplateEntry getEntry() { return entry; }
    public TemplateSource getSource() { return source; }

    public boolean isUnconfigured() {
        return source == TemplateSource.UNCONFIGURED;
    }

    @Override
    public String toString() {
        return source.getDisplayName() + " " + entry;
    }
}
