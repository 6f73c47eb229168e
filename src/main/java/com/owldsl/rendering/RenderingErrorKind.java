// com/owldsl/rendering/RenderingErrorKind.java
package com.owldsl.rendering;

/**
 * Recoverable failures of a single rendering call
 */
public enum RenderingErrorKind {
    DEPTH_EXCEEDED("Depth exceeded"),
    UNRESOLVED_PROPERTY("Unresolved property");

    private final String displayName;

    RenderingErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
