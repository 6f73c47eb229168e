// com/owldsl/rendering/RenderingException.java
package com.owldsl.rendering;

/**
 * Raised when an expression cannot be rendered. The caller decides whether to skip the
 * offending part, truncate, or drop the whole class.
 */
public class RenderingException extends Exception {

    private final RenderingErrorKind kind;
    private final String propertyIri;

    public RenderingException(RenderingErrorKind kind, String propertyIri, String message) {
        super(message);
        this.kind = kind;
        this.propertyIri = propertyIri;
    }

    public static RenderingException depthExceeded(int maxDepth) {
        return new RenderingException(RenderingErrorKind.DEPTH_EXCEEDED, null,
                "Expression nesting exceeds the maximum render depth of " + maxDepth);
    }

    public static RenderingException unresolvedProperty(String propertyIri) {
        return new RenderingException(RenderingErrorKind.UNRESOLVED_PROPERTY, propertyIri,
                "Property " + propertyIri + " has no label and no configured phrasing");
    }

    public RenderingErrorKind getKind() {
        return kind;
    }

    /**
     * IRI of the offending property, or null when the failure is not tied to one
     */
    public String getPropertyIri() {
        return propertyIri;
    }
}
