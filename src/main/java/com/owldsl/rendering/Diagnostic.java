// com/owldsl/rendering/Diagnostic.java
package com.owldsl.rendering;

import java.util.Objects;

/**
 * Advisory note attached to a rendering. Diagnostics never stop a rendering; they tell curators
 * where the output is best-effort.
 */
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String subject;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String subject, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = subject;
        this.message = message;
    }

    public static Diagnostic unconfigured(String propertyIri) {
        return new Diagnostic(DiagnosticKind.UNCONFIGURED_PROPERTY, propertyIri,
                "No phrasing configured for " + propertyIri + "; using the raw property label");
    }

    public static Diagnostic from(RenderingException e) {
        DiagnosticKind kind = e.getKind() == RenderingErrorKind.DEPTH_EXCEEDED
                ? DiagnosticKind.DEPTH_TRUNCATED
                : DiagnosticKind.UNRESOLVED_PROPERTY;
        return new Diagnostic(kind, e.getPropertyIri(), e.getMessage());
    }

    public DiagnosticKind getKind() { return kind; }

    /**
     * IRI of the property or class the note is about (may be null)
     */
    public String getSubject() { return subject; }

    public String getMessage() { return message; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Diagnostic that = (Diagnostic) obj;
        return kind == that.kind && Objects.equals(subject, that.subject) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, message);
    }

    @Override
    public String toString() {
        return kind + (subject != null ? "[" + subject + "]" : "") + ": " + message;
    }
}
