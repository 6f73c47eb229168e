// com/owldsl/rendering/RenderResult.java
package com.owldsl.rendering;

import java.util.List;
import java.util.Objects;

/**
 * Rendered text together with the advisory diagnostics collected while producing it
 */
public final class RenderResult {

    private final String text;
    private final List<Diagnostic> diagnostics;

    public RenderResult(String text, List<Diagnostic> diagnostics) {
        this.text = Objects.requireNonNull(text, "text");
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static RenderResult of(String text) {
        return new RenderResult(text, List.of());
    }

    public String getText() { return text; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.getKind() == kind);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        RenderResult that = (RenderResult) obj;
        return text.equals(that.text) && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, diagnostics);
    }

    @Override
    public String toString() {
        return text;
    }
}
