// com/owldsl/rendering/DiagnosticKind.java
package com.owldsl.rendering;

public enum DiagnosticKind {
    UNCONFIGURED_PROPERTY,
    UNRESOLVED_PROPERTY,
    DEPTH_TRUNCATED,
    SKIPPED_PROPERTY
}
