// com/owldsl/processing/ClassRenderResult.java
package com.owldsl.processing;

import com.owldsl.definition.ClassDefinition;
import com.owldsl.expression.AtomicClass;

/**
 * Outcome of rendering one class in a batch: either a definition or the reason it failed.
 */
public class ClassRenderResult {

    private final AtomicClass atomicClass;
    private final ClassDefinition definition;
    private final String error;

    private ClassRenderResult(AtomicClass atomicClass, ClassDefinition definition, String error) {
        this.atomicClass = atomicClass;
        this.definition = definition;
        this.error = error;
    }

    public static ClassRenderResult success(AtomicClass atomicClass, ClassDefinition definition) {
        return new ClassRenderResult(atomicClass, definition, null);
    }

    public static ClassRenderResult failure(AtomicClass atomicClass, String error) {
        return new ClassRenderResult(atomicClass, null, error);
    }

    public AtomicClass getAtomicClass() { return atomicClass; }

    /**
     * Null when rendering failed
     */
    public ClassDefinition getDefinition() { return definition; }

    public String getError() { return error; }

    public boolean isSuccess() {
        return definition != null;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ClassRenderResult{" + atomicClass.getIri() + ", ok}"
                : "ClassRenderResult{" + atomicClass.getIri() + ", error='" + error + "'}";
    }
}
