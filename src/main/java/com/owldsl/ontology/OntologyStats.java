// com/owldsl/ontology/OntologyStats.java
package com.owldsl.ontology;

/**
 * Statistics about an ontology
 */
public class OntologyStats {
    private final int classCount;
    private final int labelledClassCount;
    private final int objectPropertyCount;
    private final int axiomCount;

    public OntologyStats(int classCount, int labelledClassCount, int objectPropertyCount, int axiomCount) {
        this.classCount = classCount;
        this.labelledClassCount = labelledClassCount;
        this.objectPropertyCount = objectPropertyCount;
        this.axiomCount = axiomCount;
    }

    public int getClassCount() { return classCount; }
    public int getLabelledClassCount() { return labelledClassCount; }
    public int getObjectPropertyCount() { return objectPropertyCount; }
    public int getAxiomCount() { return axiomCount; }

    @Override
    public String toString() {
        return String.format("OntologyStats{classes=%d, labelledClasses=%d, objectProperties=%d, axioms=%d}",
                classCount, labelledClassCount, objectPropertyCount, axiomCount);
    }
}
