// com/owldsl/expression/Conjunction.java
package com.owldsl.expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical AND of an ordered sequence of operands. Operand order is kept as given by the source.
 */
public final class Conjunction extends ClassExpression {

    private final List<ClassExpression> operands;

    public Conjunction(List<? extends ClassExpression> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("A conjunction needs at least one operand");
        }
        this.operands = List.copyOf(operands);
    }

    public static Conjunction of(ClassExpression... operands) {
        return new Conjunction(List.of(operands));
    }

    public List<ClassExpression> getOperands() { return operands; }

    @Override
    public <T, E extends Exception> T accept(ClassExpressionVisitor<T, E> visitor) throws E {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return operands.equals(((Conjunction) obj).operands);
    }

    @Override
    public int hashCode() {
        return operands.hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
        return operands.stream().map(ClassExpression::toString).collect(Collectors.joining(" ⊓ ", "(", ")"));
    }
}
