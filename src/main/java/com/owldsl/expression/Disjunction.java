// com/owldsl/expression/Disjunction.java
package com.owldsl.expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical OR of an ordered sequence of operands
 */
public final class Disjunction extends ClassExpression {

    private final List<ClassExpression> operands;

    public Disjunction(List<? extends ClassExpression> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("A disjunction needs at least one operand");
        }
        this.operands = List.copyOf(operands);
    }

    public static Disjunction of(ClassExpression... operands) {
        return new Disjunction(List.of(operands));
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
        return operands.equals(((Disjunction) obj).operands);
    }

    @Override
    public int hashCode() {
        return operands.hashCode() * 31 + 2;
    }

    @Override
    public String toString() {
        return operands.stream().map(ClassExpression::toString).collect(Collectors.joining(" ⊔ ", "(", ")"));
    }
}
