// com/owldsl/expression/Complement.java
package com.owldsl.expression;

import java.util.Objects;

/**
 * Logical NOT of a single operand
 */
public final class Complement extends ClassExpression {

    private final ClassExpression operand;

    public Complement(ClassExpression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public ClassExpression getOperand() { return operand; }

    @Override
    public <T, E extends Exception> T accept(ClassExpressionVisitor<T, E> visitor) throws E {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return operand.equals(((Complement) obj).operand);
    }

    @Override
    public int hashCode() {
        return operand.hashCode() * 31 + 3;
    }

    @Override
    public String toString() {
        return "¬" + operand;
    }
}
