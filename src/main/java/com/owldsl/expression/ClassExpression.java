// com/owldsl/expression/ClassExpression.java
package com.owldsl.expression;

/**
 * A Description Logic class expression: an atomic class, a conjunction, a disjunction,
 * a role restriction or a complement. Consumers dispatch over the variants with a
 * {@link ClassExpressionVisitor}, so every variant has to be handled explicitly.
 */
public abstract class ClassExpression {

    ClassExpression() {
    }

    public abstract <T, E extends Exception> T accept(ClassExpressionVisitor<T, E> visitor) throws E;

    public boolean isAtomic() {
        return false;
    }

    public AtomicClass asAtomic() {
        throw new IllegalStateException("Not an atomic class: " + this);
    }
}
