// com/owldsl/expression/ClassExpressionVisitor.java
package com.owldsl.expression;

/**
 * Exhaustive dispatch over the {@link ClassExpression} variants
 *
 * @param <T> result type
 * @param <E> checked exception the visitor may raise
 */
public interface ClassExpressionVisitor<T, E extends Exception> {

    T visit(AtomicClass atomicClass) throws E;

    T visit(Conjunction conjunction) throws E;

    T visit(Disjunction disjunction) throws E;

    T visit(Restriction restriction) throws E;

    T visit(Complement complement) throws E;
}
