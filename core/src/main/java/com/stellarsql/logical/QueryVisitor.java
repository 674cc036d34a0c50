package com.stellarsql.logical;

/**
 * Visitor over the two query kinds.
 *
 * @param <R> the result type
 * @param <C> the context passed down the traversal
 */
public interface QueryVisitor<R, C> {

    R visitQuerySpecification(QuerySpecification query, C context);

    R visitSetOperation(SetOperation query, C context);
}
