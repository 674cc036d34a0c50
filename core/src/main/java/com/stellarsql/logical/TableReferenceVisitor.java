package com.stellarsql.logical;

/**
 * Visitor over FROM-clause items.
 *
 * @param <R> the result type
 * @param <C> the context passed down the traversal
 */
public interface TableReferenceVisitor<R, C> {

    R visitTable(TableRef table, C context);

    R visitDerivedTable(DerivedTable table, C context);

    R visitJoin(Join join, C context);
}
