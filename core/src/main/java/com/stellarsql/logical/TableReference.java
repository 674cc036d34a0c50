package com.stellarsql.logical;

import com.stellarsql.parser.SourcePosition;

/**
 * An item of a FROM clause: a catalog table, a derived table or a join.
 */
public sealed interface TableReference permits TableRef, DerivedTable, Join {

    SourcePosition position();

    <R, C> R accept(TableReferenceVisitor<R, C> visitor, C context);
}
