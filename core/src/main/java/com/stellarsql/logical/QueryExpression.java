package com.stellarsql.logical;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.schema.OutputColumn;

import java.util.List;

/**
 * A complete query: a single {@link QuerySpecification} or a
 * {@link SetOperation} combining two queries.
 *
 * <p>Queries are immutable. The annotator returns copies that carry their
 * {@link #outputColumns()}; the morpher returns copies in which the row
 * limit is expressed as {@link #limit()}.
 */
public sealed interface QueryExpression permits QuerySpecification, SetOperation {

    SourcePosition position();

    /**
     * Returns the result columns computed by the annotator.
     *
     * @return the output columns, empty before annotation
     */
    List<OutputColumn> outputColumns();

    /**
     * Returns the native row limit set by the morpher.
     *
     * @return the limit, or null if none
     */
    Long limit();

    /**
     * Returns the number of rows to skip.
     *
     * @return the offset, or null if none
     */
    Long offset();

    <R, C> R accept(QueryVisitor<R, C> visitor, C context);
}
