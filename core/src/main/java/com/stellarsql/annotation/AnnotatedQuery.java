package com.stellarsql.annotation;

import com.stellarsql.logical.QueryExpression;
import com.stellarsql.schema.OutputColumn;

import java.util.List;
import java.util.Objects;

/**
 * The annotator's result: a tree in which every column reference is bound
 * and every expression typed, the output schema, and the version of the
 * catalog snapshot it was checked against.
 *
 * @param query the annotated query
 * @param outputColumns the result columns, in select-list order
 * @param catalogVersion the snapshot version the annotation is valid for
 */
public record AnnotatedQuery(QueryExpression query, List<OutputColumn> outputColumns, long catalogVersion) {

    public AnnotatedQuery {
        Objects.requireNonNull(query, "query");
        outputColumns = List.copyOf(outputColumns);
    }
}
