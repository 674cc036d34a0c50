package com.stellarsql.morph;

import com.stellarsql.logical.QueryExpression;

/**
 * Rewrites an annotated query into a tree a SQL backend can execute
 * directly: no ADQL geometry, no pseudo-boolean predicates, no TOP.
 */
public interface Morpher {

    /**
     * Morphs an annotated query.
     *
     * @param annotated the annotator's output
     * @return the backend-ready query
     * @throws com.stellarsql.exception.UnsupportedFeatureException for ADQL
     *         the backend cannot express
     * @throws com.stellarsql.exception.InternalMorphException if the tree
     *         is not a valid annotated tree
     */
    QueryExpression morph(QueryExpression annotated);
}
