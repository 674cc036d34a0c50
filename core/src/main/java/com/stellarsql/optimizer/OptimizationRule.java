package com.stellarsql.optimizer;

import com.stellarsql.logical.QueryExpression;

/**
 * Interface for postprocessing rules.
 *
 * <p>A rule rewrites an annotated query into an equivalent one that is
 * simpler to translate. Rules are applied repeatedly by the
 * {@link Postprocessor} until none of them changes the tree, so a rule
 * must reach a point where it returns its input unchanged.
 *
 * <p>Rules must preserve query semantics and the annotation: every node a
 * rule creates carries the {@code FieldInfo} of the node it replaces.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to a query.
     *
     * @param query the annotated query
     * @return the rewritten query, or the same instance if nothing applied
     */
    QueryExpression apply(QueryExpression query);

    /**
     * Returns the name of this rule, for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
