package com.stellarsql.optimizer;

import com.stellarsql.expression.ExpressionTransformer;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QueryRewriter;

/**
 * Base class for rules that rewrite expressions one node at a time.
 *
 * <p>The rule is applied to every expression of the query, including those
 * of derived tables and of subqueries nested in expressions.
 */
public abstract class ExpressionRewriteRule extends ExpressionTransformer<Void> implements OptimizationRule {

    @Override
    public QueryExpression apply(QueryExpression query) {
        return QueryRewriter.rewriteExpressions(query, expr -> transform(expr, null));
    }

    @Override
    protected QueryExpression transformQuery(QueryExpression query, Void context) {
        return apply(query);
    }
}
