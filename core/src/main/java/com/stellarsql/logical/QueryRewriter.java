package com.stellarsql.logical;

import com.stellarsql.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Applies an expression rewrite to every clause of a query.
 *
 * <p>Visits the select list, join conditions, WHERE, GROUP BY, HAVING and
 * ORDER BY of each SELECT block, descending into set-operation operands and
 * derived tables. Subqueries nested inside expressions are left to the
 * rewrite function itself. Unchanged queries come back as the same
 * instance.
 */
public final class QueryRewriter {

    private QueryRewriter() {
        // Utility class - prevent instantiation
    }

    public static QueryExpression rewriteExpressions(QueryExpression query, UnaryOperator<Expression> rewrite) {
        if (query instanceof SetOperation) {
            SetOperation setOp = (SetOperation) query;
            QueryExpression left = rewriteExpressions(setOp.left(), rewrite);
            QueryExpression right = rewriteExpressions(setOp.right(), rewrite);
            return left == setOp.left() && right == setOp.right() ? setOp : setOp.withOperands(left, right);
        }
        QuerySpecification spec = (QuerySpecification) query;
        boolean changed = false;

        List<SelectItem> items = new ArrayList<>(spec.selectList().size());
        for (SelectItem item : spec.selectList().items()) {
            SelectItem rewritten = item;
            if (item instanceof DerivedColumn) {
                DerivedColumn column = (DerivedColumn) item;
                rewritten = column.withExpression(rewrite.apply(column.expression()));
            }
            changed |= rewritten != item;
            items.add(rewritten);
        }

        List<TableReference> from = new ArrayList<>(spec.from().size());
        for (TableReference table : spec.from()) {
            TableReference rewritten = rewriteTable(table, rewrite);
            changed |= rewritten != table;
            from.add(rewritten);
        }

        Expression where = apply(spec.where(), rewrite);
        List<Expression> groupBy = new ArrayList<>(spec.groupBy().size());
        for (Expression key : spec.groupBy()) {
            Expression rewritten = rewrite.apply(key);
            changed |= rewritten != key;
            groupBy.add(rewritten);
        }
        Expression having = apply(spec.having(), rewrite);

        List<SortSpecification> orderBy = new ArrayList<>(spec.orderBy().size());
        for (SortSpecification sort : spec.orderBy()) {
            SortSpecification rewritten = sort.isOrdinal() ? sort : sort.withKey(rewrite.apply(sort.key()));
            changed |= rewritten != sort;
            orderBy.add(rewritten);
        }

        changed |= where != spec.where() || having != spec.having();
        if (!changed) {
            return spec;
        }
        return spec.toBuilder()
            .selectList(new SelectList(items))
            .from(from)
            .where(where)
            .groupBy(groupBy)
            .having(having)
            .orderBy(orderBy)
            .build();
    }

    private static TableReference rewriteTable(TableReference table, UnaryOperator<Expression> rewrite) {
        if (table instanceof DerivedTable) {
            DerivedTable derived = (DerivedTable) table;
            QueryExpression query = rewriteExpressions(derived.query(), rewrite);
            return query == derived.query() ? derived : derived.withQuery(query);
        }
        if (table instanceof Join) {
            Join join = (Join) table;
            TableReference left = rewriteTable(join.left(), rewrite);
            TableReference right = rewriteTable(join.right(), rewrite);
            Expression condition = apply(join.condition(), rewrite);
            if (left == join.left() && right == join.right() && condition == join.condition()) {
                return join;
            }
            return join.withChildren(left, right, condition);
        }
        return table;
    }

    private static Expression apply(Expression expr, UnaryOperator<Expression> rewrite) {
        return expr == null ? null : rewrite.apply(expr);
    }
}
