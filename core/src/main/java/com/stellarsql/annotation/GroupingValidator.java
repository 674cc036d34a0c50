package com.stellarsql.annotation;

import com.stellarsql.exception.GroupingException;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.Join;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.logical.SelectItem;
import com.stellarsql.logical.SortSpecification;
import com.stellarsql.logical.TableReference;

import java.util.List;

/**
 * Checks aggregate placement and GROUP BY coverage of an annotated SELECT
 * block.
 *
 * <p>Aggregates may not appear in WHERE, GROUP BY or join conditions, nor
 * inside another aggregate. In a grouped query, every select item, the
 * HAVING condition and every ORDER BY key must be a grouping key, an
 * aggregate, or built from those and constants. Subqueries are checked on
 * their own level.
 */
final class GroupingValidator {

    private GroupingValidator() {
        // Utility class - prevent instantiation
    }

    static void validate(QuerySpecification spec) {
        rejectAggregates(spec.where(), "WHERE");
        for (Expression key : spec.groupBy()) {
            rejectAggregates(key, "GROUP BY");
        }
        for (TableReference table : spec.from()) {
            rejectAggregatesInJoins(table);
        }

        boolean aggregated = false;
        for (SelectItem item : spec.selectList().items()) {
            Expression expression = ((DerivedColumn) item).expression();
            rejectNestedAggregates(expression);
            aggregated |= containsAggregate(expression);
        }
        if (spec.having() != null) {
            rejectNestedAggregates(spec.having());
        }

        boolean grouped = aggregated || !spec.groupBy().isEmpty() || spec.having() != null;
        if (!grouped) {
            return;
        }
        List<Expression> keys = spec.groupBy();
        for (SelectItem item : spec.selectList().items()) {
            requireGrouped(((DerivedColumn) item).expression(), keys, "select list");
        }
        if (spec.having() != null) {
            requireGrouped(spec.having(), keys, "HAVING");
        }
        for (SortSpecification sort : spec.orderBy()) {
            if (!sort.isOrdinal()) {
                requireGrouped(sort.key(), keys, "ORDER BY");
            }
        }
    }

    static boolean isAggregate(Expression expr) {
        return expr instanceof FunctionCall
            && ((FunctionCall) expr).signature() != null
            && ((FunctionCall) expr).signature().isAggregate();
    }

    static boolean containsAggregate(Expression expr) {
        if (expr == null) {
            return false;
        }
        if (isAggregate(expr)) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (containsAggregate(child)) {
                return true;
            }
        }
        return false;
    }

    private static void rejectAggregates(Expression expr, String clause) {
        if (containsAggregate(expr)) {
            throw new GroupingException(
                "Aggregate functions are not allowed in " + clause, expr.position(), expr.toString());
        }
    }

    private static void rejectAggregatesInJoins(TableReference table) {
        if (table instanceof Join) {
            Join join = (Join) table;
            rejectAggregates(join.condition(), "JOIN conditions");
            rejectAggregatesInJoins(join.left());
            rejectAggregatesInJoins(join.right());
        }
    }

    private static void rejectNestedAggregates(Expression expr) {
        if (isAggregate(expr)) {
            for (Expression argument : expr.children()) {
                if (containsAggregate(argument)) {
                    throw new GroupingException(
                        "Aggregate function calls cannot be nested", argument.position(), argument.toString());
                }
            }
            return;
        }
        for (Expression child : expr.children()) {
            rejectNestedAggregates(child);
        }
    }

    private static void requireGrouped(Expression expr, List<Expression> keys, String clause) {
        if (keys.contains(expr) || isAggregate(expr)) {
            return;
        }
        if (expr instanceof ColumnReference) {
            ColumnReference ref = (ColumnReference) expr;
            // references to an enclosing query are constants here
            if (ref.binding() != null && ref.binding().scopeDepth() > 0) {
                return;
            }
            throw new GroupingException(
                "Column '" + ref + "' in the " + clause
                    + " must appear in the GROUP BY clause or be used in an aggregate function",
                ref.position(), ref.toString());
        }
        for (Expression child : expr.children()) {
            requireGrouped(child, keys, clause);
        }
    }
}
