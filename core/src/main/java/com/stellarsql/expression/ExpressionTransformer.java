package com.stellarsql.expression;

import com.stellarsql.logical.QueryExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for bottom-up expression rewrites.
 *
 * <p>Each visit method transforms the children first and rebuilds the node
 * only if a child changed, so an untouched subtree is returned as the same
 * instance. Subclasses override the visits for the kinds they rewrite,
 * usually calling {@code super} first to get the node with rewritten
 * children. Subqueries are handed to {@link #transformQuery}, which leaves
 * them alone unless overridden.
 *
 * @param <C> the context passed down the traversal
 */
public abstract class ExpressionTransformer<C> implements ExpressionVisitor<Expression, C> {

    public Expression transform(Expression expr, C context) {
        return expr == null ? null : expr.accept(this, context);
    }

    /**
     * Transforms a subquery nested in an expression.
     *
     * @param query the subquery
     * @param context the traversal context
     * @return the transformed subquery
     */
    protected QueryExpression transformQuery(QueryExpression query, C context) {
        return query;
    }

    protected List<Expression> transformAll(List<Expression> exprs, C context) {
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transform(original, context);
            if (transformed != original && result == null) {
                result = new ArrayList<>(exprs.subList(0, i));
            }
            if (result != null) {
                result.add(transformed);
            }
        }
        return result == null ? exprs : result;
    }

    @Override
    public Expression visitColumnReference(ColumnReference expr, C context) {
        return expr;
    }

    @Override
    public Expression visitLiteral(Literal expr, C context) {
        return expr;
    }

    @Override
    public Expression visitFunctionCall(FunctionCall expr, C context) {
        List<Expression> args = transformAll(expr.arguments(), context);
        return args == expr.arguments() ? expr : expr.withArguments(args);
    }

    @Override
    public Expression visitBinaryExpression(BinaryExpression expr, C context) {
        Expression left = transform(expr.left(), context);
        Expression right = transform(expr.right(), context);
        return left == expr.left() && right == expr.right() ? expr : expr.withOperands(left, right);
    }

    @Override
    public Expression visitUnaryExpression(UnaryExpression expr, C context) {
        Expression operand = transform(expr.operand(), context);
        return operand == expr.operand() ? expr : expr.withOperand(operand);
    }

    @Override
    public Expression visitComparison(Comparison expr, C context) {
        Expression left = transform(expr.left(), context);
        Expression right = transform(expr.right(), context);
        return left == expr.left() && right == expr.right() ? expr : expr.withOperands(left, right);
    }

    @Override
    public Expression visitBetween(BetweenExpression expr, C context) {
        Expression value = transform(expr.value(), context);
        Expression low = transform(expr.low(), context);
        Expression high = transform(expr.high(), context);
        if (value == expr.value() && low == expr.low() && high == expr.high()) {
            return expr;
        }
        return expr.withOperands(value, low, high);
    }

    @Override
    public Expression visitIn(InExpression expr, C context) {
        Expression value = transform(expr.value(), context);
        List<Expression> values = transformAll(expr.values(), context);
        return value == expr.value() && values == expr.values() ? expr : expr.withOperands(value, values);
    }

    @Override
    public Expression visitInSubquery(InSubquery expr, C context) {
        Expression value = transform(expr.value(), context);
        QueryExpression query = transformQuery(expr.query(), context);
        InSubquery result = value == expr.value() ? expr : expr.withValue(value);
        return query == expr.query() ? result : result.withQuery(query);
    }

    @Override
    public Expression visitLike(LikeExpression expr, C context) {
        Expression value = transform(expr.value(), context);
        Expression pattern = transform(expr.pattern(), context);
        return value == expr.value() && pattern == expr.pattern() ? expr : expr.withOperands(value, pattern);
    }

    @Override
    public Expression visitNullCheck(NullCheck expr, C context) {
        Expression value = transform(expr.value(), context);
        return value == expr.value() ? expr : expr.withValue(value);
    }

    @Override
    public Expression visitExists(ExistsSubquery expr, C context) {
        QueryExpression query = transformQuery(expr.query(), context);
        return query == expr.query() ? expr : expr.withQuery(query);
    }

    @Override
    public Expression visitScalarSubquery(ScalarSubquery expr, C context) {
        QueryExpression query = transformQuery(expr.query(), context);
        return query == expr.query() ? expr : expr.withQuery(query);
    }

    @Override
    public Expression visitGeometryLiteral(GeometryLiteral expr, C context) {
        List<Expression> args = transformAll(expr.arguments(), context);
        return args == expr.arguments() ? expr : expr.withArguments(args);
    }

    @Override
    public Expression visitGeometryConstant(GeometryConstant expr, C context) {
        return expr;
    }

    @Override
    public Expression visitBackendCall(BackendCall expr, C context) {
        List<Expression> args = transformAll(expr.arguments(), context);
        return args == expr.arguments() ? expr : expr.withArguments(args);
    }

    @Override
    public Expression visitBackendOperator(BackendOperator expr, C context) {
        List<Expression> operands = transformAll(expr.operands(), context);
        return operands == expr.operands() ? expr : expr.withOperands(operands);
    }

    @Override
    public Expression visitTypedLiteral(TypedLiteral expr, C context) {
        return expr;
    }

    @Override
    public Expression visitRawSQL(RawSQLExpression expr, C context) {
        List<Expression> args = transformAll(expr.arguments(), context);
        return args == expr.arguments() ? expr : expr.withArguments(args);
    }
}
