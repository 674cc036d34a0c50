package com.stellarsql.expression;

/**
 * Visitor over every expression kind.
 *
 * <p>Adding an expression kind adds a method here, which breaks every
 * implementation until it handles the new kind.
 *
 * @param <R> the result type
 * @param <C> the context passed down the traversal
 */
public interface ExpressionVisitor<R, C> {

    R visitColumnReference(ColumnReference expr, C context);

    R visitLiteral(Literal expr, C context);

    R visitFunctionCall(FunctionCall expr, C context);

    R visitBinaryExpression(BinaryExpression expr, C context);

    R visitUnaryExpression(UnaryExpression expr, C context);

    R visitComparison(Comparison expr, C context);

    R visitBetween(BetweenExpression expr, C context);

    R visitIn(InExpression expr, C context);

    R visitInSubquery(InSubquery expr, C context);

    R visitLike(LikeExpression expr, C context);

    R visitNullCheck(NullCheck expr, C context);

    R visitExists(ExistsSubquery expr, C context);

    R visitScalarSubquery(ScalarSubquery expr, C context);

    R visitGeometryLiteral(GeometryLiteral expr, C context);

    R visitGeometryConstant(GeometryConstant expr, C context);

    R visitBackendCall(BackendCall expr, C context);

    R visitBackendOperator(BackendOperator expr, C context);

    R visitTypedLiteral(TypedLiteral expr, C context);

    R visitRawSQL(RawSQLExpression expr, C context);
}
