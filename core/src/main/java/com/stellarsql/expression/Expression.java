package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.DataType;
import com.stellarsql.types.FieldInfo;

import java.util.List;

/**
 * Base interface for all value expressions of a compiled query.
 *
 * <p>Expressions form immutable trees. Each compiler stage returns a new
 * tree; children are owned by their parent and there are no parent links.
 * Context a stage needs from enclosing nodes is passed down through the
 * visitor's context argument.
 *
 * <p>The parser produces the ADQL kinds; the annotator fills in
 * {@link #info()}; the morpher replaces the ADQL-specific kinds
 * (geometry constructors and functions) with the backend kinds
 * {@link BackendCall}, {@link BackendOperator}, {@link TypedLiteral} and
 * {@link RawSQLExpression}.
 *
 * <p>{@code equals} and {@code hashCode} are structural and ignore both the
 * source position and the annotation, so two occurrences of {@code t.ra + 1}
 * compare equal wherever they were written.
 */
public sealed interface Expression
    permits ColumnReference, Literal, FunctionCall, BinaryExpression, UnaryExpression,
            Comparison, BetweenExpression, InExpression, InSubquery, LikeExpression,
            NullCheck, ExistsSubquery, ScalarSubquery, GeometryLiteral, GeometryConstant,
            BackendCall, BackendOperator, TypedLiteral, RawSQLExpression {

    /**
     * Returns where this expression starts in the query text.
     *
     * @return the source position, {@link SourcePosition#UNKNOWN} for synthesized nodes
     */
    SourcePosition position();

    /**
     * Returns the metadata attached by the annotator.
     *
     * @return the field info, or null before annotation
     */
    FieldInfo info();

    /**
     * Returns a copy of this expression carrying the given metadata.
     *
     * @param info the field info
     * @return the annotated copy
     */
    Expression withInfo(FieldInfo info);

    /**
     * Returns the direct sub-expressions, in evaluation order. Subqueries are
     * not expressions and are not included.
     *
     * @return the children
     */
    List<Expression> children();

    <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);

    /**
     * Returns the resolved data type.
     *
     * @return the type, or null before annotation
     */
    default DataType dataType() {
        FieldInfo info = info();
        return info == null ? null : info.type();
    }
}
