package com.stellarsql.generator;

import com.stellarsql.exception.InternalMorphException;
import com.stellarsql.expression.BackendCall;
import com.stellarsql.expression.BackendOperator;
import com.stellarsql.expression.BetweenExpression;
import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.ExistsSubquery;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.ExpressionVisitor;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.expression.GeometryConstant;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.InExpression;
import com.stellarsql.expression.InSubquery;
import com.stellarsql.expression.LikeExpression;
import com.stellarsql.expression.Literal;
import com.stellarsql.expression.NullCheck;
import com.stellarsql.expression.RawSQLExpression;
import com.stellarsql.expression.ScalarSubquery;
import com.stellarsql.expression.TypedLiteral;
import com.stellarsql.expression.UnaryExpression;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.DerivedTable;
import com.stellarsql.logical.Join;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.logical.QueryVisitor;
import com.stellarsql.logical.SelectItem;
import com.stellarsql.logical.SetOperation;
import com.stellarsql.logical.SortSpecification;
import com.stellarsql.logical.TableRef;
import com.stellarsql.logical.TableReference;
import com.stellarsql.logical.TableReferenceVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.stellarsql.generator.SQLQuoting.formatValue;
import static com.stellarsql.generator.SQLQuoting.quoteIdentifier;
import static com.stellarsql.generator.SQLQuoting.quoteIdentifierIfNeeded;
import static com.stellarsql.generator.SQLQuoting.quoteLiteral;
import static com.stellarsql.generator.SQLQuoting.quoteQualifiedName;

/**
 * SQL generator that renders a morphed query tree as PostgreSQL text.
 *
 * <p>Literal values become bound parameters, numbered in the order their
 * placeholders appear in the text. NULL, typed literals, ordinals and the
 * arguments of raw fragments marked for inlining are written into the text
 * instead, and so are the literals of any expression equal to a GROUP BY
 * key of its SELECT block. {@code LIMIT} and {@code OFFSET} values are bound.
 *
 * <p>Arithmetic and boolean connectives are always parenthesized, so the
 * output never depends on operator precedence.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExpression morphed = morpher.morph(annotated.query());
 *   GeneratedSQL sql = new SQLGenerator(ParameterStyle.POSITIONAL).generate(morphed);
 * </pre>
 *
 * <p>The generator holds no per-query state, so one instance may be shared
 * between threads.
 */
public class SQLGenerator {

    private final ParameterStyle parameterStyle;

    /**
     * Creates a generator that writes JDBC-style {@code ?} placeholders.
     */
    public SQLGenerator() {
        this(ParameterStyle.POSITIONAL);
    }

    public SQLGenerator(ParameterStyle parameterStyle) {
        this.parameterStyle = Objects.requireNonNull(parameterStyle, "parameterStyle must not be null");
    }

    public ParameterStyle parameterStyle() {
        return parameterStyle;
    }

    /**
     * Generates SQL for a morphed query.
     *
     * @param query a query produced by the morpher
     * @return the SQL text with its parameters
     * @throws InternalMorphException if the tree still holds nodes the
     *         morpher should have replaced
     */
    public GeneratedSQL generate(QueryExpression query) {
        Objects.requireNonNull(query, "query must not be null");
        Emitter emitter = new Emitter();
        emitter.query(query);
        return new GeneratedSQL(emitter.sql.toString(), emitter.parameters, parameterStyle);
    }

    /**
     * Generates SQL for a single morphed expression. Used for diagnostics
     * and tests.
     */
    public GeneratedSQL generate(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        Emitter emitter = new Emitter();
        emitter.expr(expression);
        return new GeneratedSQL(emitter.sql.toString(), emitter.parameters, parameterStyle);
    }

    /** Rendering state for one statement. */
    private final class Emitter implements ExpressionVisitor<Void, Void>,
            QueryVisitor<Void, Void>, TableReferenceVisitor<Void, Void> {

        private final StringBuilder sql = new StringBuilder();
        private final List<Object> parameters = new ArrayList<>();
        private int inlineDepth;
        private List<Expression> groupKeys = List.of();

        void query(QueryExpression query) {
            query.accept(this, null);
        }

        // PostgreSQL matches grouped expressions textually, and two placeholders
        // never match, so a grouping key is always written with its literals.
        void expr(Expression expression) {
            if (inlineDepth > 0 || groupKeys.isEmpty() || !groupKeys.contains(expression)) {
                expression.accept(this, null);
                return;
            }
            inlineDepth++;
            try {
                expression.accept(this, null);
            } finally {
                inlineDepth--;
            }
        }

        private void bind(Object value) {
            if (inlineDepth > 0) {
                sql.append(formatValue(value));
                return;
            }
            parameters.add(value);
            sql.append(parameterStyle.placeholder(parameters.size()));
        }

        private void exprList(List<Expression> expressions) {
            for (int i = 0; i < expressions.size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                expr(expressions.get(i));
            }
        }

        private void subquery(QueryExpression query) {
            sql.append('(');
            query(query);
            sql.append(')');
        }

        // ==================== Queries ====================

        @Override
        public Void visitQuerySpecification(QuerySpecification spec, Void context) {
            List<Expression> outerKeys = groupKeys;
            groupKeys = spec.groupBy();
            try {
                specification(spec);
            } finally {
                groupKeys = outerKeys;
            }
            return null;
        }

        private void specification(QuerySpecification spec) {
            sql.append("SELECT ");
            if (spec.distinct()) {
                sql.append("DISTINCT ");
            }
            List<Expression> selected = new ArrayList<>();
            List<SelectItem> items = spec.selectList().items();
            for (int i = 0; i < items.size(); i++) {
                if (!(items.get(i) instanceof DerivedColumn)) {
                    throw new InternalMorphException("Unexpanded wildcard reached SQL generation",
                        items.get(i).position());
                }
                DerivedColumn item = (DerivedColumn) items.get(i);
                if (i > 0) {
                    sql.append(", ");
                }
                expr(item.expression());
                if (item.alias() != null) {
                    sql.append(" AS ").append(quoteIdentifier(item.alias()));
                }
                selected.add(item.expression());
            }

            if (!spec.from().isEmpty()) {
                sql.append(" FROM ");
                for (int i = 0; i < spec.from().size(); i++) {
                    if (i > 0) {
                        sql.append(", ");
                    }
                    spec.from().get(i).accept(this, null);
                }
            }
            if (spec.where() != null) {
                sql.append(" WHERE ");
                expr(spec.where());
            }
            if (!spec.groupBy().isEmpty()) {
                sql.append(" GROUP BY ");
                for (int i = 0; i < spec.groupBy().size(); i++) {
                    if (i > 0) {
                        sql.append(", ");
                    }
                    keyOrOrdinal(spec.groupBy().get(i), selected);
                }
            }
            if (spec.having() != null) {
                sql.append(" HAVING ");
                expr(spec.having());
            }
            orderBy(spec.orderBy(), selected);
            limitOffset(spec.limit(), spec.offset());
        }

        // A key written like a select item refers to it by position, so the
        // database sees one expression instead of two with separate parameters.
        private void keyOrOrdinal(Expression key, List<Expression> selected) {
            int index = selected.indexOf(key);
            if (index >= 0) {
                sql.append(index + 1);
            } else {
                expr(key);
            }
        }

        private void orderBy(List<SortSpecification> sorts, List<Expression> selected) {
            if (sorts.isEmpty()) {
                return;
            }
            sql.append(" ORDER BY ");
            for (int i = 0; i < sorts.size(); i++) {
                SortSpecification sort = sorts.get(i);
                if (i > 0) {
                    sql.append(", ");
                }
                if (sort.isOrdinal()) {
                    sql.append(sort.ordinal());
                } else {
                    keyOrOrdinal(sort.key(), selected);
                }
                if (sort.descending()) {
                    sql.append(" DESC");
                }
            }
        }

        private void limitOffset(Long limit, Long offset) {
            if (limit != null) {
                sql.append(" LIMIT ");
                bind(limit);
            }
            if (offset != null) {
                sql.append(" OFFSET ");
                bind(offset);
            }
        }

        @Override
        public Void visitSetOperation(SetOperation op, Void context) {
            operand(op.left(), op, true);
            sql.append(' ').append(op.kind().name());
            if (op.all()) {
                sql.append(" ALL");
            }
            sql.append(' ');
            operand(op.right(), op, false);
            orderBy(op.orderBy(), List.of());
            limitOffset(op.limit(), op.offset());
            return null;
        }

        private void operand(QueryExpression operand, SetOperation parent, boolean leftSide) {
            if (needsParentheses(operand, parent, leftSide)) {
                subquery(operand);
            } else {
                query(operand);
            }
        }

        private boolean needsParentheses(QueryExpression operand, SetOperation parent, boolean leftSide) {
            if (operand.limit() != null || operand.offset() != null) {
                return true;
            }
            if (operand instanceof QuerySpecification) {
                return !((QuerySpecification) operand).orderBy().isEmpty();
            }
            SetOperation nested = (SetOperation) operand;
            return !leftSide || !nested.orderBy().isEmpty() || nested.kind() != parent.kind() || nested.all() != parent.all();
        }

        // ==================== Tables ====================

        @Override
        public Void visitTable(TableRef table, Void context) {
            sql.append(quoteQualifiedName(table.name()));
            if (table.alias() != null) {
                sql.append(" AS ").append(quoteIdentifierIfNeeded(table.alias()));
            }
            return null;
        }

        @Override
        public Void visitDerivedTable(DerivedTable table, Void context) {
            subquery(table.query());
            sql.append(" AS ").append(quoteIdentifierIfNeeded(table.alias()));
            return null;
        }

        @Override
        public Void visitJoin(Join join, Void context) {
            joinOperand(join.left());
            sql.append(' ');
            if (join.natural()) {
                sql.append("NATURAL ");
            }
            sql.append(join.joinType().sql()).append(' ');
            joinOperand(join.right());
            if (join.condition() != null) {
                sql.append(" ON ");
                expr(join.condition());
            } else if (!join.usingColumns().isEmpty()) {
                sql.append(" USING (");
                for (int i = 0; i < join.usingColumns().size(); i++) {
                    if (i > 0) {
                        sql.append(", ");
                    }
                    sql.append(quoteIdentifierIfNeeded(join.usingColumns().get(i)));
                }
                sql.append(')');
            }
            return null;
        }

        private void joinOperand(TableReference table) {
            if (table instanceof Join) {
                sql.append('(');
                table.accept(this, null);
                sql.append(')');
            } else {
                table.accept(this, null);
            }
        }

        // ==================== Expressions ====================

        @Override
        public Void visitColumnReference(ColumnReference expr, Void context) {
            if (expr.qualifier() != null) {
                sql.append(quoteQualifiedName(expr.qualifier())).append('.');
            }
            sql.append(expr.delimited() ? quoteIdentifier(expr.name()) : quoteIdentifierIfNeeded(expr.name()));
            return null;
        }

        @Override
        public Void visitLiteral(Literal expr, Void context) {
            if (expr.isNull()) {
                sql.append("NULL");
            } else {
                bind(expr.value());
            }
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall expr, Void context) {
            throw unmorphed(expr, "function call " + expr.name());
        }

        @Override
        public Void visitBinaryExpression(BinaryExpression expr, Void context) {
            sql.append('(');
            expr(expr.left());
            sql.append(' ').append(expr.operator().symbol()).append(' ');
            expr(expr.right());
            sql.append(')');
            return null;
        }

        @Override
        public Void visitUnaryExpression(UnaryExpression expr, Void context) {
            sql.append('(').append(expr.operator().symbol());
            expr(expr.operand());
            sql.append(')');
            return null;
        }

        @Override
        public Void visitComparison(Comparison expr, Void context) {
            expr(expr.left());
            sql.append(' ').append(expr.operator().symbol()).append(' ');
            expr(expr.right());
            return null;
        }

        @Override
        public Void visitBetween(BetweenExpression expr, Void context) {
            expr(expr.value());
            sql.append(expr.negated() ? " NOT BETWEEN " : " BETWEEN ");
            expr(expr.low());
            sql.append(" AND ");
            expr(expr.high());
            return null;
        }

        @Override
        public Void visitIn(InExpression expr, Void context) {
            expr(expr.value());
            sql.append(expr.negated() ? " NOT IN (" : " IN (");
            exprList(expr.values());
            sql.append(')');
            return null;
        }

        @Override
        public Void visitInSubquery(InSubquery expr, Void context) {
            expr(expr.value());
            sql.append(expr.negated() ? " NOT IN " : " IN ");
            subquery(expr.query());
            return null;
        }

        @Override
        public Void visitLike(LikeExpression expr, Void context) {
            expr(expr.value());
            if (expr.negated()) {
                sql.append(" NOT");
            }
            sql.append(expr.caseInsensitive() ? " ILIKE " : " LIKE ");
            expr(expr.pattern());
            return null;
        }

        @Override
        public Void visitNullCheck(NullCheck expr, Void context) {
            expr(expr.value());
            sql.append(expr.negated() ? " IS NOT NULL" : " IS NULL");
            return null;
        }

        @Override
        public Void visitExists(ExistsSubquery expr, Void context) {
            sql.append("EXISTS ");
            subquery(expr.query());
            return null;
        }

        @Override
        public Void visitScalarSubquery(ScalarSubquery expr, Void context) {
            subquery(expr.query());
            return null;
        }

        @Override
        public Void visitGeometryLiteral(GeometryLiteral expr, Void context) {
            throw unmorphed(expr, "geometry constructor " + expr.shape());
        }

        @Override
        public Void visitGeometryConstant(GeometryConstant expr, Void context) {
            throw unmorphed(expr, "geometry constant " + expr.shape());
        }

        @Override
        public Void visitBackendCall(BackendCall expr, Void context) {
            sql.append(expr.name()).append('(');
            exprList(expr.arguments());
            sql.append(')');
            return null;
        }

        @Override
        public Void visitBackendOperator(BackendOperator expr, Void context) {
            sql.append('(');
            if (expr.isPrefix()) {
                sql.append(expr.symbol()).append(' ');
                expr(expr.operands().get(0));
            } else {
                expr(expr.operands().get(0));
                sql.append(' ').append(expr.symbol()).append(' ');
                expr(expr.operands().get(1));
            }
            sql.append(')');
            return null;
        }

        @Override
        public Void visitTypedLiteral(TypedLiteral expr, Void context) {
            sql.append(expr.typeName()).append(' ').append(quoteLiteral(expr.text()));
            return null;
        }

        @Override
        public Void visitRawSQL(RawSQLExpression expr, Void context) {
            String template = expr.template();
            if (expr.inlineLiterals()) {
                inlineDepth++;
            }
            try {
                int i = 0;
                while (i < template.length()) {
                    char c = template.charAt(i);
                    int close = c == '{' ? template.indexOf('}', i) : -1;
                    if (close > i + 1 && isDigits(template, i + 1, close)) {
                        int index = Integer.parseInt(template.substring(i + 1, close));
                        if (index >= expr.arguments().size()) {
                            throw new InternalMorphException(
                                "Template placeholder {" + index + "} has no argument: " + template,
                                expr.position());
                        }
                        expr(expr.arguments().get(index));
                        i = close + 1;
                    } else {
                        sql.append(c);
                        i++;
                    }
                }
            } finally {
                if (expr.inlineLiterals()) {
                    inlineDepth--;
                }
            }
            return null;
        }

        private boolean isDigits(String text, int from, int to) {
            for (int i = from; i < to; i++) {
                if (!Character.isDigit(text.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        private InternalMorphException unmorphed(Expression expr, String what) {
            return new InternalMorphException("Unmorphed " + what + " reached SQL generation",
                expr.position());
        }
    }
}
