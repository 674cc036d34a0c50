package com.stellarsql.parser;

import com.stellarsql.exception.AdqlSyntaxException;
import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.expression.BetweenExpression;
import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.ExistsSubquery;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.InExpression;
import com.stellarsql.expression.InSubquery;
import com.stellarsql.expression.LikeExpression;
import com.stellarsql.expression.Literal;
import com.stellarsql.expression.NullCheck;
import com.stellarsql.expression.ScalarSubquery;
import com.stellarsql.expression.UnaryExpression;
import com.stellarsql.logical.AllColumns;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.DerivedTable;
import com.stellarsql.logical.Join;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.logical.SelectItem;
import com.stellarsql.logical.SelectList;
import com.stellarsql.logical.SetOperation;
import com.stellarsql.logical.SortSpecification;
import com.stellarsql.logical.TableRef;
import com.stellarsql.logical.TableReference;
import com.stellarsql.types.GeometryType;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * ANTLR visitor that builds the query and expression AST from the ADQL
 * parse tree.
 *
 * <p>The builder performs no semantic checks beyond what the tree shape
 * needs: it does not look at the catalog and does not validate function
 * names. Geometry constructors ({@code POINT}, {@code CIRCLE}, {@code BOX},
 * {@code POLYGON}, {@code REGION}) become {@link GeometryLiteral} nodes.
 *
 * <p>Nesting of subqueries, parentheses, function calls and operators is
 * bounded by the configured maximum depth. AND and OR chains become
 * balanced trees, so a long list of conditions only adds the logarithm of
 * its length to the depth.
 */
class AdqlAstBuilder extends AdqlBaseBaseVisitor<Object> {

    private final SourceText source;
    private final int maxDepth;
    private int depth;

    AdqlAstBuilder(SourceText source, int maxDepth) {
        this.source = source;
        this.maxDepth = maxDepth;
    }

    // ==================== Entry Point ====================

    @Override
    public QueryExpression visitSingleStatement(AdqlBaseParser.SingleStatementContext ctx) {
        return query(ctx.queryExpression());
    }

    // ==================== Queries ====================

    @Override
    public QueryExpression visitQueryTermDefault(AdqlBaseParser.QueryTermDefaultContext ctx) {
        return query(ctx.queryTerm());
    }

    @Override
    public QueryExpression visitUnionOrExcept(AdqlBaseParser.UnionOrExceptContext ctx) {
        SetOperation.Kind kind = ctx.operator.getType() == AdqlBaseParser.UNION
            ? SetOperation.Kind.UNION
            : SetOperation.Kind.EXCEPT;
        return new SetOperation(kind, ctx.ALL() != null, query(ctx.left), query(ctx.right), pos(ctx));
    }

    @Override
    public QueryExpression visitQueryPrimaryDefault(AdqlBaseParser.QueryPrimaryDefaultContext ctx) {
        return query(ctx.queryPrimary());
    }

    @Override
    public QueryExpression visitIntersect(AdqlBaseParser.IntersectContext ctx) {
        return new SetOperation(SetOperation.Kind.INTERSECT, ctx.ALL() != null,
            query(ctx.left), query(ctx.right), pos(ctx));
    }

    @Override
    public QueryExpression visitQueryPrimarySpecification(AdqlBaseParser.QueryPrimarySpecificationContext ctx) {
        return query(ctx.querySpecification());
    }

    @Override
    public QueryExpression visitParenthesizedQuery(AdqlBaseParser.ParenthesizedQueryContext ctx) {
        return nested(ctx, () -> query(ctx.queryExpression()));
    }

    @Override
    public QueryExpression visitQuerySpecification(AdqlBaseParser.QuerySpecificationContext ctx) {
        QuerySpecification.Builder builder = QuerySpecification.builder().position(pos(ctx));

        if (ctx.setQuantifier() != null) {
            builder.distinct(ctx.setQuantifier().DISTINCT() != null);
        }
        if (ctx.topClause() != null) {
            builder.top(unsignedInteger(ctx.topClause().UNSIGNED_INTEGER()));
        }
        builder.selectList((SelectList) visit(ctx.selectList()));

        List<TableReference> from = new ArrayList<>();
        for (AdqlBaseParser.TableReferenceContext tableCtx : ctx.fromClause().tableReference()) {
            from.add(table(tableCtx));
        }
        builder.from(from);

        if (ctx.whereClause() != null) {
            builder.where(expr(ctx.whereClause().searchCondition()));
        }
        if (ctx.groupByClause() != null) {
            List<Expression> groupBy = new ArrayList<>();
            for (AdqlBaseParser.ValueExpressionContext keyCtx : ctx.groupByClause().valueExpression()) {
                groupBy.add(expr(keyCtx));
            }
            builder.groupBy(groupBy);
        }
        if (ctx.havingClause() != null) {
            builder.having(expr(ctx.havingClause().searchCondition()));
        }
        if (ctx.orderByClause() != null) {
            List<SortSpecification> orderBy = new ArrayList<>();
            for (AdqlBaseParser.SortSpecificationContext sortCtx : ctx.orderByClause().sortSpecification()) {
                orderBy.add(sortSpecification(sortCtx));
            }
            builder.orderBy(orderBy);
        }
        if (ctx.offsetClause() != null) {
            builder.offset(unsignedInteger(ctx.offsetClause().UNSIGNED_INTEGER()));
        }
        return builder.build();
    }

    private SortSpecification sortSpecification(AdqlBaseParser.SortSpecificationContext ctx) {
        boolean descending = ctx.ordering != null && ctx.ordering.getType() == AdqlBaseParser.DESC;
        Expression key = expr(ctx.valueExpression());
        if (key instanceof Literal && ((Literal) key).kind() == Literal.Kind.INTEGER) {
            long ordinal = (Long) ((Literal) key).value();
            if (ordinal < 1 || ordinal > Integer.MAX_VALUE) {
                throw syntaxError("ORDER BY position out of range: " + ordinal, ctx);
            }
            return SortSpecification.byOrdinal((int) ordinal, descending, key.position());
        }
        return SortSpecification.byExpression(key, descending);
    }

    // ==================== Select List ====================

    @Override
    public SelectList visitSelectAll(AdqlBaseParser.SelectAllContext ctx) {
        return new SelectList(List.of(new AllColumns(null, pos(ctx))));
    }

    @Override
    public SelectList visitSelectSublists(AdqlBaseParser.SelectSublistsContext ctx) {
        List<SelectItem> items = new ArrayList<>();
        for (AdqlBaseParser.SelectSublistContext itemCtx : ctx.selectSublist()) {
            items.add((SelectItem) visit(itemCtx));
        }
        return new SelectList(items);
    }

    @Override
    public SelectItem visitQualifiedAsterisk(AdqlBaseParser.QualifiedAsteriskContext ctx) {
        return new AllColumns(qualifiedName(ctx.qualifiedName()), pos(ctx));
    }

    @Override
    public SelectItem visitDerivedColumn(AdqlBaseParser.DerivedColumnContext ctx) {
        Expression expression = expr(ctx.valueExpression());
        if (ctx.alias == null) {
            return DerivedColumn.of(expression);
        }
        return new DerivedColumn(expression, identifierText(ctx.alias), isDelimited(ctx.alias));
    }

    // ==================== FROM ====================

    @Override
    public TableReference visitTablePrimaryDefault(AdqlBaseParser.TablePrimaryDefaultContext ctx) {
        return table(ctx.tablePrimary());
    }

    @Override
    public TableReference visitCrossJoin(AdqlBaseParser.CrossJoinContext ctx) {
        return new Join(Join.JoinType.CROSS, false, table(ctx.left), table(ctx.right),
            null, null, pos(ctx));
    }

    @Override
    public TableReference visitNaturalJoin(AdqlBaseParser.NaturalJoinContext ctx) {
        return new Join(joinType(ctx.joinType()), true, table(ctx.left), table(ctx.right),
            null, null, pos(ctx));
    }

    @Override
    public TableReference visitQualifiedJoin(AdqlBaseParser.QualifiedJoinContext ctx) {
        Join.JoinType type = joinType(ctx.joinType());
        TableReference left = table(ctx.left);
        TableReference right = table(ctx.right);
        AdqlBaseParser.JoinSpecificationContext spec = ctx.joinSpecification();
        if (spec instanceof AdqlBaseParser.JoinOnContext) {
            Expression condition = expr(((AdqlBaseParser.JoinOnContext) spec).searchCondition());
            return new Join(type, false, left, right, condition, null, pos(ctx));
        }
        List<String> columns = new ArrayList<>();
        for (AdqlBaseParser.IdentifierContext idCtx : ((AdqlBaseParser.JoinUsingContext) spec).identifier()) {
            columns.add(identifierText(idCtx));
        }
        return new Join(type, false, left, right, null, columns, pos(ctx));
    }

    private Join.JoinType joinType(AdqlBaseParser.JoinTypeContext ctx) {
        if (ctx == null || ctx.INNER() != null) {
            return Join.JoinType.INNER;
        }
        switch (ctx.kind.getType()) {
            case AdqlBaseParser.LEFT:
                return Join.JoinType.LEFT;
            case AdqlBaseParser.RIGHT:
                return Join.JoinType.RIGHT;
            default:
                return Join.JoinType.FULL;
        }
    }

    @Override
    public TableReference visitNamedTable(AdqlBaseParser.NamedTableContext ctx) {
        String name = qualifiedName(ctx.qualifiedName());
        if (ctx.alias == null) {
            return new TableRef(name, null, false, pos(ctx));
        }
        return new TableRef(name, identifierText(ctx.alias), isDelimited(ctx.alias), pos(ctx));
    }

    @Override
    public TableReference visitDerivedTable(AdqlBaseParser.DerivedTableContext ctx) {
        QueryExpression query = nested(ctx, () -> query(ctx.subquery().queryExpression()));
        return new DerivedTable(query, identifierText(ctx.alias), isDelimited(ctx.alias), pos(ctx));
    }

    @Override
    public TableReference visitParenthesizedJoin(AdqlBaseParser.ParenthesizedJoinContext ctx) {
        return nested(ctx, () -> table(ctx.tableReference()));
    }

    // ==================== Conditions ====================

    @Override
    public Expression visitSearchCondition(AdqlBaseParser.SearchConditionContext ctx) {
        return connective(ctx, ctx.booleanTerm(), BinaryExpression.Operator.OR);
    }

    @Override
    public Expression visitBooleanTerm(AdqlBaseParser.BooleanTermContext ctx) {
        return connective(ctx, ctx.booleanFactor(), BinaryExpression.Operator.AND);
    }

    /**
     * Builds a balanced tree for a chain of AND or OR operands, keeping
     * their order. The height of the tree counts toward the nesting limit.
     */
    private Expression connective(ParserRuleContext ctx, List<? extends ParserRuleContext> operands,
                                  BinaryExpression.Operator operator) {
        int height = 0;
        for (int width = 1; width < operands.size(); width *= 2) {
            height++;
        }
        if (depth + height > maxDepth) {
            throw new RecursionLimitException(maxDepth, pos(ctx));
        }
        depth += height;
        try {
            List<Expression> level = new ArrayList<>(operands.size());
            for (ParserRuleContext operand : operands) {
                level.add(expr(operand));
            }
            while (level.size() > 1) {
                List<Expression> next = new ArrayList<>((level.size() + 1) / 2);
                for (int i = 0; i + 1 < level.size(); i += 2) {
                    Expression left = level.get(i);
                    next.add(new BinaryExpression(left, operator, level.get(i + 1), left.position()));
                }
                if (level.size() % 2 == 1) {
                    next.add(level.get(level.size() - 1));
                }
                level = next;
            }
            return level.get(0);
        } finally {
            depth -= height;
        }
    }

    @Override
    public Expression visitLogicalNot(AdqlBaseParser.LogicalNotContext ctx) {
        return nested(ctx, () ->
            new UnaryExpression(UnaryExpression.Operator.NOT, expr(ctx.booleanFactor()), pos(ctx)));
    }

    @Override
    public Expression visitBooleanPrimaryDefault(AdqlBaseParser.BooleanPrimaryDefaultContext ctx) {
        return expr(ctx.booleanPrimary());
    }

    @Override
    public Expression visitParenthesizedCondition(AdqlBaseParser.ParenthesizedConditionContext ctx) {
        return nested(ctx, () -> expr(ctx.searchCondition()));
    }

    @Override
    public Expression visitPredicateDefault(AdqlBaseParser.PredicateDefaultContext ctx) {
        return expr(ctx.predicate());
    }

    @Override
    public Expression visitComparisonPredicate(AdqlBaseParser.ComparisonPredicateContext ctx) {
        return new Comparison(expr(ctx.left), comparisonOperator(ctx.compOp()), expr(ctx.right), pos(ctx));
    }

    private Comparison.Operator comparisonOperator(AdqlBaseParser.CompOpContext ctx) {
        if (ctx.EQ() != null) {
            return Comparison.Operator.EQ;
        } else if (ctx.NEQ() != null) {
            return Comparison.Operator.NE;
        } else if (ctx.LT() != null) {
            return Comparison.Operator.LT;
        } else if (ctx.LTE() != null) {
            return Comparison.Operator.LE;
        } else if (ctx.GT() != null) {
            return Comparison.Operator.GT;
        }
        return Comparison.Operator.GE;
    }

    @Override
    public Expression visitBetweenPredicate(AdqlBaseParser.BetweenPredicateContext ctx) {
        return new BetweenExpression(expr(ctx.value), expr(ctx.low), expr(ctx.high),
            ctx.NOT() != null, pos(ctx));
    }

    @Override
    public Expression visitInSubqueryPredicate(AdqlBaseParser.InSubqueryPredicateContext ctx) {
        QueryExpression query = nested(ctx, () -> query(ctx.subquery().queryExpression()));
        return new InSubquery(expr(ctx.value), query, ctx.NOT() != null, pos(ctx));
    }

    @Override
    public Expression visitInListPredicate(AdqlBaseParser.InListPredicateContext ctx) {
        List<AdqlBaseParser.ValueExpressionContext> all = ctx.valueExpression();
        List<Expression> values = new ArrayList<>(all.size() - 1);
        for (int i = 1; i < all.size(); i++) {
            values.add(expr(all.get(i)));
        }
        return new InExpression(expr(ctx.value), values, ctx.NOT() != null, pos(ctx));
    }

    @Override
    public Expression visitLikePredicate(AdqlBaseParser.LikePredicateContext ctx) {
        return new LikeExpression(expr(ctx.value), expr(ctx.pattern), ctx.NOT() != null,
            ctx.kind.getType() == AdqlBaseParser.ILIKE, pos(ctx));
    }

    @Override
    public Expression visitNullPredicate(AdqlBaseParser.NullPredicateContext ctx) {
        return new NullCheck(expr(ctx.value), ctx.NOT() != null, pos(ctx));
    }

    @Override
    public Expression visitExistsPredicate(AdqlBaseParser.ExistsPredicateContext ctx) {
        QueryExpression query = nested(ctx, () -> query(ctx.subquery().queryExpression()));
        return new ExistsSubquery(query, pos(ctx));
    }

    // ==================== Values ====================

    @Override
    public Expression visitValuePrimary(AdqlBaseParser.ValuePrimaryContext ctx) {
        return expr(ctx.primaryExpression());
    }

    @Override
    public Expression visitUnarySign(AdqlBaseParser.UnarySignContext ctx) {
        UnaryExpression.Operator operator = ctx.operator.getType() == AdqlBaseParser.MINUS
            ? UnaryExpression.Operator.NEGATE
            : UnaryExpression.Operator.PLUS;
        return nested(ctx, () -> new UnaryExpression(operator, expr(ctx.valueExpression()), pos(ctx)));
    }

    @Override
    public Expression visitMultiplicative(AdqlBaseParser.MultiplicativeContext ctx) {
        BinaryExpression.Operator operator = ctx.operator.getType() == AdqlBaseParser.ASTERISK
            ? BinaryExpression.Operator.MULTIPLY
            : BinaryExpression.Operator.DIVIDE;
        return nested(ctx, () -> new BinaryExpression(expr(ctx.left), operator, expr(ctx.right), pos(ctx)));
    }

    @Override
    public Expression visitAdditive(AdqlBaseParser.AdditiveContext ctx) {
        BinaryExpression.Operator operator = ctx.operator.getType() == AdqlBaseParser.PLUS
            ? BinaryExpression.Operator.ADD
            : BinaryExpression.Operator.SUBTRACT;
        return nested(ctx, () -> new BinaryExpression(expr(ctx.left), operator, expr(ctx.right), pos(ctx)));
    }

    @Override
    public Expression visitConcatenation(AdqlBaseParser.ConcatenationContext ctx) {
        return nested(ctx, () ->
            new BinaryExpression(expr(ctx.left), BinaryExpression.Operator.CONCAT, expr(ctx.right), pos(ctx)));
    }

    @Override
    public Expression visitLiteralValue(AdqlBaseParser.LiteralValueContext ctx) {
        return expr(ctx.literal());
    }

    @Override
    public Expression visitCountStar(AdqlBaseParser.CountStarContext ctx) {
        String name = identifierText(ctx.identifier());
        return nested(ctx, () -> new FunctionCall(name, Collections.emptyList(), false, true, pos(ctx)));
    }

    @Override
    public Expression visitFunctionCall(AdqlBaseParser.FunctionCallContext ctx) {
        String name = identifierText(ctx.identifier()).toUpperCase(Locale.ROOT);
        return nested(ctx, () -> {
            List<Expression> args = new ArrayList<>();
            for (AdqlBaseParser.ValueExpressionContext argCtx : ctx.valueExpression()) {
                args.add(expr(argCtx));
            }
            boolean distinct = ctx.setQuantifier() != null && ctx.setQuantifier().DISTINCT() != null;
            GeometryType.Shape shape = geometryShape(name);
            if (shape != null && !isDelimited(ctx.identifier())) {
                if (distinct) {
                    throw syntaxError("DISTINCT is not allowed in " + name, ctx);
                }
                return geometryLiteral(shape, args, ctx);
            }
            return new FunctionCall(name, args, distinct, false, pos(ctx));
        });
    }

    private Expression geometryLiteral(GeometryType.Shape shape, List<Expression> args,
                                       ParserRuleContext ctx) {
        String coordSys = null;
        List<Expression> coordinates = args;
        if (shape != GeometryType.Shape.REGION && !args.isEmpty()
                && args.get(0) instanceof Literal
                && ((Literal) args.get(0)).kind() == Literal.Kind.STRING) {
            coordSys = (String) ((Literal) args.get(0)).value();
            coordinates = args.subList(1, args.size());
        }
        return new GeometryLiteral(shape, coordSys, coordinates, pos(ctx));
    }

    private static GeometryType.Shape geometryShape(String name) {
        switch (name) {
            case "POINT":
                return GeometryType.Shape.POINT;
            case "CIRCLE":
                return GeometryType.Shape.CIRCLE;
            case "BOX":
                return GeometryType.Shape.BOX;
            case "POLYGON":
                return GeometryType.Shape.POLYGON;
            case "REGION":
                return GeometryType.Shape.REGION;
            default:
                return null;
        }
    }

    @Override
    public Expression visitColumnReference(AdqlBaseParser.ColumnReferenceContext ctx) {
        List<AdqlBaseParser.IdentifierContext> parts = ctx.qualifiedName().identifier();
        AdqlBaseParser.IdentifierContext last = parts.get(parts.size() - 1);
        String qualifier = null;
        if (parts.size() > 1) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < parts.size() - 1; i++) {
                if (i > 0) {
                    sb.append('.');
                }
                sb.append(identifierText(parts.get(i)));
            }
            qualifier = sb.toString();
        }
        return new ColumnReference(qualifier, identifierText(last), isDelimited(last), pos(ctx));
    }

    @Override
    public Expression visitScalarSubquery(AdqlBaseParser.ScalarSubqueryContext ctx) {
        QueryExpression query = nested(ctx, () -> query(ctx.subquery().queryExpression()));
        return new ScalarSubquery(query, pos(ctx));
    }

    @Override
    public Expression visitParenthesizedExpression(AdqlBaseParser.ParenthesizedExpressionContext ctx) {
        return nested(ctx, () -> expr(ctx.valueExpression()));
    }

    // ==================== Literals ====================

    @Override
    public Expression visitIntegerLiteral(AdqlBaseParser.IntegerLiteralContext ctx) {
        String text = ctx.getText();
        try {
            return Literal.ofLong(Long.parseLong(text), pos(ctx));
        } catch (NumberFormatException e) {
            // beyond BIGINT: keep the value as an approximate number
            return Literal.ofDouble(Double.parseDouble(text), pos(ctx));
        }
    }

    @Override
    public Expression visitDecimalLiteral(AdqlBaseParser.DecimalLiteralContext ctx) {
        return Literal.ofDouble(Double.parseDouble(ctx.getText()), pos(ctx));
    }

    @Override
    public Expression visitStringLiteral(AdqlBaseParser.StringLiteralContext ctx) {
        StringBuilder value = new StringBuilder();
        for (TerminalNode part : ctx.STRING_LITERAL()) {
            String text = part.getText();
            value.append(text, 1, text.length() - 1);
        }
        return Literal.ofString(value.toString().replace("''", "'"), pos(ctx));
    }

    @Override
    public Expression visitNullLiteral(AdqlBaseParser.NullLiteralContext ctx) {
        return Literal.ofNull(pos(ctx));
    }

    // ==================== Helpers ====================

    private QueryExpression query(ParserRuleContext ctx) {
        return (QueryExpression) visit(ctx);
    }

    private TableReference table(ParserRuleContext ctx) {
        return (TableReference) visit(ctx);
    }

    private Expression expr(ParserRuleContext ctx) {
        return (Expression) visit(ctx);
    }

    private <T> T nested(ParserRuleContext ctx, Supplier<T> body) {
        if (++depth > maxDepth) {
            throw new RecursionLimitException(maxDepth, pos(ctx));
        }
        try {
            return body.get();
        } finally {
            depth--;
        }
    }

    private SourcePosition pos(ParserRuleContext ctx) {
        return source.position(ctx.getStart());
    }

    private String qualifiedName(AdqlBaseParser.QualifiedNameContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (AdqlBaseParser.IdentifierContext part : ctx.identifier()) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(identifierText(part));
        }
        return sb.toString();
    }

    private static String identifierText(AdqlBaseParser.IdentifierContext ctx) {
        if (ctx instanceof AdqlBaseParser.DelimitedIdentifierContext) {
            String text = ctx.getText();
            return text.substring(1, text.length() - 1).replace("\"\"", "\"");
        }
        return ctx.getText();
    }

    private static boolean isDelimited(AdqlBaseParser.IdentifierContext ctx) {
        return ctx instanceof AdqlBaseParser.DelimitedIdentifierContext;
    }

    private Long unsignedInteger(TerminalNode node) {
        try {
            return Long.parseLong(node.getText());
        } catch (NumberFormatException e) {
            throw new AdqlSyntaxException("Integer out of range: " + node.getText(),
                source.position(node.getSymbol()), node.getText(), List.of());
        }
    }

    private AdqlSyntaxException syntaxError(String message, ParserRuleContext ctx) {
        return new AdqlSyntaxException(message, pos(ctx), ctx.getText(), List.of());
    }
}
