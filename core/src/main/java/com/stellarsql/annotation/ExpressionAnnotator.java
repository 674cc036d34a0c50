package com.stellarsql.annotation;

import com.stellarsql.exception.ArityMismatchException;
import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.exception.TypeMismatchException;
import com.stellarsql.exception.UnsupportedFeatureException;
import com.stellarsql.exception.UnsupportedFunctionException;
import com.stellarsql.expression.BackendCall;
import com.stellarsql.expression.BackendOperator;
import com.stellarsql.expression.BetweenExpression;
import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.ExistsSubquery;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.ExpressionTransformer;
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
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.functions.FunctionSignature;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.types.BooleanType;
import com.stellarsql.types.CoordinateFrames;
import com.stellarsql.types.DataType;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.IntegerType;
import com.stellarsql.types.LongType;
import com.stellarsql.types.NullType;
import com.stellarsql.types.StringType;
import com.stellarsql.types.TypeInferenceEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resolves column references and types every expression node, bottom-up.
 *
 * <p>Subqueries are handed back to the owning {@link QueryAnnotator} with
 * the current scope as their parent, so correlated references resolve
 * outward.
 */
final class ExpressionAnnotator extends ExpressionTransformer<Scope> {

    private static final FieldInfo BOOLEAN = FieldInfo.of(BooleanType.get());

    private final QueryAnnotator queries;
    private final FunctionRegistry registry;
    private final int maxDepth;
    private int depth;

    ExpressionAnnotator(QueryAnnotator queries, FunctionRegistry registry, int maxDepth) {
        this.queries = queries;
        this.registry = registry;
        this.maxDepth = maxDepth;
    }

    /**
     * Operators and function calls count toward the nesting limit, as they
     * do when the parser builds the tree; trees built by other means get
     * the same bound.
     */
    @Override
    public Expression transform(Expression expr, Scope scope) {
        if (!(expr instanceof BinaryExpression) && !(expr instanceof UnaryExpression)
                && !(expr instanceof FunctionCall) && !(expr instanceof GeometryLiteral)) {
            return super.transform(expr, scope);
        }
        if (++depth > maxDepth) {
            throw new RecursionLimitException(maxDepth, expr.position());
        }
        try {
            return super.transform(expr, scope);
        } finally {
            depth--;
        }
    }

    /**
     * Annotates a search condition and checks that it is boolean.
     *
     * @param condition the condition, may be null
     * @param scope the scope to resolve against
     * @param clause the clause name for error messages
     * @return the annotated condition, or null
     */
    Expression annotateCondition(Expression condition, Scope scope, String clause) {
        if (condition == null) {
            return null;
        }
        Expression annotated = transform(condition, scope);
        DataType type = annotated.dataType();
        if (!(type instanceof BooleanType) && !(type instanceof NullType)) {
            throw new TypeMismatchException(
                clause + " condition must be boolean, not " + type.typeName(),
                condition.position(), condition.toString());
        }
        return annotated;
    }

    @Override
    protected QueryExpression transformQuery(QueryExpression query, Scope scope) {
        return queries.annotate(query, scope);
    }

    // ==================== Leaves ====================

    @Override
    public Expression visitColumnReference(ColumnReference expr, Scope scope) {
        Scope.Resolution resolution = scope.resolve(expr);
        return expr.withBinding(resolution.binding(), resolution.column().info());
    }

    @Override
    public Expression visitLiteral(Literal expr, Scope scope) {
        DataType type;
        switch (expr.kind()) {
            case INTEGER:
                long value = (Long) expr.value();
                type = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE
                    ? IntegerType.get()
                    : LongType.get();
                break;
            case DOUBLE:
                type = DoubleType.get();
                break;
            case STRING:
                type = StringType.get();
                break;
            default:
                type = NullType.get();
                break;
        }
        return expr.withInfo(FieldInfo.of(type));
    }

    // ==================== Functions ====================

    @Override
    public Expression visitFunctionCall(FunctionCall expr, Scope scope) {
        FunctionCall call = (FunctionCall) super.visitFunctionCall(expr, scope);
        String name = call.name();

        List<FunctionSignature> candidates = registry.signatures(name);
        if (candidates.isEmpty()) {
            throw new UnsupportedFunctionException(
                "Unknown function '" + name + "'", call.position(), name);
        }

        int arity = call.arguments().size();
        List<FunctionSignature> shaped = new ArrayList<>();
        for (FunctionSignature candidate : candidates) {
            if (candidate.acceptsStar() == call.star() && candidate.acceptsArity(arity)) {
                shaped.add(candidate);
            }
        }
        if (shaped.isEmpty()) {
            String given = call.star() ? "*" : arity + " argument(s)";
            throw new ArityMismatchException(
                "Function " + name + " cannot be called with " + given, call.position(), name);
        }

        List<DataType> types = new ArrayList<>(arity);
        List<FieldInfo> infos = new ArrayList<>(arity);
        for (Expression argument : call.arguments()) {
            types.add(argument.dataType());
            infos.add(argument.info());
        }
        FunctionSignature signature = null;
        for (FunctionSignature candidate : shaped) {
            if (candidate.accepts(types)) {
                signature = candidate;
                break;
            }
        }
        if (signature == null) {
            String typeNames = types.stream().map(DataType::typeName).collect(Collectors.joining(", "));
            throw new TypeMismatchException(
                "Function " + name + " cannot be applied to (" + typeNames + ")", call.position(), name);
        }
        if (call.distinct() && !signature.isAggregate()) {
            throw new UnsupportedFeatureException(
                "DISTINCT is only allowed in aggregate functions", call.position(), name);
        }
        return call.withSignature(signature, signature.resultInfo(infos));
    }

    // ==================== Operators ====================

    @Override
    public Expression visitBinaryExpression(BinaryExpression expr, Scope scope) {
        BinaryExpression binary = (BinaryExpression) super.visitBinaryExpression(expr, scope);
        FieldInfo left = binary.left().info();
        FieldInfo right = binary.right().info();

        switch (binary.operator()) {
            case AND:
            case OR:
                requireBoolean(binary.left(), binary.operator().name());
                requireBoolean(binary.right(), binary.operator().name());
                return binary.withInfo(BOOLEAN);
            case CONCAT:
                requireString(binary.left(), "||");
                requireString(binary.right(), "||");
                return binary.withInfo(new FieldInfo(StringType.get(), "", "", null));
            default:
                requireNumeric(binary.left(), binary.operator().symbol());
                requireNumeric(binary.right(), binary.operator().symbol());
                DataType type = TypeInferenceEngine.promoteNumericTypes(left.type(), right.type());
                if (type instanceof NullType) {
                    type = DoubleType.get();
                }
                boolean additive = binary.operator() == BinaryExpression.Operator.ADD
                    || binary.operator() == BinaryExpression.Operator.SUBTRACT;
                FieldInfo info = additive
                    ? TypeInferenceEngine.combineAdditive(left, right, type)
                    : TypeInferenceEngine.combineMultiplicative(left, right,
                        binary.operator() == BinaryExpression.Operator.DIVIDE, type);
                return binary.withInfo(info);
        }
    }

    @Override
    public Expression visitUnaryExpression(UnaryExpression expr, Scope scope) {
        UnaryExpression unary = (UnaryExpression) super.visitUnaryExpression(expr, scope);
        if (unary.operator() == UnaryExpression.Operator.NOT) {
            requireBoolean(unary.operand(), "NOT");
            return unary.withInfo(BOOLEAN);
        }
        requireNumeric(unary.operand(), unary.operator().symbol());
        FieldInfo operand = unary.operand().info();
        return unary.withInfo(operand.type() instanceof NullType ? operand.withType(DoubleType.get()) : operand);
    }

    // ==================== Predicates ====================

    @Override
    public Expression visitComparison(Comparison expr, Scope scope) {
        Comparison comparison = (Comparison) super.visitComparison(expr, scope);
        requireComparable(comparison.left(), comparison.right(), comparison.operator().symbol());
        return comparison.withInfo(BOOLEAN);
    }

    @Override
    public Expression visitBetween(BetweenExpression expr, Scope scope) {
        BetweenExpression between = (BetweenExpression) super.visitBetween(expr, scope);
        requireComparable(between.value(), between.low(), "BETWEEN");
        requireComparable(between.value(), between.high(), "BETWEEN");
        return between.withInfo(BOOLEAN);
    }

    @Override
    public Expression visitIn(InExpression expr, Scope scope) {
        InExpression in = (InExpression) super.visitIn(expr, scope);
        for (Expression value : in.values()) {
            requireComparable(in.value(), value, "IN");
        }
        return in.withInfo(BOOLEAN);
    }

    @Override
    public Expression visitInSubquery(InSubquery expr, Scope scope) {
        InSubquery in = (InSubquery) super.visitInSubquery(expr, scope);
        DataType columnType = singleColumnType(in.query(), "IN");
        if (!TypeInferenceEngine.isComparable(in.value().dataType(), columnType)) {
            throw new TypeMismatchException(
                "Cannot compare " + in.value().dataType().typeName() + " with " + columnType.typeName()
                    + " in IN subquery", in.position(), in.value().toString());
        }
        return in.withInfo(BOOLEAN);
    }

    @Override
    public Expression visitLike(LikeExpression expr, Scope scope) {
        LikeExpression like = (LikeExpression) super.visitLike(expr, scope);
        String operator = like.caseInsensitive() ? "ILIKE" : "LIKE";
        requireString(like.value(), operator);
        requireString(like.pattern(), operator);
        return like.withInfo(BOOLEAN);
    }

    @Override
    public Expression visitNullCheck(NullCheck expr, Scope scope) {
        return super.visitNullCheck(expr, scope).withInfo(BOOLEAN);
    }

    @Override
    public Expression visitExists(ExistsSubquery expr, Scope scope) {
        return super.visitExists(expr, scope).withInfo(BOOLEAN);
    }

    @Override
    public Expression visitScalarSubquery(ScalarSubquery expr, Scope scope) {
        ScalarSubquery subquery = (ScalarSubquery) super.visitScalarSubquery(expr, scope);
        singleColumnType(subquery.query(), "Scalar subquery");
        FieldInfo info = subquery.query().outputColumns().get(0).toFieldInfo();
        return subquery.withInfo(info);
    }

    // ==================== Geometry ====================

    @Override
    public Expression visitGeometryLiteral(GeometryLiteral expr, Scope scope) {
        GeometryLiteral geometry = (GeometryLiteral) super.visitGeometryLiteral(expr, scope);
        List<Expression> args = geometry.arguments();
        String name = geometry.shape().name();

        switch (geometry.shape()) {
            case POINT:
                requireArity(geometry, args.size() == 2, "2 coordinates");
                requireAllNumeric(args, name);
                break;
            case CIRCLE:
                if (args.size() == 2) {
                    requirePoint(args.get(0), name);
                    requireNumeric(args.get(1), name);
                } else {
                    requireArity(geometry, args.size() == 3, "a center and a radius");
                    requireAllNumeric(args, name);
                }
                break;
            case BOX:
                if (args.size() == 3) {
                    requirePoint(args.get(0), name);
                    requireAllNumeric(args.subList(1, 3), name);
                } else {
                    requireArity(geometry, args.size() == 4, "a center, a width and a height");
                    requireAllNumeric(args, name);
                }
                break;
            case POLYGON:
                if (!args.isEmpty() && args.get(0).dataType() instanceof GeometryType) {
                    requireArity(geometry, args.size() >= 3, "at least 3 vertices");
                    for (Expression vertex : args) {
                        requirePoint(vertex, name);
                    }
                } else {
                    requireArity(geometry, args.size() >= 6 && args.size() % 2 == 0,
                        "at least 3 vertices");
                    requireAllNumeric(args, name);
                }
                break;
            default:
                requireArity(geometry, args.size() == 1, "one STC-S string");
                requireString(args.get(0), name);
                break;
        }

        String frame = CoordinateFrames.normalize(geometry.coordSys());
        if (frame == null && !args.isEmpty() && args.get(0).dataType() instanceof GeometryType) {
            frame = args.get(0).info().frame();
        }
        return geometry.withInfo(new FieldInfo(GeometryType.of(geometry.shape()), "", "", frame));
    }

    // Backend kinds only appear after morphing; they keep whatever they carry.

    @Override
    public Expression visitGeometryConstant(GeometryConstant expr, Scope scope) {
        return expr;
    }

    @Override
    public Expression visitBackendCall(BackendCall expr, Scope scope) {
        return expr;
    }

    @Override
    public Expression visitBackendOperator(BackendOperator expr, Scope scope) {
        return expr;
    }

    @Override
    public Expression visitTypedLiteral(TypedLiteral expr, Scope scope) {
        return expr;
    }

    @Override
    public Expression visitRawSQL(RawSQLExpression expr, Scope scope) {
        return expr;
    }

    // ==================== Checks ====================

    private DataType singleColumnType(QueryExpression query, String context) {
        if (query.outputColumns().size() != 1) {
            throw new TypeMismatchException(
                context + " must return exactly one column, not " + query.outputColumns().size(),
                query.position(), null);
        }
        return query.outputColumns().get(0).type();
    }

    private static void requireArity(GeometryLiteral geometry, boolean ok, String expected) {
        if (!ok) {
            throw new ArityMismatchException(
                geometry.shape() + " expects " + expected + ", got " + geometry.arguments().size()
                    + " argument(s)",
                geometry.position(), geometry.shape().name());
        }
    }

    private static void requireAllNumeric(List<Expression> args, String context) {
        for (Expression arg : args) {
            requireNumeric(arg, context);
        }
    }

    private static void requireNumeric(Expression expr, String context) {
        DataType type = expr.dataType();
        if (!TypeInferenceEngine.isNumeric(type) && !TypeInferenceEngine.isNull(type)) {
            throw mismatch(expr, context, "a numeric", type);
        }
    }

    private static void requireString(Expression expr, String context) {
        DataType type = expr.dataType();
        if (!TypeInferenceEngine.isString(type) && !TypeInferenceEngine.isNull(type)) {
            throw mismatch(expr, context, "a string", type);
        }
    }

    private static void requireBoolean(Expression expr, String context) {
        DataType type = expr.dataType();
        if (!(type instanceof BooleanType) && !TypeInferenceEngine.isNull(type)) {
            throw mismatch(expr, context, "a boolean", type);
        }
    }

    private static void requirePoint(Expression expr, String context) {
        DataType type = expr.dataType();
        if (!(type instanceof GeometryType && ((GeometryType) type).isPoint())) {
            throw mismatch(expr, context, "a point", type);
        }
    }

    private static void requireComparable(Expression left, Expression right, String context) {
        if (!TypeInferenceEngine.isComparable(left.dataType(), right.dataType())) {
            throw new TypeMismatchException(
                "Cannot compare " + left.dataType().typeName() + " with " + right.dataType().typeName()
                    + " in " + context,
                left.position(), left.toString());
        }
    }

    private static TypeMismatchException mismatch(Expression expr, String context, String expected,
                                                  DataType actual) {
        return new TypeMismatchException(
            context + " expects " + expected + " operand, got " + actual.typeName(),
            expr.position(), expr.toString());
    }
}
