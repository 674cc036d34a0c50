package com.stellarsql.morph;

import com.stellarsql.catalog.TableMeta;
import com.stellarsql.exception.InternalMorphException;
import com.stellarsql.exception.UnsupportedFeatureException;
import com.stellarsql.expression.BackendCall;
import com.stellarsql.expression.BackendOperator;
import com.stellarsql.expression.ColumnBinding;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.ExpressionTransformer;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.expression.GeometryConstant;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.Literal;
import com.stellarsql.expression.RawSQLExpression;
import com.stellarsql.expression.TypedLiteral;
import com.stellarsql.expression.UnaryExpression;
import com.stellarsql.functions.BackendTranslation;
import com.stellarsql.functions.FunctionSignature;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.BooleanType;
import com.stellarsql.types.CoordinateFrames;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.GeometryType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites annotated expressions into PostgreSQL/pgSphere form.
 *
 * <p>Geometry constructors become pgSphere constructor calls (positions
 * converted from degrees to radians), constant geometries become pgSphere
 * typed literals, the 0/1-valued geometry predicates become boolean
 * operators, and functions follow their registry translation. Column
 * references get their backend spelling and qualifier.
 */
final class ExpressionMorpher extends ExpressionTransformer<RangeContext> {

    private static final FieldInfo BOOLEAN = FieldInfo.of(BooleanType.get());
    private static final FieldInfo DOUBLE = FieldInfo.of(DoubleType.get());

    /** Square degrees per steradian. */
    private static final String SQUARE_DEGREES_PER_STERADIAN = "3282.806350011744";

    private final PgSphereMorpher queries;
    private final boolean q3cEnabled;
    private final CoordinateConversionRegistry conversions;

    ExpressionMorpher(PgSphereMorpher queries, boolean q3cEnabled, CoordinateConversionRegistry conversions) {
        this.queries = queries;
        this.q3cEnabled = q3cEnabled;
        this.conversions = conversions;
    }

    @Override
    protected QueryExpression transformQuery(QueryExpression query, RangeContext context) {
        return queries.morphQuery(query, context, false);
    }

    // ==================== Columns ====================

    @Override
    public Expression visitColumnReference(ColumnReference expr, RangeContext context) {
        ColumnBinding binding = expr.binding();
        if (binding == null) {
            throw new InternalMorphException("Unresolved column reference '" + expr + "'", expr.position());
        }
        String qualifier = null;
        if (binding.rangeName() != null) {
            qualifier = context.lookup(binding.rangeName(), binding.scopeDepth(), expr.position()).emittedName();
        }
        String name = IdentifierNormalizer.normalize(binding.columnName(), binding.caseSensitive());
        return new ColumnReference(qualifier, name, binding.caseSensitive(), expr.position())
            .withBinding(binding, expr.info());
    }

    // ==================== Functions ====================

    @Override
    public Expression visitFunctionCall(FunctionCall expr, RangeContext context) {
        FunctionSignature signature = expr.signature();
        if (signature == null) {
            throw new InternalMorphException("Unresolved function call '" + expr.name() + "'", expr.position());
        }
        BackendTranslation translation = signature.translation();
        switch (translation.kind()) {
            case UNSUPPORTED:
                throw new UnsupportedFeatureException(translation.target(), expr.position(), expr.toString());
            case MORPHER:
                return morphGeometryFunction(expr, context);
            case TEMPLATE:
                return new RawSQLExpression(translation.target(), transformAll(expr.arguments(), context),
                    false, expr.info(), expr.position());
            default:
                return renamedCall(expr, translation.target(), transformAll(expr.arguments(), context));
        }
    }

    private static Expression renamedCall(FunctionCall expr, String name, List<Expression> arguments) {
        if (expr.star()) {
            return new RawSQLExpression(name + "(*)", List.of(), false, expr.info(), expr.position());
        }
        if (expr.distinct()) {
            return new RawSQLExpression(name + "(DISTINCT " + placeholders(arguments.size()) + ")",
                arguments, false, expr.info(), expr.position());
        }
        return new BackendCall(name, arguments, expr.info(), expr.position());
    }

    private Expression morphGeometryFunction(FunctionCall expr, RangeContext context) {
        switch (expr.name()) {
            case "CONTAINS":
            case "INTERSECTS":
                return new RawSQLExpression("(CASE WHEN {0} THEN 1 ELSE 0 END)",
                    List.of(predicate(expr, context)), false, expr.info(), expr.position());
            case "DISTANCE":
                return distance(expr, context);
            case "AREA":
                return new RawSQLExpression("(" + SQUARE_DEGREES_PER_STERADIAN + " * area({0}))",
                    List.of(transform(expr.argument(0), context)), false, expr.info(), expr.position());
            case "CENTROID":
                return new BackendOperator("@@", List.of(transform(expr.argument(0), context)),
                    expr.info(), expr.position());
            case "COORD1":
                return degrees("long", transform(expr.argument(0), context), expr);
            case "COORD2":
                return degrees("lat", transform(expr.argument(0), context), expr);
            case "COORDSYS":
                String frame = frameOf(expr.argument(0));
                return Literal.ofString(frame != null ? frame : "UNKNOWN", expr.position()).withInfo(expr.info());
            default:
                throw new InternalMorphException("No backend form for function " + expr.name(), expr.position());
        }
    }

    private static Expression degrees(String accessor, Expression point, FunctionCall expr) {
        return new BackendCall("DEGREES",
            List.of(new BackendCall(accessor, List.of(point), DOUBLE, expr.position())),
            expr.info(), expr.position());
    }

    private Expression distance(FunctionCall expr, RangeContext context) {
        Expression from;
        Expression to;
        if (expr.arguments().size() == 4) {
            List<Expression> args = transformAll(expr.arguments(), context);
            from = point(args.get(0), args.get(1), null, expr.position());
            to = point(args.get(2), args.get(3), null, expr.position());
        } else {
            Expression[] operands = alignedOperands(expr, context);
            from = operands[0];
            to = operands[1];
        }
        BackendOperator separation = new BackendOperator("<->", List.of(from, to), DOUBLE, expr.position());
        return new BackendCall("DEGREES", List.of(separation), expr.info(), expr.position());
    }

    // ==================== Geometry predicates ====================

    @Override
    public Expression visitComparison(Comparison expr, RangeContext context) {
        FunctionCall predicate;
        Expression other;
        if (isPseudoBoolean(expr.left())) {
            predicate = (FunctionCall) expr.left();
            other = expr.right();
        } else if (isPseudoBoolean(expr.right())) {
            predicate = (FunctionCall) expr.right();
            other = expr.left();
        } else {
            return super.visitComparison(expr, context);
        }

        Integer truth = truthValue(other);
        if (truth == null) {
            throw new UnsupportedFeatureException(
                predicate.name() + " returns 0 or 1 and may only be compared with 0 or 1",
                expr.position(), other.toString());
        }
        if (expr.operator() != Comparison.Operator.EQ && expr.operator() != Comparison.Operator.NE) {
            throw new UnsupportedFeatureException(
                predicate.name() + " may only be compared using = or !=",
                expr.position(), expr.operator().symbol());
        }
        boolean positive = (expr.operator() == Comparison.Operator.EQ) == (truth == 1);
        Expression morphed = predicate(predicate, context);
        if (positive) {
            return morphed;
        }
        return new UnaryExpression(UnaryExpression.Operator.NOT, morphed, expr.position()).withInfo(BOOLEAN);
    }

    private static boolean isPseudoBoolean(Expression expr) {
        if (!(expr instanceof FunctionCall)) {
            return false;
        }
        FunctionCall call = (FunctionCall) expr;
        return call.signature() != null
            && call.signature().translation().kind() == BackendTranslation.Kind.MORPHER
            && ("CONTAINS".equals(call.name()) || "INTERSECTS".equals(call.name()));
    }

    private static Integer truthValue(Expression expr) {
        if (!(expr instanceof Literal) || !((Literal) expr).isNumeric()) {
            return null;
        }
        double value = ((Literal) expr).doubleValue();
        if (value == 0.0) {
            return 0;
        }
        return value == 1.0 ? 1 : null;
    }

    /**
     * Returns the boolean backend form of CONTAINS or INTERSECTS.
     */
    private Expression predicate(FunctionCall call, RangeContext context) {
        if ("CONTAINS".equals(call.name())) {
            Expression q3c = q3cContains(call, context);
            if (q3c != null) {
                return q3c;
            }
        }
        Expression[] operands = alignedOperands(call, context);
        String symbol = "CONTAINS".equals(call.name()) ? "@" : "&&";
        return new BackendOperator(symbol, List.of(operands[0], operands[1]), BOOLEAN, call.position());
    }

    /**
     * Morphs both operands and converts the first into the second's frame
     * when both carry a frame and they differ.
     */
    private Expression[] alignedOperands(FunctionCall call, RangeContext context) {
        Expression first = transform(call.argument(0), context);
        Expression second = transform(call.argument(1), context);
        String fromFrame = frameOf(call.argument(0));
        String toFrame = frameOf(call.argument(1));
        if (fromFrame != null && toFrame != null && !fromFrame.equals(toFrame)) {
            first = conversions.convert(first, fromFrame, toFrame);
        }
        return new Expression[] {first, second};
    }

    private static String frameOf(Expression expr) {
        if (expr instanceof GeometryConstant && ((GeometryConstant) expr).frame() != null) {
            return ((GeometryConstant) expr).frame();
        }
        FieldInfo info = expr.info();
        return info == null ? null : CoordinateFrames.normalize(info.frame());
    }

    /**
     * Returns a q3c index call for {@code CONTAINS(POINT(lon, lat), shape)}
     * when lon and lat are an indexed column pair of one table and the shape
     * is constant; null otherwise.
     */
    private Expression q3cContains(FunctionCall call, RangeContext context) {
        if (!q3cEnabled) {
            return null;
        }
        Expression pointArg = call.argument(0);
        Expression shapeArg = call.argument(1);
        if (!(pointArg instanceof GeometryLiteral) || !(shapeArg instanceof GeometryConstant)) {
            return null;
        }
        GeometryLiteral point = (GeometryLiteral) pointArg;
        GeometryConstant shape = (GeometryConstant) shapeArg;
        if (point.shape() != GeometryType.Shape.POINT || point.arguments().size() != 2
                || !(point.argument(0) instanceof ColumnReference)
                || !(point.argument(1) instanceof ColumnReference)) {
            return null;
        }
        String pointFrame = frameOf(point);
        if (pointFrame != null && shape.frame() != null && !pointFrame.equals(shape.frame())) {
            return null;
        }

        ColumnBinding lon = ((ColumnReference) point.argument(0)).binding();
        ColumnBinding lat = ((ColumnReference) point.argument(1)).binding();
        if (lon == null || lat == null || lon.rangeName() == null
                || !lon.rangeName().equals(lat.rangeName()) || lon.scopeDepth() != lat.scopeDepth()) {
            return null;
        }
        TableMeta table = context.lookup(lon.rangeName(), lon.scopeDepth(), call.position()).table();
        if (table == null || table.spatialIndex(lon.columnName(), lat.columnName()).isEmpty()) {
            return null;
        }

        List<Expression> args = new ArrayList<>();
        args.add(transform(point.argument(0), context));
        args.add(transform(point.argument(1), context));
        switch (shape.shape()) {
            case CIRCLE:
                args.add(number(shape.value(0), call.position()));
                args.add(number(shape.value(1), call.position()));
                args.add(number(shape.value(2), call.position()));
                return new BackendCall("q3c_radial_query", args, BOOLEAN, call.position());
            case BOX:
                args.add(coordinateArray(boxCorners(shape), call.position()));
                return new BackendCall("q3c_poly_query", args, BOOLEAN, call.position());
            case POLYGON:
                args.add(coordinateArray(shape.values(), call.position()));
                return new BackendCall("q3c_poly_query", args, BOOLEAN, call.position());
            default:
                return null;
        }
    }

    private static Expression coordinateArray(List<Double> values, SourcePosition position) {
        List<Expression> numbers = new ArrayList<>(values.size());
        for (double value : values) {
            numbers.add(number(value, position));
        }
        return new RawSQLExpression("ARRAY[" + placeholders(numbers.size()) + "]", numbers, true, null, position);
    }

    private static Literal number(double value, SourcePosition position) {
        return Literal.ofDouble(value, position).withInfo(DOUBLE);
    }

    // ==================== Geometry values ====================

    @Override
    public Expression visitGeometryLiteral(GeometryLiteral expr, RangeContext context) {
        List<Expression> args = transformAll(expr.arguments(), context);
        switch (expr.shape()) {
            case POINT:
                return point(args.get(0), args.get(1), expr.info(), expr.position());
            case CIRCLE:
                if (args.size() == 2) {
                    return raw("scircle({0}, RADIANS({1}))", args, expr);
                }
                return raw("scircle(spoint(RADIANS({0}), RADIANS({1})), RADIANS({2}))", args, expr);
            case BOX:
                return box(args, expr);
            case POLYGON:
                return polygon(args, expr);
            default:
                throw new UnsupportedFeatureException(
                    "REGION is only supported with a literal STC-S string", expr.position(), expr.toString());
        }
    }

    private static Expression point(Expression lon, Expression lat, FieldInfo info, SourcePosition position) {
        return new RawSQLExpression("spoint(RADIANS({0}), RADIANS({1}))", List.of(lon, lat), true, info, position);
    }

    private static Expression raw(String template, List<Expression> args, GeometryLiteral expr) {
        return new RawSQLExpression(template, args, true, expr.info(), expr.position());
    }

    /**
     * A box is the polygon through its four corners, built from a VALUES
     * list since pgSphere has no constructor taking expressions.
     */
    private static Expression box(List<Expression> args, GeometryLiteral expr) {
        String lon;
        String lat;
        String width;
        String height;
        if (args.size() == 3) {
            lon = "DEGREES(long({0}))";
            lat = "DEGREES(lat({0}))";
            width = "{1}";
            height = "{2}";
        } else {
            lon = "{0}";
            lat = "{1}";
            width = "{2}";
            height = "{3}";
        }
        String west = lon + " - " + width + " / 2.0";
        String east = lon + " + " + width + " / 2.0";
        String south = lat + " - " + height + " / 2.0";
        String north = lat + " + " + height + " / 2.0";
        List<String> corners = List.of(
            spointTemplate(west, south),
            spointTemplate(west, north),
            spointTemplate(east, north),
            spointTemplate(east, south));
        return raw(polygonTemplate(corners), args, expr);
    }

    private static Expression polygon(List<Expression> args, GeometryLiteral expr) {
        List<String> vertices = new ArrayList<>();
        boolean pointArguments = expr.argument(0).dataType() instanceof GeometryType;
        if (pointArguments) {
            for (int i = 0; i < args.size(); i++) {
                vertices.add("{" + i + "}");
            }
        } else {
            for (int i = 0; i + 1 < args.size(); i += 2) {
                vertices.add(spointTemplate("{" + i + "}", "{" + (i + 1) + "}"));
            }
        }
        return raw(polygonTemplate(vertices), args, expr);
    }

    private static String spointTemplate(String lon, String lat) {
        return "spoint(RADIANS(" + lon + "), RADIANS(" + lat + "))";
    }

    private static String polygonTemplate(List<String> vertices) {
        StringBuilder sb = new StringBuilder("(SELECT spoly(q.p ORDER BY q.ind) FROM (VALUES ");
        for (int i = 0; i < vertices.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('(').append(i).append(", ").append(vertices.get(i)).append(')');
        }
        return sb.append(") AS q(ind, p))").toString();
    }

    @Override
    public Expression visitGeometryConstant(GeometryConstant expr, RangeContext context) {
        switch (expr.shape()) {
            case POINT:
                return new TypedLiteral("spoint", position(expr.value(0), expr.value(1)), expr.info(), expr.position());
            case CIRCLE:
                return new TypedLiteral("scircle",
                    "<" + position(expr.value(0), expr.value(1)) + ", " + degrees(expr.value(2)) + ">",
                    expr.info(), expr.position());
            case BOX:
                return new TypedLiteral("spoly", polygonText(boxCorners(expr)), expr.info(), expr.position());
            default:
                return new TypedLiteral("spoly", polygonText(expr.values()), expr.info(), expr.position());
        }
    }

    /** Corners of a constant box, counter-clockwise from the south-west. */
    private static List<Double> boxCorners(GeometryConstant box) {
        double lon = box.value(0);
        double lat = box.value(1);
        double halfWidth = box.value(2) / 2;
        double halfHeight = box.value(3) / 2;
        return List.of(
            lon - halfWidth, lat - halfHeight,
            lon - halfWidth, lat + halfHeight,
            lon + halfWidth, lat + halfHeight,
            lon + halfWidth, lat - halfHeight);
    }

    private static String polygonText(List<Double> values) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i + 1 < values.size(); i += 2) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(position(values.get(i), values.get(i + 1)));
        }
        return sb.append('}').toString();
    }

    private static String position(double lon, double lat) {
        return "(" + degrees(lon) + ", " + degrees(lat) + ")";
    }

    private static String degrees(double value) {
        return formatNumber(value) + "d";
    }

    private static String formatNumber(double value) {
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String placeholders(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('{').append(i).append('}');
        }
        return sb.toString();
    }
}
