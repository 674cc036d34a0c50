package com.stellarsql.optimizer;

import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.expression.GeometryConstant;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.Literal;
import com.stellarsql.expression.UnaryExpression;
import com.stellarsql.types.CoordinateFrames;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.IntegerType;
import com.stellarsql.types.TypeInferenceEngine;

/**
 * Evaluates expressions whose operands are all literals.
 *
 * <p>Folds:
 * <ul>
 *   <li>arithmetic on numeric literals, with integer semantics for integer
 *       operands (truncating division)</li>
 *   <li>unary minus and plus on numeric literals</li>
 *   <li>{@code ||} of two string literals</li>
 *   <li>{@code COORD1}, {@code COORD2} and {@code COORDSYS} of constant
 *       points</li>
 * </ul>
 * Division by zero and integer overflow are left for the database to
 * report.
 */
public class ConstantFoldingRule extends ExpressionRewriteRule {

    @Override
    public Expression visitBinaryExpression(BinaryExpression expr, Void context) {
        BinaryExpression rebuilt = (BinaryExpression) super.visitBinaryExpression(expr, context);
        if (!(rebuilt.left() instanceof Literal) || !(rebuilt.right() instanceof Literal)) {
            return rebuilt;
        }
        Literal left = (Literal) rebuilt.left();
        Literal right = (Literal) rebuilt.right();

        if (rebuilt.operator() == BinaryExpression.Operator.CONCAT) {
            if (left.kind() == Literal.Kind.STRING && right.kind() == Literal.Kind.STRING) {
                return Literal.ofString((String) left.value() + right.value(), rebuilt.position())
                    .withInfo(rebuilt.info());
            }
            return rebuilt;
        }
        if (!rebuilt.operator().isArithmetic() || !left.isNumeric() || !right.isNumeric()) {
            return rebuilt;
        }
        if (left.kind() == Literal.Kind.INTEGER && right.kind() == Literal.Kind.INTEGER) {
            return foldIntegers(rebuilt, (Long) left.value(), (Long) right.value());
        }
        return foldDoubles(rebuilt, left.doubleValue(), right.doubleValue());
    }

    private static Expression foldIntegers(BinaryExpression expr, long left, long right) {
        long result;
        try {
            switch (expr.operator()) {
                case ADD:
                    result = Math.addExact(left, right);
                    break;
                case SUBTRACT:
                    result = Math.subtractExact(left, right);
                    break;
                case MULTIPLY:
                    result = Math.multiplyExact(left, right);
                    break;
                default:
                    if (right == 0 || (left == Long.MIN_VALUE && right == -1)) {
                        return expr;
                    }
                    result = left / right;
                    break;
            }
        } catch (ArithmeticException e) {
            return expr;
        }
        if (!fitsType(result, expr.info())) {
            return expr;
        }
        return Literal.ofLong(result, expr.position()).withInfo(expr.info());
    }

    private static Expression foldDoubles(BinaryExpression expr, double left, double right) {
        double result;
        switch (expr.operator()) {
            case ADD:
                result = left + right;
                break;
            case SUBTRACT:
                result = left - right;
                break;
            case MULTIPLY:
                result = left * right;
                break;
            default:
                if (right == 0.0) {
                    return expr;
                }
                result = left / right;
                break;
        }
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return expr;
        }
        return Literal.ofDouble(result, expr.position()).withInfo(expr.info());
    }

    private static boolean fitsType(long value, FieldInfo info) {
        if (info != null && info.type() instanceof IntegerType) {
            return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
        }
        return true;
    }

    @Override
    public Expression visitUnaryExpression(UnaryExpression expr, Void context) {
        UnaryExpression rebuilt = (UnaryExpression) super.visitUnaryExpression(expr, context);
        if (!(rebuilt.operand() instanceof Literal) || !((Literal) rebuilt.operand()).isNumeric()) {
            return rebuilt;
        }
        Literal operand = (Literal) rebuilt.operand();
        switch (rebuilt.operator()) {
            case PLUS:
                return operand.withInfo(rebuilt.info());
            case NEGATE:
                if (operand.kind() == Literal.Kind.INTEGER) {
                    long value = (Long) operand.value();
                    if (value == Long.MIN_VALUE) {
                        return rebuilt;
                    }
                    return Literal.ofLong(-value, rebuilt.position()).withInfo(rebuilt.info());
                }
                return Literal.ofDouble(-operand.doubleValue(), rebuilt.position()).withInfo(rebuilt.info());
            default:
                return rebuilt;
        }
    }

    @Override
    public Expression visitFunctionCall(FunctionCall expr, Void context) {
        FunctionCall rebuilt = (FunctionCall) super.visitFunctionCall(expr, context);
        if (rebuilt.arguments().size() != 1) {
            return rebuilt;
        }
        Expression argument = rebuilt.argument(0);
        switch (rebuilt.name()) {
            case "COORD1":
            case "COORD2":
                if (argument instanceof GeometryConstant && isPoint((GeometryConstant) argument)) {
                    double value = ((GeometryConstant) argument).value("COORD1".equals(rebuilt.name()) ? 0 : 1);
                    return Literal.ofDouble(value, rebuilt.position()).withInfo(rebuilt.info());
                }
                return rebuilt;
            case "COORDSYS":
                String frame = constantFrame(argument);
                if (frame == null) {
                    return rebuilt;
                }
                return Literal.ofString(frame, rebuilt.position()).withInfo(rebuilt.info());
            default:
                return rebuilt;
        }
    }

    private static boolean isPoint(GeometryConstant constant) {
        return constant.shape() == GeometryType.Shape.POINT;
    }

    private static String constantFrame(Expression argument) {
        if (argument instanceof GeometryConstant) {
            String frame = ((GeometryConstant) argument).frame();
            return frame != null ? frame : "UNKNOWN";
        }
        if (argument instanceof GeometryLiteral) {
            GeometryLiteral literal = (GeometryLiteral) argument;
            if (literal.coordSys() != null) {
                String frame = CoordinateFrames.normalize(literal.coordSys());
                return frame != null ? frame : "UNKNOWN";
            }
        }
        return null;
    }

    static boolean isNumericLiteral(Expression expr) {
        return expr instanceof Literal && ((Literal) expr).isNumeric()
            && (expr.info() == null || TypeInferenceEngine.isNumeric(expr.dataType()));
    }
}
