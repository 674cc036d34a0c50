package com.stellarsql.optimizer;

import com.stellarsql.expression.Expression;
import com.stellarsql.expression.GeometryConstant;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.Literal;
import com.stellarsql.types.CoordinateFrames;
import com.stellarsql.types.GeometryType;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds geometry constructors with constant coordinates into
 * {@link GeometryConstant}s.
 *
 * <p>A constructor folds when every argument is a numeric literal or an
 * already folded point, e.g. {@code CIRCLE('ICRS', POINT(10, 20), 1)}.
 * {@code REGION} folds when its argument is a string literal holding
 * STC-S. A constructor without a coordinate system takes the frame of its
 * first point argument.
 */
public class GeometryFoldingRule extends ExpressionRewriteRule {

    @Override
    public Expression visitGeometryLiteral(GeometryLiteral expr, Void context) {
        GeometryLiteral rebuilt = (GeometryLiteral) super.visitGeometryLiteral(expr, context);
        if (rebuilt.shape() == GeometryType.Shape.REGION) {
            Expression argument = rebuilt.argument(0);
            if (argument instanceof Literal && ((Literal) argument).kind() == Literal.Kind.STRING) {
                return StcsParser.parse((String) ((Literal) argument).value(), argument.position())
                    .withInfo(rebuilt.info());
            }
            return rebuilt;
        }

        String frame = CoordinateFrames.normalize(rebuilt.coordSys());
        boolean frameInherited = rebuilt.coordSys() == null;
        List<Double> values = new ArrayList<>();
        for (Expression argument : rebuilt.arguments()) {
            if (ConstantFoldingRule.isNumericLiteral(argument)) {
                values.add(((Literal) argument).doubleValue());
            } else if (argument instanceof GeometryConstant
                    && ((GeometryConstant) argument).shape() == GeometryType.Shape.POINT) {
                GeometryConstant point = (GeometryConstant) argument;
                if (frameInherited) {
                    frame = point.frame();
                    frameInherited = false;
                }
                values.addAll(point.values());
            } else {
                return rebuilt;
            }
        }
        return new GeometryConstant(rebuilt.shape(), frame, values, rebuilt.position()).withInfo(rebuilt.info());
    }
}
