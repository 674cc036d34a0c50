package com.stellarsql.morph;

import com.stellarsql.expression.Expression;
import com.stellarsql.expression.RawSQLExpression;
import com.stellarsql.types.CoordinateFrames;

import java.util.List;
import java.util.Map;

/**
 * Frame conversion with pgSphere {@code strans} Euler rotations.
 *
 * <p>Every conversion goes through ICRS: adding {@code strans(...)} rotates
 * from ICRS into a frame, subtracting it rotates back. FK5 is taken as
 * identical to ICRS.
 */
public class PgSphereFrameConversion implements CoordinateConversionProvider {

    /** Euler angles (radians) of the rotation from ICRS; empty for frames aligned with ICRS. */
    private static final Map<String, double[]> FROM_ICRS = Map.of(
        CoordinateFrames.ICRS, new double[0],
        CoordinateFrames.FK5, new double[0],
        CoordinateFrames.FK4, new double[] {
            1.5651864333666516, -0.0048590552804904244, -1.5763681043529187},
        CoordinateFrames.GALACTIC, new double[] {
            1.3463560974407338, -1.0973190018372752, 0.57477052472873258});

    @Override
    public boolean supports(String fromFrame, String toFrame) {
        return FROM_ICRS.containsKey(fromFrame) && FROM_ICRS.containsKey(toFrame);
    }

    @Override
    public Expression convert(Expression geometry, String fromFrame, String toFrame) {
        Expression result = geometry;
        double[] toIcrs = FROM_ICRS.get(fromFrame);
        if (toIcrs.length > 0) {
            result = rotate(result, '-', toIcrs);
        }
        double[] fromIcrs = FROM_ICRS.get(toFrame);
        if (fromIcrs.length > 0) {
            result = rotate(result, '+', fromIcrs);
        }
        return result;
    }

    private static Expression rotate(Expression geometry, char direction, double[] angles) {
        String template = "({0} " + direction + " strans(" + angles[0] + ", " + angles[1] + ", " + angles[2] + "))";
        return new RawSQLExpression(template, List.of(geometry), false, geometry.info(), geometry.position());
    }
}
