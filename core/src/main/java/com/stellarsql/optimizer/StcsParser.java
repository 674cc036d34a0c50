package com.stellarsql.optimizer;

import com.stellarsql.exception.UnsupportedFeatureException;
import com.stellarsql.expression.GeometryConstant;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.CoordinateFrames;
import com.stellarsql.types.GeometryType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the STC-S subset accepted by the ADQL {@code REGION} function.
 *
 * <p>Supported forms, with coordinates in degrees:
 * <pre>
 *   Position [frame ...] lon lat
 *   Circle   [frame ...] lon lat radius
 *   Box      [frame ...] lon lat width height
 *   Polygon  [frame ...] lon1 lat1 lon2 lat2 lon3 lat3 ...
 * </pre>
 * Words between the shape and the first number name the frame, reference
 * position and flavor; only the first is used. A trailing {@code unit deg}
 * is accepted.
 */
final class StcsParser {

    private StcsParser() {
        // Utility class - prevent instantiation
    }

    static GeometryConstant parse(String stcs, SourcePosition position) {
        String[] words = stcs.trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            throw invalid(stcs, "empty region", position);
        }

        GeometryType.Shape shape = shapeOf(words[0], stcs, position);
        int i = 1;
        String frame = null;
        if (i < words.length && !isNumber(words[i])) {
            frame = CoordinateFrames.normalize(words[i]);
            i++;
        }
        while (i < words.length && !isNumber(words[i])) {
            i++;
        }

        List<Double> values = new ArrayList<>();
        while (i < words.length && isNumber(words[i])) {
            values.add(Double.parseDouble(words[i]));
            i++;
        }
        if (i < words.length) {
            boolean degrees = i + 2 == words.length
                && "unit".equalsIgnoreCase(words[i]) && "deg".equalsIgnoreCase(words[i + 1]);
            if (!degrees) {
                throw invalid(stcs, "unexpected '" + words[i] + "'", position);
            }
        }

        checkCount(shape, values.size(), stcs, position);
        return new GeometryConstant(shape, frame, values, position);
    }

    private static GeometryType.Shape shapeOf(String word, String stcs, SourcePosition position) {
        switch (word.toUpperCase(Locale.ROOT)) {
            case "POSITION":
                return GeometryType.Shape.POINT;
            case "CIRCLE":
                return GeometryType.Shape.CIRCLE;
            case "BOX":
                return GeometryType.Shape.BOX;
            case "POLYGON":
                return GeometryType.Shape.POLYGON;
            default:
                throw new UnsupportedFeatureException(
                    "STC-S shape '" + word + "' is not supported in REGION", position, stcs);
        }
    }

    private static void checkCount(GeometryType.Shape shape, int count, String stcs, SourcePosition position) {
        boolean ok;
        switch (shape) {
            case POINT:
                ok = count == 2;
                break;
            case CIRCLE:
                ok = count == 3;
                break;
            case BOX:
                ok = count == 4;
                break;
            default:
                ok = count >= 6 && count % 2 == 0;
                break;
        }
        if (!ok) {
            throw invalid(stcs, "wrong number of coordinates for " + shape, position);
        }
    }

    private static boolean isNumber(String word) {
        try {
            Double.parseDouble(word);
            return !word.endsWith("d") && !word.endsWith("f") && !word.endsWith("D") && !word.endsWith("F");
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static UnsupportedFeatureException invalid(String stcs, String reason, SourcePosition position) {
        return new UnsupportedFeatureException("Invalid STC-S region (" + reason + "): " + stcs, position, stcs);
    }
}
