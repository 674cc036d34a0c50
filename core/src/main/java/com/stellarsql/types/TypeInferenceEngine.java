package com.stellarsql.types;

/**
 * Centralized type and unit rules shared by the annotator and the function
 * registry.
 *
 * <h2>Coercion Rules</h2>
 * <ul>
 *   <li>Numeric widening: SMALLINT → INTEGER → BIGINT → REAL → DOUBLE</li>
 *   <li>CHAR and VARCHAR are interchangeable</li>
 *   <li>A POINT is accepted wherever a geometry is expected</li>
 *   <li>NULL is accepted everywhere</li>
 * </ul>
 *
 * <h2>Unit Rules</h2>
 * <ul>
 *   <li>Addition and subtraction keep the unit when both operands agree, else no unit</li>
 *   <li>Multiplication and division combine units ({@code m*s}, {@code m/(s)})</li>
 *   <li>A dimensionless operand leaves the other operand's unit in a product</li>
 * </ul>
 */
public final class TypeInferenceEngine {

    private TypeInferenceEngine() {
        // Utility class - prevent instantiation
    }

    // ========================================================================
    // Type classification
    // ========================================================================

    public static boolean isNumeric(DataType type) {
        return numericRank(type) != ScalarType.NOT_NUMERIC;
    }

    public static boolean isIntegral(DataType type) {
        return type instanceof ShortType ||
               type instanceof IntegerType ||
               type instanceof LongType;
    }

    public static boolean isString(DataType type) {
        return type instanceof StringType;
    }

    public static boolean isGeometry(DataType type) {
        return type instanceof GeometryType;
    }

    public static boolean isNull(DataType type) {
        return type instanceof NullType;
    }

    // ========================================================================
    // Promotion and coercion
    // ========================================================================

    /**
     * Promotes numeric types along the widening order.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        if (left instanceof NullType) {
            return right;
        }
        if (right instanceof NullType) {
            return left;
        }
        return numericRank(left) >= numericRank(right) ? left : right;
    }

    private static int numericRank(DataType type) {
        return type instanceof ScalarType ? ((ScalarType) type).numericRank() : ScalarType.NOT_NUMERIC;
    }

    /**
     * Checks whether a value of type {@code from} may be passed where
     * {@code to} is expected.
     *
     * @param from the actual type
     * @param to the expected type
     * @return true if the value coerces implicitly
     */
    public static boolean canCoerce(DataType from, DataType to) {
        if (from instanceof NullType || from.equals(to)) {
            return true;
        }
        if (isNumeric(from) && isNumeric(to)) {
            return numericRank(from) <= numericRank(to);
        }
        if (from instanceof GeometryType && to instanceof GeometryType) {
            return ((GeometryType) to).shape() == GeometryType.Shape.REGION;
        }
        return false;
    }

    /**
     * Unifies two types for a comparison, IN list, COALESCE or set operation.
     *
     * @param a first type
     * @param b second type
     * @return the unified type, or null if the types are incompatible
     */
    public static DataType unifyTypes(DataType a, DataType b) {
        if (a instanceof NullType) {
            return b;
        }
        if (b instanceof NullType) {
            return a;
        }
        if (a.equals(b)) {
            return a;
        }
        if (isNumeric(a) && isNumeric(b)) {
            return promoteNumericTypes(a, b);
        }
        if (a instanceof GeometryType && b instanceof GeometryType) {
            return GeometryType.of(GeometryType.Shape.REGION);
        }
        return null;
    }

    /**
     * Checks whether two types can be compared with an ordering operator.
     *
     * @param a first type
     * @param b second type
     * @return true if {@code <}, {@code =} and friends apply
     */
    public static boolean isComparable(DataType a, DataType b) {
        if (a instanceof GeometryType || b instanceof GeometryType) {
            return false;
        }
        return unifyTypes(a, b) != null;
    }

    // ========================================================================
    // Units
    // ========================================================================

    /**
     * Derives the unit and UCD of a sum or difference.
     *
     * @param left metadata of the left operand
     * @param right metadata of the right operand
     * @param resultType the result type
     * @return the combined field info
     */
    public static FieldInfo combineAdditive(FieldInfo left, FieldInfo right, DataType resultType) {
        String unit = left.unit().equals(right.unit()) ? left.unit() : "";
        String ucd = left.ucd().equals(right.ucd()) ? left.ucd() : "";
        String frame = left.frame() != null && left.frame().equals(right.frame()) ? left.frame() : null;
        return new FieldInfo(resultType, unit, ucd, frame);
    }

    /**
     * Derives the unit of a product or quotient.
     *
     * @param left metadata of the left operand
     * @param right metadata of the right operand
     * @param division true for division, false for multiplication
     * @param resultType the result type
     * @return the combined field info
     */
    public static FieldInfo combineMultiplicative(FieldInfo left, FieldInfo right,
                                                  boolean division, DataType resultType) {
        String unit;
        if (right.unit().isEmpty()) {
            unit = left.unit();
        } else if (left.unit().isEmpty()) {
            unit = division ? "1/(" + right.unit() + ")" : right.unit();
        } else {
            unit = division
                ? left.unit() + "/(" + right.unit() + ")"
                : left.unit() + "*" + right.unit();
        }
        return new FieldInfo(resultType, unit, "", null);
    }
}
