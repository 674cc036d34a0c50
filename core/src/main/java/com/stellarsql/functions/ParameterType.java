package com.stellarsql.functions;

import com.stellarsql.types.DataType;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.TypeInferenceEngine;

/**
 * Argument classes a function parameter accepts.
 *
 * <p>NULL is accepted by every parameter type.
 */
public enum ParameterType {
    /** Any numeric type. */
    NUMERIC,
    /** An integral type (SMALLINT, INTEGER, BIGINT). */
    INTEGER,
    /** A character string. */
    STRING,
    /** A POINT geometry. */
    POINT,
    /** Any geometry; POINT included. */
    GEOMETRY,
    /** Anything except a geometry. */
    SCALAR,
    /** Any value. */
    ANY;

    /**
     * Tests whether an argument of the given type can be passed.
     *
     * @param type the argument's annotated type
     * @return true if the argument fits this parameter
     */
    public boolean accepts(DataType type) {
        if (TypeInferenceEngine.isNull(type)) {
            return true;
        }
        switch (this) {
            case NUMERIC:
                return TypeInferenceEngine.isNumeric(type);
            case INTEGER:
                return TypeInferenceEngine.isIntegral(type);
            case STRING:
                return TypeInferenceEngine.isString(type);
            case POINT:
                return type instanceof GeometryType && ((GeometryType) type).isPoint();
            case GEOMETRY:
                return TypeInferenceEngine.isGeometry(type);
            case SCALAR:
                return !TypeInferenceEngine.isGeometry(type);
            default:
                return true;
        }
    }
}
