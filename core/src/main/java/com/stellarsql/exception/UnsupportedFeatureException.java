package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown for valid ADQL the PostgreSQL/pgSphere backend cannot express.
 */
public class UnsupportedFeatureException extends AdqlCompilationException {

    public UnsupportedFeatureException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.UNSUPPORTED_FEATURE, message, position, offendingText);
    }
}
