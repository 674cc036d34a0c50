package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when a FROM item or a column qualifier names no table in the catalog or scope.
 */
public class UnknownTableException extends AdqlCompilationException {

    public UnknownTableException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.UNKNOWN_TABLE, message, position, offendingText);
    }
}
