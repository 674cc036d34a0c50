package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when a column reference matches no column of the tables in scope.
 */
public class UnknownColumnException extends AdqlCompilationException {

    public UnknownColumnException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.UNKNOWN_COLUMN, message, position, offendingText);
    }
}
