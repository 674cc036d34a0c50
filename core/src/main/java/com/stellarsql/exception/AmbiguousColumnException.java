package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when an unqualified column name matches columns of more than one table in scope.
 */
public class AmbiguousColumnException extends AdqlCompilationException {

    public AmbiguousColumnException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.AMBIGUOUS_COLUMN, message, position, offendingText);
    }
}
