package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when a known function is called with a number of arguments no signature accepts.
 */
public class ArityMismatchException extends AdqlCompilationException {

    public ArityMismatchException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.ARITY_MISMATCH, message, position, offendingText);
    }
}
