package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when operand or argument types cannot be coerced to what an operator or function accepts.
 */
public class TypeMismatchException extends AdqlCompilationException {

    public TypeMismatchException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.TYPE_MISMATCH, message, position, offendingText);
    }
}
