package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown for calls to functions the registry does not know.
 */
public class UnsupportedFunctionException extends AdqlCompilationException {

    public UnsupportedFunctionException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.UNSUPPORTED_FUNCTION, message, position, offendingText);
    }
}
