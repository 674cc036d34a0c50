package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when the morpher meets a tree that violates an invariant of the
 * annotated tree. This is a bug in the compiler, not in the query.
 */
public class InternalMorphException extends AdqlCompilationException {

    public InternalMorphException(String message, SourcePosition position) {
        super(ErrorKind.INTERNAL_MORPH_ERROR, message, position, null);
    }

    public InternalMorphException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_MORPH_ERROR, message, SourcePosition.UNKNOWN, null, cause);
    }
}
