package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when the nesting depth of a query exceeds the configured maximum.
 */
public class RecursionLimitException extends AdqlCompilationException {

    private final int limit;

    public RecursionLimitException(int limit, SourcePosition position) {
        super(ErrorKind.RECURSION_LIMIT,
              "Query nesting exceeds the maximum depth of " + limit,
              position, null);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
