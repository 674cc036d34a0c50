package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Thrown when aggregates or non-grouped columns are used where the grouping rules forbid them.
 */
public class GroupingException extends AdqlCompilationException {

    public GroupingException(String message, SourcePosition position, String offendingText) {
        super(ErrorKind.GROUPING_ERROR, message, position, offendingText);
    }
}
