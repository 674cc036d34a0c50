package com.stellarsql.exception;

/**
 * Classification of compilation failures.
 *
 * <p>Every {@link AdqlCompilationException} carries exactly one kind so that
 * callers (for example a TAP service turning errors into VOTable error
 * documents) can branch without inspecting exception classes.
 */
public enum ErrorKind {
    SYNTAX_ERROR,
    UNKNOWN_TABLE,
    UNKNOWN_COLUMN,
    AMBIGUOUS_COLUMN,
    TYPE_MISMATCH,
    UNSUPPORTED_FUNCTION,
    ARITY_MISMATCH,
    UNSUPPORTED_FEATURE,
    RECURSION_LIMIT,
    GROUPING_ERROR,
    INTERNAL_MORPH_ERROR
}
