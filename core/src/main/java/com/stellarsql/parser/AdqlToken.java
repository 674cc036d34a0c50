package com.stellarsql.parser;

/**
 * A lexical token of an ADQL query.
 *
 * @param kind the token class
 * @param text the token text as written
 * @param position where the token starts
 */
public record AdqlToken(TokenKind kind, String text, SourcePosition position) {

    /** Token classes. */
    public enum TokenKind {
        KEYWORD,
        IDENTIFIER,
        OPERATOR,
        LITERAL,
        PUNCTUATION,
        UNRECOGNIZED
    }
}
