package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when the query text does not conform to the ADQL grammar.
 *
 * <p>The position is that of the first token the parser could not accept.
 * The expected-token list holds the display names of the tokens that would
 * have been valid there, when the parser could determine them.
 */
public class AdqlSyntaxException extends AdqlCompilationException {

    private final List<String> expectedTokens;

    public AdqlSyntaxException(String message, SourcePosition position,
                               String offendingToken, List<String> expectedTokens) {
        super(ErrorKind.SYNTAX_ERROR, message, position, offendingToken);
        this.expectedTokens = expectedTokens == null
            ? Collections.emptyList()
            : List.copyOf(expectedTokens);
    }

    public List<String> expectedTokens() {
        return expectedTokens;
    }

    @Override
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder(super.getUserMessage());
        if (!expectedTokens.isEmpty()) {
            sb.append("; expected one of: ").append(String.join(", ", expectedTokens));
        }
        return sb.toString();
    }
}
