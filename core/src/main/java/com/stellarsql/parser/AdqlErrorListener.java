package com.stellarsql.parser;

import com.stellarsql.exception.AdqlSyntaxException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Error listener that turns the first ANTLR syntax error into an
 * {@link AdqlSyntaxException} with the offending token's position and the
 * set of tokens the parser expected there.
 */
class AdqlErrorListener extends BaseErrorListener {

    private final SourceText source;

    AdqlErrorListener(SourceText source) {
        this.source = source;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        String offendingText = null;
        int startIndex = -1;
        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            startIndex = token.getStartIndex();
            offendingText = token.getType() == Token.EOF ? "<end of input>" : token.getText();
        }
        SourcePosition position = source.position(line, charPositionInLine, startIndex);

        List<String> expected = new ArrayList<>();
        if (recognizer instanceof Parser) {
            Parser parser = (Parser) recognizer;
            IntervalSet expectedTokens = e != null && e.getExpectedTokens() != null
                ? e.getExpectedTokens()
                : parser.getExpectedTokens();
            Vocabulary vocabulary = parser.getVocabulary();
            for (int type : expectedTokens.toList()) {
                expected.add(type == Token.EOF ? "<end of input>" : vocabulary.getDisplayName(type));
            }
        }

        String message = offendingText != null
            ? "Syntax error at '" + offendingText + "'"
            : "Syntax error: " + msg;
        throw new AdqlSyntaxException(message, position, offendingText, expected);
    }
}
