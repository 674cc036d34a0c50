package com.stellarsql.parser;

import com.stellarsql.exception.AdqlSyntaxException;
import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.logical.QueryExpression;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for turning ADQL text into the query AST.
 *
 * <p>Wraps the ANTLR4-generated parser with:
 * <ul>
 *   <li>case-insensitive keywords via {@link UpperCaseCharStream}</li>
 *   <li>SLL-first, LL-fallback two-phase parsing</li>
 *   <li>a nesting-depth pre-check so deep queries fail with
 *       {@link RecursionLimitException} instead of exhausting the stack</li>
 *   <li>errors reported as {@link AdqlSyntaxException} with line, column
 *       and byte offset</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 *   AdqlQueryParser parser = new AdqlQueryParser(100);
 *   QueryExpression query = parser.parse("SELECT TOP 10 ra, dec FROM gaia.dr3");
 * </pre>
 *
 * <p>Instances hold no per-query state and may be shared between threads.
 */
public class AdqlQueryParser {

    private static final Logger logger = LoggerFactory.getLogger(AdqlQueryParser.class);

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final int maxDepth;

    public AdqlQueryParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * Creates a parser with the given nesting limit.
     *
     * @param maxDepth maximum nesting of parentheses, subqueries, function
     *                 calls and prefix operators
     */
    public AdqlQueryParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Parses an ADQL query.
     *
     * <p>Uses SLL prediction mode first, then falls back to full LL mode when
     * SLL fails; only the LL pass reports errors.
     *
     * @param adql the query text
     * @return the query AST, unannotated
     * @throws AdqlSyntaxException if the text is not a valid ADQL query
     * @throws RecursionLimitException if the query nests too deeply
     */
    public QueryExpression parse(String adql) {
        if (adql == null || adql.isBlank()) {
            throw new AdqlSyntaxException("Query must not be null or empty",
                new SourcePosition(1, 1, 0), "<end of input>", List.of("SELECT"));
        }

        logger.debug("Parsing ADQL: {}", adql);

        SourceText source = new SourceText(adql);
        AdqlBaseLexer lexer = newLexer(adql);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        new NestingDepthGuard(maxDepth, source).check(tokens.getTokens());

        AdqlBaseParser parser = new AdqlBaseParser(tokens);

        try {
            // Phase 1: SLL mode
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
            parser.removeErrorListeners();
            parser.setErrorHandler(new BailErrorStrategy());

            AdqlBaseParser.SingleStatementContext tree;
            try {
                tree = parser.singleStatement();
            } catch (ParseCancellationException e) {
                // Phase 2: LL mode, which also produces the error report
                logger.debug("SLL parse failed, falling back to LL mode");
                tokens.seek(0);
                parser.reset();
                parser.getInterpreter().setPredictionMode(PredictionMode.LL);
                parser.removeErrorListeners();
                parser.addErrorListener(new AdqlErrorListener(source));
                parser.setErrorHandler(new DefaultErrorStrategy());

                tree = parser.singleStatement();
            }

            QueryExpression query = (QueryExpression) new AdqlAstBuilder(source, maxDepth).visit(tree);
            logger.debug("Parsed ADQL into {}", query);
            return query;
        } catch (StackOverflowError e) {
            throw new RecursionLimitException(maxDepth, SourcePosition.UNKNOWN);
        }
    }

    /**
     * Splits a query into tokens, skipping whitespace and comments.
     *
     * <p>Characters that start no valid token come back as
     * {@link AdqlToken.TokenKind#UNRECOGNIZED} tokens rather than raising an error.
     *
     * @param adql the query text
     * @return the tokens in source order
     */
    public List<AdqlToken> tokenize(String adql) {
        SourceText source = new SourceText(adql == null ? "" : adql);
        AdqlBaseLexer lexer = newLexer(source.text());
        List<AdqlToken> result = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL) {
                continue;
            }
            result.add(new AdqlToken(kindOf(token.getType()), token.getText(), source.position(token)));
        }
        return result;
    }

    private static AdqlBaseLexer newLexer(String adql) {
        AdqlBaseLexer lexer = new AdqlBaseLexer(new UpperCaseCharStream(CharStreams.fromString(adql)));
        lexer.removeErrorListeners();
        return lexer;
    }

    private static AdqlToken.TokenKind kindOf(int type) {
        switch (type) {
            case AdqlBaseLexer.REGULAR_IDENTIFIER:
            case AdqlBaseLexer.DELIMITED_IDENTIFIER:
                return AdqlToken.TokenKind.IDENTIFIER;
            case AdqlBaseLexer.STRING_LITERAL:
            case AdqlBaseLexer.UNSIGNED_INTEGER:
            case AdqlBaseLexer.UNSIGNED_DECIMAL:
            case AdqlBaseLexer.APPROXIMATE_NUMBER:
                return AdqlToken.TokenKind.LITERAL;
            case AdqlBaseLexer.EQ:
            case AdqlBaseLexer.NEQ:
            case AdqlBaseLexer.LT:
            case AdqlBaseLexer.LTE:
            case AdqlBaseLexer.GT:
            case AdqlBaseLexer.GTE:
            case AdqlBaseLexer.PLUS:
            case AdqlBaseLexer.MINUS:
            case AdqlBaseLexer.ASTERISK:
            case AdqlBaseLexer.SLASH:
            case AdqlBaseLexer.CONCAT:
                return AdqlToken.TokenKind.OPERATOR;
            case AdqlBaseLexer.LEFT_PAREN:
            case AdqlBaseLexer.RIGHT_PAREN:
            case AdqlBaseLexer.COMMA:
            case AdqlBaseLexer.DOT:
            case AdqlBaseLexer.SEMICOLON:
                return AdqlToken.TokenKind.PUNCTUATION;
            case AdqlBaseLexer.UNRECOGNIZED:
                return AdqlToken.TokenKind.UNRECOGNIZED;
            default:
                return AdqlToken.TokenKind.KEYWORD;
        }
    }
}
