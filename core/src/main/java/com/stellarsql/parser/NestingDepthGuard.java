package com.stellarsql.parser;

import com.stellarsql.exception.RecursionLimitException;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Token-level nesting check run before the parser sees the query.
 *
 * <p>The generated parser is recursive descent, so a pathologically nested
 * query could exhaust the stack before the AST builder gets a chance to
 * count levels. The guard counts open parentheses plus runs of prefix
 * operators ({@code NOT}, unary {@code -} and {@code +}) still waiting for
 * their operand, and fails at the first token that goes past the limit.
 */
final class NestingDepthGuard {

    private final int maxDepth;
    private final SourceText source;

    NestingDepthGuard(int maxDepth, SourceText source) {
        this.maxDepth = maxDepth;
        this.source = source;
    }

    void check(List<Token> tokens) {
        // pending prefix operators per parenthesis level
        Deque<int[]> levels = new ArrayDeque<>();
        levels.push(new int[1]);
        int prefixTotal = 0;
        Token previous = null;

        for (Token token : tokens) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL
                    || token.getType() == Token.EOF) {
                continue;
            }
            int type = token.getType();
            if (type == AdqlBaseParser.LEFT_PAREN) {
                levels.push(new int[1]);
            } else if (type == AdqlBaseParser.RIGHT_PAREN) {
                if (levels.size() > 1) {
                    prefixTotal -= levels.pop()[0];
                }
                // the parenthesized operand completes the prefix run before it
                prefixTotal -= levels.peek()[0];
                levels.peek()[0] = 0;
            } else if (isPrefixOperator(token, previous)) {
                levels.peek()[0]++;
                prefixTotal++;
            } else if (levels.peek()[0] > 0) {
                prefixTotal -= levels.peek()[0];
                levels.peek()[0] = 0;
            }

            int depth = levels.size() - 1 + prefixTotal;
            if (depth > maxDepth) {
                throw new RecursionLimitException(maxDepth, source.position(token));
            }
            previous = token;
        }
    }

    private static boolean isPrefixOperator(Token token,
                                            Token previous) {
        int type = token.getType();
        if (type == AdqlBaseParser.NOT) {
            return previous == null || (!endsValue(previous) && previous.getType() != AdqlBaseParser.IS);
        }
        if (type == AdqlBaseParser.MINUS || type == AdqlBaseParser.PLUS) {
            return previous == null || !endsValue(previous);
        }
        return false;
    }

    private static boolean endsValue(Token token) {
        switch (token.getType()) {
            case AdqlBaseParser.REGULAR_IDENTIFIER:
            case AdqlBaseParser.DELIMITED_IDENTIFIER:
            case AdqlBaseParser.UNSIGNED_INTEGER:
            case AdqlBaseParser.UNSIGNED_DECIMAL:
            case AdqlBaseParser.APPROXIMATE_NUMBER:
            case AdqlBaseParser.STRING_LITERAL:
            case AdqlBaseParser.NULL:
            case AdqlBaseParser.RIGHT_PAREN:
                return true;
            default:
                return false;
        }
    }
}
