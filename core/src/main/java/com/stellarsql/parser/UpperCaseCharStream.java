package com.stellarsql.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Char stream that presents upper-cased characters to the lexer while
 * keeping the original text for token values.
 *
 * <p>The grammar spells keywords in upper case; this makes them match in
 * any case without case-insensitive lexer rules. Identifiers and string
 * literals keep their original case because {@link #getText(Interval)}
 * reads the wrapped stream.
 */
public class UpperCaseCharStream implements CharStream {

    private final CharStream wrapped;

    public UpperCaseCharStream(CharStream wrapped) {
        this.wrapped = wrapped;
    }

    @Override
    public String getText(Interval interval) {
        return wrapped.getText(interval);
    }

    @Override
    public void consume() {
        wrapped.consume();
    }

    @Override
    public int LA(int i) {
        int c = wrapped.LA(i);
        if (c <= 0) {
            return c;
        }
        return Character.toUpperCase(c);
    }

    @Override
    public int mark() {
        return wrapped.mark();
    }

    @Override
    public void release(int marker) {
        wrapped.release(marker);
    }

    @Override
    public int index() {
        return wrapped.index();
    }

    @Override
    public void seek(int index) {
        wrapped.seek(index);
    }

    @Override
    public int size() {
        return wrapped.size();
    }

    @Override
    public String getSourceName() {
        return wrapped.getSourceName();
    }
}
