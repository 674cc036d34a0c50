package com.stellarsql.parser;

/**
 * Location of a token or node in the query text.
 *
 * <p>Line and column are 1-based; the column counts characters. The byte
 * offset is the 0-based offset of the first character in the UTF-8 encoding
 * of the whole query.
 *
 * @param line 1-based line number
 * @param column 1-based column (in characters)
 * @param byteOffset 0-based UTF-8 byte offset
 */
public record SourcePosition(int line, int column, int byteOffset) {

    /** Position used for nodes synthesized by later stages. */
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, -1);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? "line " + line + ", column " + column : "unknown position";
    }
}
