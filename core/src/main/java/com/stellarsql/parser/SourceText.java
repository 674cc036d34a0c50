package com.stellarsql.parser;

import org.antlr.v4.runtime.Token;

import java.nio.charset.StandardCharsets;

/**
 * The query text with a code-point index to UTF-8 byte offset table, used
 * to turn ANTLR token coordinates into {@link SourcePosition}s.
 */
final class SourceText {

    private final String text;
    private final int[] byteOffsets;

    SourceText(String text) {
        this.text = text;
        int count = text.codePointCount(0, text.length());
        this.byteOffsets = new int[count + 1];
        int offset = 0;
        int index = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            byteOffsets[index++] = offset;
            offset += new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            i += Character.charCount(cp);
        }
        byteOffsets[count] = offset;
    }

    String text() {
        return text;
    }

    /**
     * Builds a source position from ANTLR coordinates.
     *
     * @param line 1-based line
     * @param charPositionInLine 0-based column in code points
     * @param codePointIndex 0-based code point index in the whole text, or -1
     * @return the position
     */
    SourcePosition position(int line, int charPositionInLine, int codePointIndex) {
        int byteOffset;
        if (codePointIndex < 0) {
            byteOffset = -1;
        } else if (codePointIndex >= byteOffsets.length) {
            byteOffset = byteOffsets[byteOffsets.length - 1];
        } else {
            byteOffset = byteOffsets[codePointIndex];
        }
        return new SourcePosition(line, charPositionInLine + 1, byteOffset);
    }

    SourcePosition position(Token token) {
        return position(token.getLine(), token.getCharPositionInLine(), token.getStartIndex());
    }
}
