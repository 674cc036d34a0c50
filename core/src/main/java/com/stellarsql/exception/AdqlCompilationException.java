package com.stellarsql.exception;

import com.stellarsql.parser.SourcePosition;

/**
 * Base exception for every failure raised while compiling an ADQL query.
 *
 * <p>Carries the {@link ErrorKind}, the source position of the offending
 * construct (when one is known) and the offending text. Compilation is
 * fail-fast: the first error aborts the pipeline and no partial result is
 * returned.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       CompiledQuery q = compiler.compile(adql, catalog);
 *   } catch (AdqlCompilationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Kind: " + e.kind());
 *   }
 * </pre>
 */
public class AdqlCompilationException extends RuntimeException {

    private final ErrorKind kind;
    private final SourcePosition position;
    private final String offendingText;

    public AdqlCompilationException(ErrorKind kind, String message,
                                    SourcePosition position, String offendingText) {
        this(kind, message, position, offendingText, null);
    }

    public AdqlCompilationException(ErrorKind kind, String message,
                                    SourcePosition position, String offendingText,
                                    Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
        this.offendingText = offendingText;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the source position of the offending construct.
     *
     * @return the position, {@link SourcePosition#UNKNOWN} if not available
     */
    public SourcePosition position() {
        return position;
    }

    /**
     * Returns the offending text (identifier, token or function name).
     *
     * @return the offending text, or null if not available
     */
    public String offendingText() {
        return offendingText;
    }

    /**
     * Returns a message suitable for end users, including the position.
     *
     * @return user-facing message
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getMessage());
        if (position.isKnown()) {
            sb.append(" (at ").append(position).append(")");
        }
        return sb.toString();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ADQL compilation failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Position: ").append(position);
        if (position.isKnown()) {
            sb.append(" (byte offset ").append(position.byteOffset()).append(")");
        }
        sb.append("\n");
        if (offendingText != null) {
            sb.append("Offending text: ").append(offendingText).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
