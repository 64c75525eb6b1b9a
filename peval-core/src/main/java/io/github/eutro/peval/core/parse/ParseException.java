package io.github.eutro.peval.core.parse;

/**
 * Thrown when source text is not a valid program.
 */
public class ParseException extends RuntimeException {
    /**
     * The 1-based line of the error.
     */
    public final int line;
    /**
     * The 1-based column of the error.
     */
    public final int column;

    public ParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }
}
