package io.github.eutro.peval.core.parse;

import org.jetbrains.annotations.Nullable;

/**
 * A lexical token.
 */
public final class Token {
    public enum Type {
        NAME,
        NUMBER,
        STRING,
        OP,
        NEWLINE,
        INDENT,
        DEDENT,
        EOF,
    }

    public final Type type;
    /**
     * The text of the token: the identifier for names, the symbol for operators,
     * and the source text for literals.
     */
    public final String text;
    /**
     * The value of a {@link Type#NUMBER} or {@link Type#STRING} literal.
     */
    @Nullable
    public final Object value;
    public final int line;
    public final int column;

    public Token(Type type, String text, @Nullable Object value, int line, int column) {
        this.type = type;
        this.text = text;
        this.value = value;
        this.line = line;
        this.column = column;
    }

    public boolean is(Type type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOp(String symbol) {
        return is(Type.OP, symbol);
    }

    @Override
    public String toString() {
        switch (type) {
            case NEWLINE:
                return "newline";
            case INDENT:
                return "indent";
            case DEDENT:
                return "dedent";
            case EOF:
                return "end of input";
            default:
                return "'" + text + "'";
        }
    }
}
