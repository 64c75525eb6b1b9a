package io.github.eutro.peval.core.tree;

/**
 * A binary arithmetic or bitwise operator.
 */
public enum BinOperator {
    ADD("+", Precedence.ARITH),
    SUB("-", Precedence.ARITH),
    MULT("*", Precedence.TERM),
    DIV("/", Precedence.TERM),
    FLOOR_DIV("//", Precedence.TERM),
    MOD("%", Precedence.TERM),
    POW("**", Precedence.POWER),
    LSHIFT("<<", Precedence.SHIFT),
    RSHIFT(">>", Precedence.SHIFT),
    BIT_OR("|", Precedence.BIT_OR),
    BIT_XOR("^", Precedence.BIT_XOR),
    BIT_AND("&", Precedence.BIT_AND),
    ;

    /**
     * The source symbol of the operator.
     */
    public final String symbol;
    /**
     * The binding strength of the operator.
     */
    public final int precedence;

    BinOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /**
     * Find the operator with the given symbol, or null if there is none.
     *
     * @param symbol The symbol, e.g. {@code "+"}.
     * @return The operator.
     */
    public static BinOperator fromSymbol(String symbol) {
        for (BinOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        return null;
    }
}
