package io.github.eutro.peval.core.tree;

/**
 * A unary operator.
 */
public enum UnOperator {
    NOT("not", Precedence.NOT),
    NEG("-", Precedence.UNARY),
    POS("+", Precedence.UNARY),
    INVERT("~", Precedence.UNARY),
    ;

    public final String symbol;
    public final int precedence;

    UnOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }
}
