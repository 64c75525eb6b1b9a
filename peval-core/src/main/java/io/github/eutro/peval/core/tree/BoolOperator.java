package io.github.eutro.peval.core.tree;

/**
 * A short-circuiting logical operator.
 */
public enum BoolOperator {
    AND("and", Precedence.AND),
    OR("or", Precedence.OR),
    ;

    public final String symbol;
    public final int precedence;

    BoolOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /**
     * Whether a value of the given truthiness decides the result of this operator on its own.
     *
     * @param truthy The truthiness of the operand.
     * @return Whether evaluation stops at that operand.
     */
    public boolean shortCircuitsOn(boolean truthy) {
        return this == AND ? !truthy : truthy;
    }
}
