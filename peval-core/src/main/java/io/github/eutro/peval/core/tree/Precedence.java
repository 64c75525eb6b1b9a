package io.github.eutro.peval.core.tree;

/**
 * Expression binding strengths, weakest first.
 */
public final class Precedence {
    public static final int LAMBDA = 1;
    public static final int IF_EXP = 2;
    public static final int OR = 3;
    public static final int AND = 4;
    public static final int NOT = 5;
    public static final int COMPARE = 6;
    public static final int BIT_OR = 7;
    public static final int BIT_XOR = 8;
    public static final int BIT_AND = 9;
    public static final int SHIFT = 10;
    public static final int ARITH = 11;
    public static final int TERM = 12;
    public static final int UNARY = 13;
    public static final int POWER = 14;
    public static final int AWAIT = 15;
    public static final int PRIMARY = 16;
    public static final int ATOM = 17;

    private Precedence() {
    }
}
