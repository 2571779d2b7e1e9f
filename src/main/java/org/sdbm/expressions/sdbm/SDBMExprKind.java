package org.sdbm.expressions.sdbm;

/**
 * SDBM 表达式的变体标签。
 * 能力类 (Positive / Varying / Input) 完全由标签决定，与具体的 Java 类层次无关。
 */
public enum SDBMExprKind {

    CONSTANT("const"),
    DIM("dim"),
    SYMBOL("symbol"),
    STRIPE("stripe"),
    NEG("neg"),
    SUM("sum"),
    DIFF("diff");

    private final String symbol;

    SDBMExprKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Positive = {DIM, SYMBOL, STRIPE}：可以直接作为矩阵中一个不取反的轴。
     */
    public boolean isPositive() {
        return switch (this) {
            case DIM, SYMBOL, STRIPE -> true;
            case CONSTANT, NEG, SUM, DIFF -> false;
        };
    }

    /**
     * Varying = 除常数以外的一切。
     */
    public boolean isVarying() {
        return this != CONSTANT;
    }

    /**
     * Input = {DIM, SYMBOL}：叶子变量引用。
     */
    public boolean isInput() {
        return this == DIM || this == SYMBOL;
    }
}
