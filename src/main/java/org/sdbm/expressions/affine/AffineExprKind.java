package org.sdbm.expressions.affine;

/**
 * 一般仿射表达式的节点种类。
 */
public enum AffineExprKind {

    ADD("+"),
    MUL("*"),
    MOD("mod"),
    FLOOR_DIV("floordiv"),
    CEIL_DIV("ceildiv"),
    CONSTANT("const"),
    DIM("dim"),
    SYMBOL("symbol");

    private final String symbol;

    AffineExprKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isBinary() {
        return switch (this) {
            case ADD, MUL, MOD, FLOOR_DIV, CEIL_DIV -> true;
            case CONSTANT, DIM, SYMBOL -> false;
        };
    }
}
