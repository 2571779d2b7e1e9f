package org.sdbm.expressions.affine;

import lombok.Getter;
import org.sdbm.expressions.ToZ3ArithExpr;

import java.util.Objects;

/**
 * 一般仿射表达式 (维度、符号、常数以及 +、*、mod、floordiv、ceildiv)。
 * 此类只提供构造、求值与 Z3 转换，不做任何化简。
 * 此类是不可变的，equals 与 hashCode 基于结构。
 */
@Getter
public abstract class AffineExpr implements ToZ3ArithExpr {

    private final AffineExprKind kind;

    AffineExpr(AffineExprKind kind) {
        this.kind = Objects.requireNonNull(kind, "AffineExpr-构造函数: kind 不能为 null");
    }

    // --- 工厂方法 ---

    public static AffineConstantExpr constant(long value) {
        return new AffineConstantExpr(value);
    }

    public static AffineDimExpr dim(int position) {
        return new AffineDimExpr(position);
    }

    public static AffineSymbolExpr symbol(int position) {
        return new AffineSymbolExpr(position);
    }

    public static AffineBinaryOpExpr binary(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        return new AffineBinaryOpExpr(kind, lhs, rhs);
    }

    public AffineExpr add(AffineExpr other) {
        return binary(AffineExprKind.ADD, this, other);
    }

    public AffineExpr add(long value) {
        return add(constant(value));
    }

    public AffineExpr mul(AffineExpr other) {
        return binary(AffineExprKind.MUL, this, other);
    }

    public AffineExpr mul(long value) {
        return mul(constant(value));
    }

    public AffineExpr floorDiv(AffineExpr other) {
        return binary(AffineExprKind.FLOOR_DIV, this, other);
    }

    public AffineExpr floorDiv(long value) {
        return floorDiv(constant(value));
    }

    public AffineExpr ceilDiv(AffineExpr other) {
        return binary(AffineExprKind.CEIL_DIV, this, other);
    }

    public AffineExpr ceilDiv(long value) {
        return ceilDiv(constant(value));
    }

    public AffineExpr mod(AffineExpr other) {
        return binary(AffineExprKind.MOD, this, other);
    }

    public AffineExpr mod(long value) {
        return mod(constant(value));
    }

    /**
     * 在给定的维度与符号取值下求值。
     * @param dims    维度取值，下标为维度位置。
     * @param symbols 符号取值，下标为符号位置。
     * @return 表达式的整数值。
     * @throws ArithmeticException 除数为零时。
     * @throws IndexOutOfBoundsException 取值数组不覆盖表达式中出现的位置时。
     */
    public abstract long evaluate(long[] dims, long[] symbols);

    public boolean isConstant(long value) {
        return false;
    }
}
