package org.sdbm.expressions.affine;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.AccessLevel;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;

import java.util.Objects;

/**
 * 二元仿射表达式：lhs (+ | * | mod | floordiv | ceildiv) rhs。
 * 除法与取模采用向下取整语义，与除数符号无关。
 */
@Getter
public final class AffineBinaryOpExpr extends AffineExpr {

    private final AffineExpr lhs;
    private final AffineExpr rhs;
    @Getter(AccessLevel.NONE)
    private final int hashCode;

    AffineBinaryOpExpr(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        super(kind);
        if (!kind.isBinary()) {
            throw new IllegalArgumentException("AffineBinaryOpExpr-构造函数: " + kind + " 不是二元运算");
        }
        this.lhs = Objects.requireNonNull(lhs, "AffineBinaryOpExpr-构造函数: lhs 不能为 null");
        this.rhs = Objects.requireNonNull(rhs, "AffineBinaryOpExpr-构造函数: rhs 不能为 null");
        this.hashCode = Objects.hash(kind.ordinal(), lhs, rhs);
    }

    @Override
    public long evaluate(long[] dims, long[] symbols) {
        long l = lhs.evaluate(dims, symbols);
        long r = rhs.evaluate(dims, symbols);
        return switch (getKind()) {
            case ADD -> l + r;
            case MUL -> l * r;
            case FLOOR_DIV -> Math.floorDiv(l, r);
            case CEIL_DIV -> -Math.floorDiv(-l, r);
            case MOD -> Math.floorMod(l, r);
            default -> throw new IllegalStateException("未知的二元运算: " + getKind());
        };
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<IntSort> l = lhs.toZ3ArithExpr(ctx, varManager);
        ArithExpr<IntSort> r = rhs.toZ3ArithExpr(ctx, varManager);
        return switch (getKind()) {
            case ADD -> ctx.mkAdd(l, r);
            case MUL -> ctx.mkMul(l, r);
            case FLOOR_DIV -> floorDiv(ctx, l, r);
            case CEIL_DIV -> ctx.mkUnaryMinus(floorDiv(ctx, ctx.mkUnaryMinus(l), r));
            case MOD -> ctx.mkSub(l, ctx.mkMul(r, floorDiv(ctx, l, r)));
            default -> throw new IllegalStateException("未知的二元运算: " + getKind());
        };
    }

    /**
     * Z3 的整数 div 在除数为负时向上取整，这里统一成向下取整。
     */
    private static ArithExpr<IntSort> floorDiv(Context ctx, ArithExpr<IntSort> l, ArithExpr<IntSort> r) {
        return (ArithExpr<IntSort>) ctx.mkITE(
                ctx.mkGt(r, ctx.mkInt(0)),
                ctx.mkDiv(l, r),
                ctx.mkDiv(ctx.mkUnaryMinus(l), ctx.mkUnaryMinus(r)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AffineBinaryOpExpr that = (AffineBinaryOpExpr) o;
        return getKind() == that.getKind() && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + getKind().getSymbol() + " " + rhs + ")";
    }
}
