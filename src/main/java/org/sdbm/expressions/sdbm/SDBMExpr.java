package org.sdbm.expressions.sdbm;

import lombok.AccessLevel;
import lombok.Getter;
import org.sdbm.expressions.ToZ3ArithExpr;
import org.sdbm.expressions.affine.AffineExpr;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 条带差分界限 (Striped Difference-Bound) 表达式的公共基类。
 * <p>
 * 变体集合是封闭的：常数、维度、符号、条带、取反、和、差。所有实例都由 {@link SDBMContext} 唯一化，
 * 因此 equals 是引用比较，hashCode 在构造时计算一次。
 * 算术运算 ({@link #add}、{@link #subtract}、{@link #negate}、{@link #stripe}) 均经由
 * {@link SDBMBuilder} 折叠，返回值总是规范形式。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public abstract class SDBMExpr implements ToZ3ArithExpr {

    private final SDBMContext context;
    private final SDBMExprKind kind;
    @Getter(AccessLevel.NONE)
    private final int hashCode;

    SDBMExpr(SDBMContext context, SDBMExprKind kind, int hashCode) {
        this.context = Objects.requireNonNull(context, "SDBMExpr-构造函数: context 不能为 null");
        this.kind = kind;
        this.hashCode = hashCode;
    }

    /**
     * @return 直接子表达式，按字段顺序排列。
     */
    public abstract List<SDBMExpr> getOperands();

    // --- 能力类查询 ---

    public boolean isPositive() {
        return kind.isPositive();
    }

    public boolean isVarying() {
        return kind.isVarying();
    }

    public boolean isInput() {
        return kind.isInput();
    }

    public boolean isa(Class<? extends SDBMExpr> type) {
        return type.isInstance(this);
    }

    /**
     * 收窄到指定的变体类型。
     * @param type 目标类型，例如 SDBMStripeExpr.class 或 SDBMInputExpr.class。
     * @return 如果此表达式属于该类型则返回它，否则返回空。
     */
    public <T extends SDBMExpr> Optional<T> as(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }

    /**
     * 后序遍历此表达式的所有子表达式 (包括自身)。
     */
    public void walk(Consumer<SDBMExpr> callback) {
        for (SDBMExpr operand : getOperands()) {
            operand.walk(callback);
        }
        callback.accept(this);
    }

    // --- 规范化算术 ---

    public SDBMExpr add(SDBMExpr other) {
        return SDBMBuilder.add(this, other);
    }

    public SDBMExpr add(long value) {
        return SDBMBuilder.add(this, context.constant(value));
    }

    public SDBMExpr subtract(SDBMExpr other) {
        return SDBMBuilder.subtract(this, other);
    }

    public SDBMExpr subtract(long value) {
        return SDBMBuilder.subtract(this, context.constant(value));
    }

    public SDBMExpr negate() {
        return SDBMBuilder.negate(this);
    }

    public SDBMStripeExpr stripe(long factor) {
        return SDBMBuilder.stripe(this, context.constant(factor));
    }

    public SDBMStripeExpr stripe(SDBMConstantExpr factor) {
        return SDBMBuilder.stripe(this, factor);
    }

    // --- 仿射表达式转换 ---

    /**
     * 转换为一般仿射表达式。此转换是全函数。
     */
    public AffineExpr getAsAffineExpr() {
        return SDBMAffineConverter.toAffine(this);
    }

    /**
     * 尝试将一般仿射表达式转换为 SDBM 表达式。
     * @param context 结果所属的上下文。
     * @param affine 待转换的仿射表达式。
     * @return 如果仿射表达式落在 SDBM 可表示的片段内则返回对应表达式，否则返回空。
     */
    public static Optional<SDBMExpr> tryConvertAffineExpr(SDBMContext context, AffineExpr affine) {
        return SDBMAffineConverter.fromAffine(context, affine);
    }

    /**
     * 检查两个表达式属于同一个上下文。跨上下文组合表达式属于调用方的契约错误。
     */
    static void requireSameContext(SDBMExpr lhs, SDBMExpr rhs, String operation) {
        if (lhs.getContext() != rhs.getContext()) {
            throw new IllegalArgumentException(operation + ": 表达式 " + lhs + " 与 " + rhs
                    + " 属于不同的上下文 (" + lhs.getContext() + ", " + rhs.getContext() + ")");
        }
    }

    // --- Object 方法 ---

    @Override
    public final boolean equals(Object o) {
        // 唯一化保证结构相等即引用相等
        return this == o;
    }

    @Override
    public final int hashCode() {
        return hashCode;
    }
}
