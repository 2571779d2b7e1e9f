package org.sdbm.expressions.sdbm;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.IntNum;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 条带表达式 x # C：将 x 向下取整到 C 的倍数 (即分块的基址，而不是块编号)。
 * x 必须是 Positive 表达式，C 必须是正常数。条带可以嵌套，例如 s0 # 3 # 5。
 */
@Getter
public final class SDBMStripeExpr extends SDBMExpr {

    private static final Logger logger = LoggerFactory.getLogger(SDBMStripeExpr.class);

    private final SDBMExpr var;
    private final SDBMConstantExpr stripeFactor;

    SDBMStripeExpr(SDBMContext context, SDBMExpr var, SDBMConstantExpr stripeFactor) {
        super(context, SDBMExprKind.STRIPE, Objects.hash(SDBMExprKind.STRIPE.ordinal(), var, stripeFactor));
        this.var = var;
        this.stripeFactor = stripeFactor;
    }

    /**
     * 创建 (不折叠的) 条带表达式。
     *
     * @param var    被条带化的 Positive 表达式。
     * @param factor 条带因子，必须为正。
     * @return 唯一化的条带表达式。
     * @throws IllegalArgumentException 如果因子非正，或 var 不是 Positive 表达式。
     */
    public static SDBMStripeExpr of(SDBMExpr var, SDBMConstantExpr factor) {
        Objects.requireNonNull(var, "SDBMStripeExpr.of: var 不能为 null");
        Objects.requireNonNull(factor, "SDBMStripeExpr.of: factor 不能为 null");
        if (factor.getValue() <= 0) {
            logger.error("SDBMStripeExpr.of: 条带因子 {} 非正 (non-positive)，{} # {} 没有意义", factor, var, factor);
            throw new IllegalArgumentException("SDBMStripeExpr.of: non-positive stripe factor " + factor.getValue());
        }
        if (!var.isPositive()) {
            logger.error("SDBMStripeExpr.of: 被条带化的表达式 {} 不是 Positive 表达式", var);
            throw new IllegalArgumentException("SDBMStripeExpr.of: 只能对 Positive 表达式做条带，实际为 " + var);
        }
        requireSameContext(var, factor, "SDBMStripeExpr.of");
        return (SDBMStripeExpr) var.getContext().intern(SDBMExprKind.STRIPE, var, factor);
    }

    @Override
    public List<SDBMExpr> getOperands() {
        return List.of(var, stripeFactor);
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        // 因子为正时 Z3 的整数除法就是向下取整
        IntNum z3Factor = ctx.mkInt(stripeFactor.getValue());
        return ctx.mkMul(ctx.mkDiv(var.toZ3ArithExpr(ctx, varManager), z3Factor), z3Factor);
    }

    @Override
    public String toString() {
        return var + " # " + stripeFactor;
    }
}
