package org.sdbm.expressions.sdbm;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 和表达式 x + C，x 是 Varying 表达式，C 是常数。
 */
@Getter
public final class SDBMSumExpr extends SDBMExpr {

    private static final Logger logger = LoggerFactory.getLogger(SDBMSumExpr.class);

    private final SDBMExpr lhs;
    private final SDBMConstantExpr rhs;

    SDBMSumExpr(SDBMContext context, SDBMExpr lhs, SDBMConstantExpr rhs) {
        super(context, SDBMExprKind.SUM, Objects.hash(SDBMExprKind.SUM.ordinal(), lhs, rhs));
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static SDBMSumExpr of(SDBMExpr lhs, SDBMConstantExpr rhs) {
        Objects.requireNonNull(lhs, "SDBMSumExpr.of: lhs 不能为 null");
        Objects.requireNonNull(rhs, "SDBMSumExpr.of: rhs 不能为 null");
        if (!lhs.isVarying()) {
            logger.error("SDBMSumExpr.of: 左操作数 {} 不是 Varying 表达式", lhs);
            throw new IllegalArgumentException("SDBMSumExpr.of: 左操作数必须是 Varying 表达式，实际为 " + lhs);
        }
        requireSameContext(lhs, rhs, "SDBMSumExpr.of");
        return (SDBMSumExpr) lhs.getContext().intern(SDBMExprKind.SUM, lhs, rhs);
    }

    @Override
    public List<SDBMExpr> getOperands() {
        return List.of(lhs, rhs);
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkAdd(lhs.toZ3ArithExpr(ctx, varManager), rhs.toZ3ArithExpr(ctx, varManager));
    }

    @Override
    public String toString() {
        long value = rhs.getValue();
        if (value < 0) {
            // Long.MIN_VALUE 没有对应的正数
            return lhs + " - " + Long.toString(value).substring(1);
        }
        return lhs + " + " + value;
    }
}
