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
 * 差表达式 x - y，两侧都是 Varying 表达式。差的方向是固定的，lhs 总是取正号的一侧。
 */
@Getter
public final class SDBMDiffExpr extends SDBMExpr {

    private static final Logger logger = LoggerFactory.getLogger(SDBMDiffExpr.class);

    private final SDBMExpr lhs;
    private final SDBMExpr rhs;

    SDBMDiffExpr(SDBMContext context, SDBMExpr lhs, SDBMExpr rhs) {
        super(context, SDBMExprKind.DIFF, Objects.hash(SDBMExprKind.DIFF.ordinal(), lhs, rhs));
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static SDBMDiffExpr of(SDBMExpr lhs, SDBMExpr rhs) {
        Objects.requireNonNull(lhs, "SDBMDiffExpr.of: lhs 不能为 null");
        Objects.requireNonNull(rhs, "SDBMDiffExpr.of: rhs 不能为 null");
        if (!lhs.isVarying() || !rhs.isVarying()) {
            logger.error("SDBMDiffExpr.of: 操作数 {} 和 {} 必须都是 Varying 表达式", lhs, rhs);
            throw new IllegalArgumentException("SDBMDiffExpr.of: 操作数必须都是 Varying 表达式，实际为 " + lhs + " 和 " + rhs);
        }
        requireSameContext(lhs, rhs, "SDBMDiffExpr.of");
        return (SDBMDiffExpr) lhs.getContext().intern(SDBMExprKind.DIFF, lhs, rhs);
    }

    @Override
    public List<SDBMExpr> getOperands() {
        return List.of(lhs, rhs);
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkSub(lhs.toZ3ArithExpr(ctx, varManager), rhs.toZ3ArithExpr(ctx, varManager));
    }

    @Override
    public String toString() {
        return lhs + " - " + rhs;
    }
}
