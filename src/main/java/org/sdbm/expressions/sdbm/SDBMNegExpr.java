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
 * 取反表达式 -x，x 必须是 Positive 表达式。
 */
@Getter
public final class SDBMNegExpr extends SDBMExpr {

    private static final Logger logger = LoggerFactory.getLogger(SDBMNegExpr.class);

    private final SDBMExpr var;

    SDBMNegExpr(SDBMContext context, SDBMExpr var) {
        super(context, SDBMExprKind.NEG, Objects.hash(SDBMExprKind.NEG.ordinal(), var));
        this.var = var;
    }

    public static SDBMNegExpr of(SDBMExpr var) {
        Objects.requireNonNull(var, "SDBMNegExpr.of: var 不能为 null");
        if (!var.isPositive()) {
            logger.error("SDBMNegExpr.of: 被取反的表达式 {} 不是 Positive 表达式", var);
            throw new IllegalArgumentException("SDBMNegExpr.of: 只能对 Positive 表达式取反，实际为 " + var);
        }
        return (SDBMNegExpr) var.getContext().intern(SDBMExprKind.NEG, var);
    }

    @Override
    public List<SDBMExpr> getOperands() {
        return List.of(var);
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkUnaryMinus(var.toZ3ArithExpr(ctx, varManager));
    }

    @Override
    public String toString() {
        return "-" + var;
    }
}
