package org.sdbm.expressions.sdbm;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import org.sdbm.symbolic.Z3VariableManager;

import java.util.Objects;

/**
 * 维度变量 d_i。
 */
public final class SDBMDimExpr extends SDBMInputExpr {

    SDBMDimExpr(SDBMContext context, int position) {
        super(context, SDBMExprKind.DIM, position, Objects.hash(SDBMExprKind.DIM.ordinal(), position));
    }

    public static SDBMDimExpr of(SDBMContext context, int position) {
        Objects.requireNonNull(context, "SDBMDimExpr.of: context 不能为 null");
        checkPosition(position, "SDBMDimExpr.of");
        return (SDBMDimExpr) context.intern(SDBMExprKind.DIM, position);
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return varManager.getDimVar(getPosition());
    }

    @Override
    public String toString() {
        return "d" + getPosition();
    }
}
