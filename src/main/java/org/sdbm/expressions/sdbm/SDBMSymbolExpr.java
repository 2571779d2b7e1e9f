package org.sdbm.expressions.sdbm;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import org.sdbm.symbolic.Z3VariableManager;

import java.util.Objects;

/**
 * 符号变量 s_i。
 */
public final class SDBMSymbolExpr extends SDBMInputExpr {

    SDBMSymbolExpr(SDBMContext context, int position) {
        super(context, SDBMExprKind.SYMBOL, position, Objects.hash(SDBMExprKind.SYMBOL.ordinal(), position));
    }

    public static SDBMSymbolExpr of(SDBMContext context, int position) {
        Objects.requireNonNull(context, "SDBMSymbolExpr.of: context 不能为 null");
        checkPosition(position, "SDBMSymbolExpr.of");
        return (SDBMSymbolExpr) context.intern(SDBMExprKind.SYMBOL, position);
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return varManager.getSymbolVar(getPosition());
    }

    @Override
    public String toString() {
        return "s" + getPosition();
    }
}
