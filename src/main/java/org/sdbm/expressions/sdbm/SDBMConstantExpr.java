package org.sdbm.expressions.sdbm;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 整数常数表达式。
 */
@Getter
public final class SDBMConstantExpr extends SDBMExpr {

    private final long value;

    SDBMConstantExpr(SDBMContext context, long value) {
        super(context, SDBMExprKind.CONSTANT, Objects.hash(SDBMExprKind.CONSTANT.ordinal(), value));
        this.value = value;
    }

    public static SDBMConstantExpr of(SDBMContext context, long value) {
        Objects.requireNonNull(context, "SDBMConstantExpr.of: context 不能为 null");
        return (SDBMConstantExpr) context.intern(SDBMExprKind.CONSTANT, value);
    }

    @Override
    public List<SDBMExpr> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkInt(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
