package org.sdbm.expressions.affine;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;

@Getter
public final class AffineConstantExpr extends AffineExpr {

    private final long value;

    AffineConstantExpr(long value) {
        super(AffineExprKind.CONSTANT);
        this.value = value;
    }

    @Override
    public long evaluate(long[] dims, long[] symbols) {
        return value;
    }

    @Override
    public boolean isConstant(long expected) {
        return value == expected;
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkInt(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((AffineConstantExpr) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
