package org.sdbm.expressions.affine;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;

@Getter
public final class AffineDimExpr extends AffineExpr {

    private final int position;

    AffineDimExpr(int position) {
        super(AffineExprKind.DIM);
        if (position < 0) {
            throw new IllegalArgumentException("AffineDimExpr-构造函数: 位置必须是非负整数，实际为 " + position);
        }
        this.position = position;
    }

    @Override
    public long evaluate(long[] dims, long[] symbols) {
        return dims[position];
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return varManager.getDimVar(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return position == ((AffineDimExpr) o).position;
    }

    @Override
    public int hashCode() {
        return 31 * AffineExprKind.DIM.ordinal() + position;
    }

    @Override
    public String toString() {
        return "d" + position;
    }
}
