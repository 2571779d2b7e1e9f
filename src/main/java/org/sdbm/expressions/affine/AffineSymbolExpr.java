package org.sdbm.expressions.affine;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.sdbm.symbolic.Z3VariableManager;

@Getter
public final class AffineSymbolExpr extends AffineExpr {

    private final int position;

    AffineSymbolExpr(int position) {
        super(AffineExprKind.SYMBOL);
        if (position < 0) {
            throw new IllegalArgumentException("AffineSymbolExpr-构造函数: 位置必须是非负整数，实际为 " + position);
        }
        this.position = position;
    }

    @Override
    public long evaluate(long[] dims, long[] symbols) {
        return symbols[position];
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return varManager.getSymbolVar(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return position == ((AffineSymbolExpr) o).position;
    }

    @Override
    public int hashCode() {
        return 31 * AffineExprKind.SYMBOL.ordinal() + position;
    }

    @Override
    public String toString() {
        return "s" + position;
    }
}
