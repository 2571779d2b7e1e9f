package org.sdbm.expressions.dbm;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.sdbm.expressions.ToZ3BoolExpr;
import org.sdbm.expressions.sdbm.SDBMExpr;
import org.sdbm.symbolic.Z3VariableManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 一组 SDBM 约束：不等式 (expr <= 0) 与等式 (expr == 0)。语义为所有约束的合取。
 * 此类是不可变的。
 */
@Getter
public final class SDBMExpressions implements ToZ3BoolExpr {

    private final List<SDBMExpr> inequalities;
    private final List<SDBMExpr> equalities;

    public SDBMExpressions(List<SDBMExpr> inequalities, List<SDBMExpr> equalities) {
        Objects.requireNonNull(inequalities, "SDBMExpressions-构造函数: inequalities 不能为 null");
        Objects.requireNonNull(equalities, "SDBMExpressions-构造函数: equalities 不能为 null");
        this.inequalities = Collections.unmodifiableList(new ArrayList<>(inequalities));
        this.equalities = Collections.unmodifiableList(new ArrayList<>(equalities));
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        List<BoolExpr> z3Constraints = new ArrayList<>();
        for (SDBMExpr inequality : inequalities) {
            z3Constraints.add(ctx.mkLe(inequality.toZ3ArithExpr(ctx, varManager), ctx.mkInt(0)));
        }
        for (SDBMExpr equality : equalities) {
            z3Constraints.add(ctx.mkEq(equality.toZ3ArithExpr(ctx, varManager), ctx.mkInt(0)));
        }
        if (z3Constraints.isEmpty()) {
            return ctx.mkTrue();
        }
        return ctx.mkAnd(z3Constraints.toArray(new BoolExpr[0]));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SDBMExpressions that = (SDBMExpressions) o;
        return inequalities.equals(that.inequalities) && equalities.equals(that.equalities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inequalities, equalities);
    }

    @Override
    public String toString() {
        String joined = Stream.concat(
                        inequalities.stream().map(e -> e + " <= 0"),
                        equalities.stream().map(e -> e + " == 0"))
                .collect(Collectors.joining(" /\\ "));
        return joined.isEmpty() ? "TRUE" : "(" + joined + ")";
    }
}
