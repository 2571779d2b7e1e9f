package org.sdbm.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.sdbm.expressions.ToZ3ArithExpr;
import org.sdbm.expressions.ToZ3BoolExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 Z3 的语义判定器。
 * 用于检查 SDBM 表达式、仿射表达式和 SDBM 矩阵之间的可满足性、蕴含与等价关系。
 * 持有一个原生的 Z3 Context，使用完毕后必须调用 {@link #close()}；实例不应跨线程共享。
 * @author Ayalyt
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    /** 默认的求解超时 (毫秒) */
    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

    public enum OracleResult {
        /** 判定成立 */
        YES,
        /** 判定不成立 */
        NO,
        /** Z3 无法给出结论 (例如超时) */
        UNKNOWN
    }

    private final Context context;
    private final Z3VariableManager varManager;
    private final int timeoutMillis;

    public Z3Oracle() {
        this(DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * @param timeoutMillis 单次求解的超时，必须为正。
     */
    public Z3Oracle(int timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Z3Oracle: 超时必须为正，实际为 " + timeoutMillis);
        }
        this.context = new Context();
        this.varManager = new Z3VariableManager(context);
        this.timeoutMillis = timeoutMillis;
        logger.info("Z3Oracle 初始化完成，超时 {} ms。", timeoutMillis);
    }

    /**
     * 检查给定公式的可满足性。
     * @param formula Z3 布尔表达式。
     * @return Z3 的求解状态。
     */
    public Status check(BoolExpr formula) {
        Solver solver = context.mkSolver();
        Params params = context.mkParams();
        params.add("timeout", timeoutMillis);
        solver.setParameters(params);
        solver.add(formula);
        Status status = solver.check();
        logger.debug("Z3Oracle.check: {} => {}", formula, status);
        return status;
    }

    public OracleResult isSatisfiable(ToZ3BoolExpr formula) {
        return toResult(check(formula.toZ3BoolExpr(context, varManager)), Status.SATISFIABLE);
    }

    /**
     * 检查 premise 是否蕴含 conclusion，即 premise ∧ ¬conclusion 不可满足。
     */
    public OracleResult checkImplication(ToZ3BoolExpr premise, ToZ3BoolExpr conclusion) {
        BoolExpr counterExample = context.mkAnd(
                premise.toZ3BoolExpr(context, varManager),
                context.mkNot(conclusion.toZ3BoolExpr(context, varManager)));
        return toResult(check(counterExample), Status.UNSATISFIABLE);
    }

    /**
     * 检查两个约束系统在所有整数取值下是否等价。
     */
    public OracleResult checkEquivalence(ToZ3BoolExpr lhs, ToZ3BoolExpr rhs) {
        BoolExpr differs = context.mkXor(
                lhs.toZ3BoolExpr(context, varManager),
                rhs.toZ3BoolExpr(context, varManager));
        return toResult(check(differs), Status.UNSATISFIABLE);
    }

    /**
     * 检查两个整数表达式在所有整数取值下是否相等。
     */
    public OracleResult checkEqual(ToZ3ArithExpr lhs, ToZ3ArithExpr rhs) {
        BoolExpr differs = context.mkNot(context.mkEq(
                lhs.toZ3ArithExpr(context, varManager),
                rhs.toZ3ArithExpr(context, varManager)));
        return toResult(check(differs), Status.UNSATISFIABLE);
    }

    private OracleResult toResult(Status status, Status expected) {
        if (status == Status.UNKNOWN) {
            logger.warn("Z3Oracle: Z3 返回 UNKNOWN 状态 (可能超时)，无法判定。");
            return OracleResult.UNKNOWN;
        }
        return status == expected ? OracleResult.YES : OracleResult.NO;
    }

    @Override
    public void close() {
        context.close();
        logger.info("Z3Oracle 已关闭。");
    }
}
