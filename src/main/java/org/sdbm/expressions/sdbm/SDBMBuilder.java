package org.sdbm.expressions.sdbm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * SDBM 表达式的规范化构造器。
 * <p>
 * 所有算术运算在构造时立即折叠，保证结果是规范形式：
 * <ol>
 *     <li>常数 + 常数 折叠为常数；</li>
 *     <li>(x + c1) + c2 折叠为 x + (c1 + c2)，常数链最多嵌套一层；</li>
 *     <li>x + 0 折叠为 x，与操作数顺序无关；</li>
 *     <li>x - x 折叠为 0；</li>
 *     <li>x + (-y) 与 (-y) + x 都折叠为 x - y，x 可以是任意 Varying 表达式 (取反表达式除外)；</li>
 *     <li>subtract(x, y) 定义为 add(x, negate(y))；</li>
 *     <li>stripe(x, c) 直接构造 x # c，嵌套的条带不会被合并。</li>
 * </ol>
 * 不属于上述模式的加法 (例如 d0 + d1) 超出了 SDBM 的表示范围。
 * @author Ayalyt
 */
public final class SDBMBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SDBMBuilder.class);

    private SDBMBuilder() {
    }

    /**
     * 计算 lhs + rhs 的规范形式。
     * @throws IllegalArgumentException 如果结果无法表示为 SDBM 表达式。
     */
    public static SDBMExpr add(SDBMExpr lhs, SDBMExpr rhs) {
        return tryAdd(lhs, rhs).orElseThrow(() -> {
            logger.error("SDBMBuilder.add: {} + {} 不是 SDBM 表达式", lhs, rhs);
            return new IllegalArgumentException("SDBMBuilder.add: 不支持的加法 " + lhs + " + " + rhs);
        });
    }

    /**
     * 计算 lhs + rhs 的规范形式，结果无法表示时返回空。
     */
    public static Optional<SDBMExpr> tryAdd(SDBMExpr lhs, SDBMExpr rhs) {
        Objects.requireNonNull(lhs, "SDBMBuilder.tryAdd: lhs 不能为 null");
        Objects.requireNonNull(rhs, "SDBMBuilder.tryAdd: rhs 不能为 null");
        SDBMExpr.requireSameContext(lhs, rhs, "SDBMBuilder.tryAdd");
        SDBMContext context = lhs.getContext();

        if (lhs.getKind() == SDBMExprKind.CONSTANT && rhs.getKind() == SDBMExprKind.CONSTANT) {
            return Optional.of(context.constant(valueOf(lhs) + valueOf(rhs)));
        }
        if (rhs.getKind() == SDBMExprKind.CONSTANT) {
            return Optional.of(addConstant(lhs, valueOf(rhs)));
        }
        if (lhs.getKind() == SDBMExprKind.CONSTANT) {
            return Optional.of(addConstant(rhs, valueOf(lhs)));
        }

        // 以下两侧都是 Varying
        if (isNegationOf(lhs, rhs)) {
            return Optional.of(context.constant(0));
        }
        // 常数总是提到最外层：(l + c) + r = (l + r) + c
        if (lhs.getKind() == SDBMExprKind.SUM) {
            SDBMSumExpr sum = (SDBMSumExpr) lhs;
            return tryAdd(sum.getLhs(), rhs).map(partial -> addConstant(partial, sum.getRhs().getValue()));
        }
        if (rhs.getKind() == SDBMExprKind.SUM) {
            SDBMSumExpr sum = (SDBMSumExpr) rhs;
            return tryAdd(lhs, sum.getLhs()).map(partial -> addConstant(partial, sum.getRhs().getValue()));
        }
        // x + (-y) 与 (-y) + x 都是 x - y；(-x) + (-y) 不可表示
        if (rhs.getKind() == SDBMExprKind.NEG && lhs.getKind() != SDBMExprKind.NEG) {
            return Optional.of(SDBMDiffExpr.of(lhs, ((SDBMNegExpr) rhs).getVar()));
        }
        if (lhs.getKind() == SDBMExprKind.NEG && rhs.getKind() != SDBMExprKind.NEG) {
            return Optional.of(SDBMDiffExpr.of(rhs, ((SDBMNegExpr) lhs).getVar()));
        }

        logger.debug("SDBMBuilder.tryAdd: {} + {} 超出 SDBM 的表示范围", lhs, rhs);
        return Optional.empty();
    }

    /**
     * 计算 lhs - rhs 的规范形式。
     * @throws IllegalArgumentException 如果结果无法表示为 SDBM 表达式。
     */
    public static SDBMExpr subtract(SDBMExpr lhs, SDBMExpr rhs) {
        Objects.requireNonNull(lhs, "SDBMBuilder.subtract: lhs 不能为 null");
        Objects.requireNonNull(rhs, "SDBMBuilder.subtract: rhs 不能为 null");
        SDBMExpr.requireSameContext(lhs, rhs, "SDBMBuilder.subtract");
        if (lhs == rhs) {
            return lhs.getContext().constant(0);
        }
        return add(lhs, negate(rhs));
    }

    /**
     * 计算 -expr 的规范形式。对任何规范形式的表达式都有定义。
     */
    public static SDBMExpr negate(SDBMExpr expr) {
        Objects.requireNonNull(expr, "SDBMBuilder.negate: expr 不能为 null");
        return switch (expr.getKind()) {
            case CONSTANT -> expr.getContext().constant(-valueOf(expr));
            case DIM, SYMBOL, STRIPE -> SDBMNegExpr.of(expr);
            case NEG -> ((SDBMNegExpr) expr).getVar();
            case SUM -> {
                SDBMSumExpr sum = (SDBMSumExpr) expr;
                yield addConstant(negate(sum.getLhs()), -sum.getRhs().getValue());
            }
            case DIFF -> {
                SDBMDiffExpr diff = (SDBMDiffExpr) expr;
                yield SDBMDiffExpr.of(diff.getRhs(), diff.getLhs());
            }
        };
    }

    /**
     * 构造 expr # factor。
     * @throws IllegalArgumentException 如果因子非正，或 expr 不是 Positive 表达式。
     */
    public static SDBMStripeExpr stripe(SDBMExpr expr, SDBMConstantExpr factor) {
        return SDBMStripeExpr.of(expr, factor);
    }

    /**
     * expr + value，expr 可以是任意规范形式的表达式。
     */
    private static SDBMExpr addConstant(SDBMExpr expr, long value) {
        SDBMContext context = expr.getContext();
        if (expr.getKind() == SDBMExprKind.CONSTANT) {
            return context.constant(valueOf(expr) + value);
        }
        if (value == 0) {
            return expr;
        }
        if (expr.getKind() == SDBMExprKind.SUM) {
            SDBMSumExpr sum = (SDBMSumExpr) expr;
            long folded = sum.getRhs().getValue() + value;
            if (folded == 0) {
                return sum.getLhs();
            }
            return SDBMSumExpr.of(sum.getLhs(), context.constant(folded));
        }
        return SDBMSumExpr.of(expr, context.constant(value));
    }

    /**
     * 判断 lhs 是否恰好是 -rhs，不创建任何新表达式。
     */
    private static boolean isNegationOf(SDBMExpr lhs, SDBMExpr rhs) {
        if (lhs.getKind() == SDBMExprKind.NEG) {
            return ((SDBMNegExpr) lhs).getVar() == rhs;
        }
        if (rhs.getKind() == SDBMExprKind.NEG) {
            return ((SDBMNegExpr) rhs).getVar() == lhs;
        }
        if (lhs.getKind() == SDBMExprKind.DIFF && rhs.getKind() == SDBMExprKind.DIFF) {
            SDBMDiffExpr left = (SDBMDiffExpr) lhs;
            SDBMDiffExpr right = (SDBMDiffExpr) rhs;
            return left.getLhs() == right.getRhs() && left.getRhs() == right.getLhs();
        }
        if (lhs.getKind() == SDBMExprKind.SUM && rhs.getKind() == SDBMExprKind.SUM) {
            SDBMSumExpr left = (SDBMSumExpr) lhs;
            SDBMSumExpr right = (SDBMSumExpr) rhs;
            return left.getRhs().getValue() == -right.getRhs().getValue()
                    && isNegationOf(left.getLhs(), right.getLhs());
        }
        return false;
    }

    private static long valueOf(SDBMExpr constant) {
        return ((SDBMConstantExpr) constant).getValue();
    }
}
