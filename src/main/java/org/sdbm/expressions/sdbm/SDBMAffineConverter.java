package org.sdbm.expressions.sdbm;

import org.sdbm.expressions.affine.AffineBinaryOpExpr;
import org.sdbm.expressions.affine.AffineConstantExpr;
import org.sdbm.expressions.affine.AffineDimExpr;
import org.sdbm.expressions.affine.AffineExpr;
import org.sdbm.expressions.affine.AffineExprKind;
import org.sdbm.expressions.affine.AffineSymbolExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * SDBM 表达式与一般仿射表达式之间的双向转换。
 * <p>
 * 正向转换是结构化的全函数；条带 x # C 被表示为 (x floordiv C) * C。
 * 反向转换是部分函数：它按模式识别仿射表达式树，只有落在 SDBM 片段内的表达式才能转换，
 * 其余情况返回空。返回空是正常的否定结果，不是错误。
 */
final class SDBMAffineConverter {

    private static final Logger logger = LoggerFactory.getLogger(SDBMAffineConverter.class);

    private SDBMAffineConverter() {
    }

    static AffineExpr toAffine(SDBMExpr expr) {
        Objects.requireNonNull(expr, "SDBMAffineConverter.toAffine: expr 不能为 null");
        return switch (expr.getKind()) {
            case CONSTANT -> AffineExpr.constant(((SDBMConstantExpr) expr).getValue());
            case DIM -> AffineExpr.dim(((SDBMDimExpr) expr).getPosition());
            case SYMBOL -> AffineExpr.symbol(((SDBMSymbolExpr) expr).getPosition());
            case STRIPE -> {
                SDBMStripeExpr stripe = (SDBMStripeExpr) expr;
                long factor = stripe.getStripeFactor().getValue();
                yield toAffine(stripe.getVar()).floorDiv(factor).mul(factor);
            }
            case NEG -> toAffine(((SDBMNegExpr) expr).getVar()).mul(-1);
            case SUM -> {
                SDBMSumExpr sum = (SDBMSumExpr) expr;
                yield toAffine(sum.getLhs()).add(sum.getRhs().getValue());
            }
            case DIFF -> {
                SDBMDiffExpr diff = (SDBMDiffExpr) expr;
                yield toAffine(diff.getLhs()).add(toAffine(diff.getRhs()).mul(-1));
            }
        };
    }

    static Optional<SDBMExpr> fromAffine(SDBMContext context, AffineExpr affine) {
        Objects.requireNonNull(context, "SDBMAffineConverter.fromAffine: context 不能为 null");
        Objects.requireNonNull(affine, "SDBMAffineConverter.fromAffine: affine 不能为 null");
        Optional<SDBMExpr> result = convert(context, affine);
        if (result.isEmpty()) {
            logger.debug("SDBMAffineConverter.fromAffine: {} 不是 SDBM 表达式", affine);
        }
        return result;
    }

    private static Optional<SDBMExpr> convert(SDBMContext context, AffineExpr affine) {
        return switch (affine.getKind()) {
            case CONSTANT -> Optional.of(context.constant(((AffineConstantExpr) affine).getValue()));
            case DIM -> Optional.of(context.dim(((AffineDimExpr) affine).getPosition()));
            case SYMBOL -> Optional.of(context.symbol(((AffineSymbolExpr) affine).getPosition()));
            case ADD -> {
                AffineBinaryOpExpr add = (AffineBinaryOpExpr) affine;
                Optional<SDBMExpr> lhs = convert(context, add.getLhs());
                Optional<SDBMExpr> rhs = convert(context, add.getRhs());
                if (lhs.isEmpty() || rhs.isEmpty()) {
                    yield Optional.empty();
                }
                yield SDBMBuilder.tryAdd(lhs.get(), rhs.get());
            }
            case MUL -> convertMul(context, (AffineBinaryOpExpr) affine);
            // 单独出现的除法、取模以及任何 ceildiv 都不可表示
            case FLOOR_DIV, CEIL_DIV, MOD -> Optional.empty();
        };
    }

    private static Optional<SDBMExpr> convertMul(SDBMContext context, AffineBinaryOpExpr mul) {
        AffineExpr lhs = mul.getLhs();
        AffineExpr rhs = mul.getRhs();

        // C * (x floordiv C) 或 (x floordiv C) * C 即 x # C
        Optional<SDBMExpr> stripe = matchStripe(context, lhs, rhs);
        if (stripe.isEmpty()) {
            stripe = matchStripe(context, rhs, lhs);
        }
        if (stripe.isPresent()) {
            return stripe;
        }

        if (lhs.getKind() == AffineExprKind.CONSTANT && rhs.getKind() == AffineExprKind.CONSTANT) {
            long product = ((AffineConstantExpr) lhs).getValue() * ((AffineConstantExpr) rhs).getValue();
            return Optional.of(context.constant(product));
        }
        if (lhs.getKind() == AffineExprKind.CONSTANT) {
            return scale(context, rhs, ((AffineConstantExpr) lhs).getValue());
        }
        if (rhs.getKind() == AffineExprKind.CONSTANT) {
            return scale(context, lhs, ((AffineConstantExpr) rhs).getValue());
        }
        return Optional.empty();
    }

    /**
     * 只允许系数 1 与 -1；取反要求被取反的一侧是常数或 Positive 表达式。
     */
    private static Optional<SDBMExpr> scale(SDBMContext context, AffineExpr operand, long coefficient) {
        if (coefficient != 1 && coefficient != -1) {
            return Optional.empty();
        }
        Optional<SDBMExpr> converted = convert(context, operand);
        if (coefficient == 1 || converted.isEmpty()) {
            return converted;
        }
        SDBMExpr expr = converted.get();
        if (expr.getKind() == SDBMExprKind.CONSTANT) {
            return Optional.of(context.constant(-((SDBMConstantExpr) expr).getValue()));
        }
        if (expr.isPositive()) {
            return Optional.of(SDBMNegExpr.of(expr));
        }
        return Optional.empty();
    }

    private static Optional<SDBMExpr> matchStripe(SDBMContext context, AffineExpr factorSide, AffineExpr floorDivSide) {
        if (factorSide.getKind() != AffineExprKind.CONSTANT || floorDivSide.getKind() != AffineExprKind.FLOOR_DIV) {
            return Optional.empty();
        }
        long factor = ((AffineConstantExpr) factorSide).getValue();
        AffineBinaryOpExpr floorDiv = (AffineBinaryOpExpr) floorDivSide;
        if (factor <= 0 || !floorDiv.getRhs().isConstant(factor)) {
            return Optional.empty();
        }
        return convert(context, floorDiv.getLhs())
                .filter(SDBMExpr::isPositive)
                .<SDBMExpr>map(var -> SDBMStripeExpr.of(var, context.constant(factor)));
    }
}
