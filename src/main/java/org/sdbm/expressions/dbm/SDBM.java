package org.sdbm.expressions.dbm;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.sdbm.expressions.ToZ3BoolExpr;
import org.sdbm.expressions.sdbm.SDBMConstantExpr;
import org.sdbm.expressions.sdbm.SDBMContext;
import org.sdbm.expressions.sdbm.SDBMDiffExpr;
import org.sdbm.expressions.sdbm.SDBMExpr;
import org.sdbm.expressions.sdbm.SDBMExprKind;
import org.sdbm.expressions.sdbm.SDBMInputExpr;
import org.sdbm.expressions.sdbm.SDBMNegExpr;
import org.sdbm.expressions.sdbm.SDBMStripeExpr;
import org.sdbm.expressions.sdbm.SDBMSumExpr;
import org.sdbm.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 条带差分界限矩阵 (Striped Difference-Bound Matrix, SDBM)。
 * <p>
 * 矩阵的位置 (行/列) 依次为：零位置 0、用到的各个维度、用到的各个符号、以及每个不同的条带子表达式对应的临时变量。
 * 元素 (i, j) 存储使 x_i - x_j <= c 成立的最紧的常数 c；不存在的元素表示没有界。
 * 条带临时变量 t = x # C 由两个界 t - x <= 0 和 x - t <= C - 1 定义，其定义式记录在 stripeDefinitions 中。
 * <p>
 * 约定：不等式表达式 e 表示 e <= 0，等式表达式 e 表示 e == 0。
 * 此类是不可变的；可变状态只存在于构建过程中。
 * @author Ayalyt
 */
@Getter
public final class SDBM implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(SDBM.class);

    /** 零位置，代表常数 0 */
    public static final int ZERO_POSITION = 0;

    /** 位置 1..n 对应的项 (维度、符号、条带)，下标为 position - 1 */
    private final List<SDBMExpr> variables;

    /** 项到位置的映射 */
    private final Map<SDBMExpr, Integer> positionIndex;

    /** 条带临时变量的位置到其定义式的映射 */
    private final SortedMap<Integer, SDBMStripeExpr> stripeDefinitions;

    /** 稀疏边界矩阵，(i, j) -> c 表示 x_i - x_j <= c */
    private final Map<Pair<Integer, Integer>, Long> bounds;

    private final int numDims;
    private final int numSymbols;
    @Getter(AccessLevel.NONE)
    private final int hashCode;

    private SDBM(Assembler assembler) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(assembler.variables));
        this.positionIndex = Collections.unmodifiableMap(new HashMap<>(assembler.positionIndex));
        this.stripeDefinitions = Collections.unmodifiableSortedMap(new TreeMap<>(assembler.stripeDefinitions));
        this.bounds = Collections.unmodifiableMap(new HashMap<>(assembler.bounds));
        this.numDims = assembler.numDims;
        this.numSymbols = assembler.numSymbols;
        this.hashCode = Objects.hash(this.variables, this.bounds);
    }

    // --- 构建 ---

    /**
     * 由不等式 (expr <= 0) 与等式 (expr == 0) 列表构建 SDBM。
     * 每个表达式在条带替换为临时变量之后必须形如 x_i - x_j + c，其中 x_i、x_j 可以是零位置。
     * 同一元素上的多个界只保留最紧的一个，与插入顺序无关。
     *
     * @param inequalities 不等式列表。
     * @param equalities   等式列表。
     * @return 新的 SDBM 实例。
     * @throws IllegalArgumentException 如果某个表达式不是差分约束，或表达式来自不同的上下文。
     */
    public static SDBM get(List<SDBMExpr> inequalities, List<SDBMExpr> equalities) {
        Objects.requireNonNull(inequalities, "SDBM.get: inequalities 不能为 null");
        Objects.requireNonNull(equalities, "SDBM.get: equalities 不能为 null");
        List<SDBMExpr> all = new ArrayList<>(inequalities);
        all.addAll(equalities);
        for (SDBMExpr expr : all) {
            Objects.requireNonNull(expr, "SDBM.get: 约束列表中不能包含 null");
            if (expr.getContext() != all.get(0).getContext()) {
                logger.error("SDBM.get: 约束 {} 与 {} 属于不同的上下文", expr, all.get(0));
                throw new IllegalArgumentException("SDBM.get: 所有约束必须属于同一个上下文");
            }
        }

        Assembler assembler = new Assembler();
        assembler.registerInputs(all);
        for (SDBMExpr inequality : inequalities) {
            assembler.addInequality(inequality);
        }
        for (SDBMExpr equality : equalities) {
            assembler.addEquality(equality);
        }
        SDBM result = new SDBM(assembler);
        logger.debug("SDBM.get: 由 {} 个不等式和 {} 个等式构建了 {} 个位置 ({} 个条带临时变量) 的 SDBM",
                inequalities.size(), equalities.size(), result.getNumVariables(), result.stripeDefinitions.size());
        return result;
    }

    // --- 查询 ---

    /**
     * @return 矩阵的行 (列) 数，包括零位置。
     */
    public int getNumVariables() {
        return variables.size() + 1;
    }

    /**
     * 获取 x_row - x_col 的上界。
     * @return 上界，如果没有界则返回空。
     */
    public OptionalLong getBound(int row, int col) {
        checkPosition(row);
        checkPosition(col);
        Long value = bounds.get(Pair.of(row, col));
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    /**
     * 获取非零位置对应的项：维度、符号，或条带临时变量所代表的条带表达式。
     */
    public SDBMExpr getPositionTerm(int position) {
        if (position <= ZERO_POSITION || position >= getNumVariables()) {
            throw new IndexOutOfBoundsException("SDBM.getPositionTerm: 位置 " + position + " 越界：1.." + (getNumVariables() - 1));
        }
        return variables.get(position - 1);
    }

    public boolean isAuxiliary(int position) {
        return stripeDefinitions.containsKey(position);
    }

    /**
     * 左上角元素 (0, 0) 表示 0 <= c；c 为负时整个约束系统不可满足。
     */
    public boolean isTriviallyInfeasible() {
        Long value = bounds.get(Pair.of(ZERO_POSITION, ZERO_POSITION));
        return value != null && value < 0;
    }

    // --- 提取 ---

    /**
     * 将矩阵分解为最少的等式与不等式列表。
     * <p>
     * 一对互为相反数的元素 (i, j) = c 与 (j, i) = -c 合并为一个等式 x_i - x_j - c == 0，
     * 其余的有限元素各产生一个不等式 x_i - x_j - c <= 0。
     * 条带临时变量被替换为其定义的条带表达式，由条带定义本身蕴含的界不会出现在结果中。
     *
     * @param context 用于构造结果表达式的上下文，必须是构建此 SDBM 时所用的上下文。
     * @return 等式与不等式列表。
     */
    public SDBMExpressions getSDBMExpressions(SDBMContext context) {
        Objects.requireNonNull(context, "SDBM.getSDBMExpressions: context 不能为 null");
        if (!variables.isEmpty() && variables.get(0).getContext() != context) {
            throw new IllegalArgumentException("SDBM.getSDBMExpressions: 上下文 " + context
                    + " 与构建 SDBM 时的上下文 " + variables.get(0).getContext() + " 不一致");
        }
        List<SDBMExpr> inequalities = new ArrayList<>();
        List<SDBMExpr> equalities = new ArrayList<>();

        if (isTriviallyInfeasible()) {
            long value = bounds.get(Pair.of(ZERO_POSITION, ZERO_POSITION));
            logger.debug("SDBM.getSDBMExpressions: 约束系统不可满足 (0 <= {})", value);
            inequalities.add(context.constant(-value));
            return new SDBMExpressions(inequalities, equalities);
        }

        int size = getNumVariables();
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                Long direct = bounds.get(Pair.of(i, j));
                Long reverse = bounds.get(Pair.of(j, i));
                boolean directImplied = direct != null && isImpliedByStripe(i, j, direct);
                boolean reverseImplied = reverse != null && isImpliedByStripe(j, i, reverse);

                if (direct != null && reverse != null && direct == -reverse) {
                    if (!directImplied || !reverseImplied) {
                        equalities.add(buildDifference(context, i, j, direct));
                    }
                    continue;
                }
                if (direct != null && !directImplied) {
                    inequalities.add(buildDifference(context, i, j, direct));
                }
                if (reverse != null && !reverseImplied) {
                    inequalities.add(buildDifference(context, j, i, reverse));
                }
            }
        }
        logger.debug("SDBM.getSDBMExpressions: 提取出 {} 个不等式和 {} 个等式", inequalities.size(), equalities.size());
        return new SDBMExpressions(inequalities, equalities);
    }

    /**
     * 判断元素 (row, col) = value 是否已被某个条带临时变量的定义蕴含。
     */
    private boolean isImpliedByStripe(int row, int col, long value) {
        SDBMStripeExpr rowStripe = stripeDefinitions.get(row);
        if (rowStripe != null && positionIndex.get(rowStripe.getVar()) == col && value >= 0) {
            return true; // t - x <= 0
        }
        SDBMStripeExpr colStripe = stripeDefinitions.get(col);
        return colStripe != null && positionIndex.get(colStripe.getVar()) == row
                && value >= colStripe.getStripeFactor().getValue() - 1; // x - t <= C - 1
    }

    /**
     * x_row - x_col - value
     */
    private SDBMExpr buildDifference(SDBMContext context, int row, int col, long value) {
        SDBMExpr difference = term(context, row).subtract(term(context, col));
        return difference.add(-value);
    }

    private SDBMExpr term(SDBMContext context, int position) {
        return position == ZERO_POSITION ? context.constant(0) : variables.get(position - 1);
    }

    private ArithExpr<IntSort> z3Term(Context ctx, Z3VariableManager varManager, int position) {
        return position == ZERO_POSITION ? ctx.mkInt(0) : variables.get(position - 1).toZ3ArithExpr(ctx, varManager);
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= getNumVariables()) {
            throw new IndexOutOfBoundsException("SDBM: 位置 " + position + " 越界：" + getNumVariables());
        }
    }

    // --- Z3 转换 ---

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        List<BoolExpr> z3Bounds = new ArrayList<>();
        for (Map.Entry<Pair<Integer, Integer>, Long> entry : bounds.entrySet()) {
            int row = entry.getKey().getLeft();
            int col = entry.getKey().getRight();
            ArithExpr<IntSort> difference = ctx.mkSub(z3Term(ctx, varManager, row), z3Term(ctx, varManager, col));
            z3Bounds.add(ctx.mkLe(difference, ctx.mkInt(entry.getValue())));
        }
        if (z3Bounds.isEmpty()) {
            return ctx.mkTrue(); // 空 SDBM 表示恒真
        }
        return ctx.mkAnd(z3Bounds.toArray(new BoolExpr[0]));
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SDBM sdbm = (SDBM) o;
        return variables.equals(sdbm.variables) && bounds.equals(sdbm.bounds);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        int size = getNumVariables();
        List<String> names = new ArrayList<>(size);
        names.add("0");
        for (int i = 1; i < size; i++) {
            names.add(isAuxiliary(i) ? "t" + i : variables.get(i - 1).toString());
        }
        int maxNameWidth = names.stream().mapToInt(String::length).max().orElse(1);
        int elementWidth = Math.max(6, maxNameWidth);

        StringBuilder sb = new StringBuilder();
        // 列标题
        sb.append(String.format("%" + maxNameWidth + "s |", ""));
        for (String name : names) {
            sb.append(String.format(" %-" + elementWidth + "s", name));
        }
        sb.append('\n');

        // 分隔线
        sb.append("-".repeat(maxNameWidth + 1));
        sb.append("+");
        sb.append("-".repeat((elementWidth + 1) * size));
        sb.append('\n');

        // 行
        for (int i = 0; i < size; i++) {
            sb.append(String.format("%" + maxNameWidth + "s |", names.get(i)));
            for (int j = 0; j < size; j++) {
                Long value = bounds.get(Pair.of(i, j));
                sb.append(String.format(" %-" + elementWidth + "s", value == null ? "∞" : value.toString()));
            }
            sb.append('\n');
        }
        for (Map.Entry<Integer, SDBMStripeExpr> definition : stripeDefinitions.entrySet()) {
            sb.append("t").append(definition.getKey()).append(" = ").append(definition.getValue()).append('\n');
        }
        return sb.toString();
    }

    /**
     * x_plus - x_minus + constant，plus / minus 为零位置时表示该侧没有变量。
     */
    private static final class DifferenceForm {
        private final int plus;
        private final int minus;
        private final long constant;

        private DifferenceForm(int plus, int minus, long constant) {
            this.plus = plus;
            this.minus = minus;
            this.constant = constant;
        }

        private DifferenceForm negate() {
            return new DifferenceForm(minus, plus, -constant);
        }

        private DifferenceForm shift(long value) {
            return new DifferenceForm(plus, minus, constant + value);
        }

        private DifferenceForm combine(DifferenceForm other, SDBMExpr source) {
            List<Integer> positive = new ArrayList<>(2);
            List<Integer> negative = new ArrayList<>(2);
            addVariable(positive, plus);
            addVariable(positive, other.plus);
            addVariable(negative, minus);
            addVariable(negative, other.minus);
            // 同一位置正负抵消
            for (Iterator<Integer> it = positive.iterator(); it.hasNext(); ) {
                if (negative.remove(it.next())) {
                    it.remove();
                }
            }
            if (positive.size() > 1 || negative.size() > 1) {
                logger.error("SDBM: 约束 {} 不是差分约束，包含正项 {} 与负项 {}", source, positive, negative);
                throw new IllegalArgumentException("SDBM: 约束 " + source + " 不是差分约束");
            }
            return new DifferenceForm(
                    positive.isEmpty() ? ZERO_POSITION : positive.get(0),
                    negative.isEmpty() ? ZERO_POSITION : negative.get(0),
                    constant + other.constant);
        }

        private static void addVariable(List<Integer> positions, int position) {
            if (position != ZERO_POSITION) {
                positions.add(position);
            }
        }

        private boolean isConstant() {
            return plus == ZERO_POSITION && minus == ZERO_POSITION;
        }
    }

    /**
     * 构建过程中的可变状态，构建完成后即被丢弃。
     */
    private static final class Assembler {
        private final List<SDBMExpr> variables = new ArrayList<>();
        private final Map<SDBMExpr, Integer> positionIndex = new HashMap<>();
        private final SortedMap<Integer, SDBMStripeExpr> stripeDefinitions = new TreeMap<>();
        private final Map<Pair<Integer, Integer>, Long> bounds = new HashMap<>();
        private int numDims;
        private int numSymbols;

        /**
         * 维度按位置升序排在前面，然后是符号。
         */
        private void registerInputs(List<SDBMExpr> exprs) {
            SortedMap<Integer, SDBMExpr> dims = new TreeMap<>();
            SortedMap<Integer, SDBMExpr> symbols = new TreeMap<>();
            for (SDBMExpr expr : exprs) {
                expr.walk(sub -> {
                    if (sub.getKind() == SDBMExprKind.DIM) {
                        dims.put(((SDBMInputExpr) sub).getPosition(), sub);
                    } else if (sub.getKind() == SDBMExprKind.SYMBOL) {
                        symbols.put(((SDBMInputExpr) sub).getPosition(), sub);
                    }
                });
            }
            dims.values().forEach(this::newPosition);
            symbols.values().forEach(this::newPosition);
            this.numDims = dims.size();
            this.numSymbols = symbols.size();
        }

        private int newPosition(SDBMExpr term) {
            variables.add(term);
            int position = variables.size();
            positionIndex.put(term, position);
            return position;
        }

        /**
         * 获取 Positive 表达式的位置；条带第一次出现时为其分配临时变量并插入定义的界。
         */
        private int positionOf(SDBMExpr term) {
            Integer existing = positionIndex.get(term);
            if (existing != null) {
                return existing;
            }
            SDBMStripeExpr stripe = (SDBMStripeExpr) term;
            int varPosition = positionOf(stripe.getVar());
            int position = newPosition(stripe);
            stripeDefinitions.put(position, stripe);
            // t = x # C 等价于 t <= x <= t + C - 1
            tighten(position, varPosition, 0);
            tighten(varPosition, position, stripe.getStripeFactor().getValue() - 1);
            logger.debug("SDBM: 为条带 {} 分配临时变量 t{}", stripe, position);
            return position;
        }

        private DifferenceForm linearize(SDBMExpr expr) {
            return switch (expr.getKind()) {
                case CONSTANT -> new DifferenceForm(ZERO_POSITION, ZERO_POSITION, ((SDBMConstantExpr) expr).getValue());
                case DIM, SYMBOL, STRIPE -> new DifferenceForm(positionOf(expr), ZERO_POSITION, 0);
                case NEG -> linearize(((SDBMNegExpr) expr).getVar()).negate();
                case SUM -> {
                    SDBMSumExpr sum = (SDBMSumExpr) expr;
                    yield linearize(sum.getLhs()).shift(sum.getRhs().getValue());
                }
                case DIFF -> {
                    SDBMDiffExpr diff = (SDBMDiffExpr) expr;
                    yield linearize(diff.getLhs()).combine(linearize(diff.getRhs()).negate(), expr);
                }
            };
        }

        /**
         * x_p - x_m + c <= 0  =>  x_p - x_m <= -c
         */
        private void addInequality(SDBMExpr expr) {
            DifferenceForm form = linearize(expr);
            if (form.isConstant()) {
                if (form.constant > 0) {
                    logger.warn("SDBM: 不等式 {} <= 0 恒假", expr);
                    tighten(ZERO_POSITION, ZERO_POSITION, -form.constant);
                }
                return;
            }
            tighten(form.plus, form.minus, -form.constant);
        }

        /**
         * x_p - x_m + c == 0  =>  x_p - x_m <= -c 且 x_m - x_p <= c
         */
        private void addEquality(SDBMExpr expr) {
            DifferenceForm form = linearize(expr);
            if (form.isConstant()) {
                if (form.constant != 0) {
                    logger.warn("SDBM: 等式 {} == 0 恒假", expr);
                    tighten(ZERO_POSITION, ZERO_POSITION, -Math.abs(form.constant));
                }
                return;
            }
            tighten(form.plus, form.minus, -form.constant);
            tighten(form.minus, form.plus, form.constant);
        }

        private void tighten(int row, int col, long value) {
            bounds.merge(Pair.of(row, col), value, Math::min);
        }
    }
}
