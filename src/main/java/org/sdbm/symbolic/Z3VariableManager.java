package org.sdbm.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理维度、符号位置到 Z3 整数变量的映射。
 * 确保每个维度/符号在 Z3 Context 中有唯一的对应 Z3 变量。
 * SDBM 表达式与仿射表达式共用同一套命名 (d0, d1, ..., s0, s1, ...)，因此两者可以在同一个求解器中比较。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 HashMap 存储映射，Z3 Context 本身不是线程安全的，此实例也不跨线程共享
    private final Map<Integer, IntExpr> dimZ3Vars;
    private final Map<Integer, IntExpr> symbolZ3Vars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.dimZ3Vars = new HashMap<>();
        this.symbolZ3Vars = new HashMap<>();
        logger.debug("Z3VariableManager 初始化完成。");
    }

    /**
     * 获取指定维度位置对应的 Z3 整数变量。
     * 如果变量尚未创建，则会创建并缓存。
     * @param position 维度位置。
     * @return 对应的 Z3 IntExpr 变量。
     */
    public IntExpr getDimVar(int position) {
        return dimZ3Vars.computeIfAbsent(position, p -> {
            logger.debug("创建 Z3 维度变量: d{}", p);
            return ctx.mkIntConst("d" + p);
        });
    }

    /**
     * 获取指定符号位置对应的 Z3 整数变量。
     * 如果变量尚未创建，则会创建并缓存。
     * @param position 符号位置。
     * @return 对应的 Z3 IntExpr 变量。
     */
    public IntExpr getSymbolVar(int position) {
        return symbolZ3Vars.computeIfAbsent(position, p -> {
            logger.debug("创建 Z3 符号变量: s{}", p);
            return ctx.mkIntConst("s" + p);
        });
    }
}
