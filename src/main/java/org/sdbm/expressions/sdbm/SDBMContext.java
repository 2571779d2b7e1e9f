package org.sdbm.expressions.sdbm;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SDBM 表达式的唯一化上下文 (hash-consing 存储)。
 * 同一上下文中，变体标签与字段都相同的表达式只存在一个实例，因此表达式的相等性就是引用相等。
 * 所有表达式的生命周期与其所属的上下文一致。
 * 此类是线程安全的：创建新表达式由 ConcurrentHashMap.computeIfAbsent 串行化。
 * @author Ayalyt
 */
public final class SDBMContext {

    private static final Logger logger = LoggerFactory.getLogger(SDBMContext.class);

    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    /** 唯一化表，键为 [kind, field1, field2, ...] */
    private final ConcurrentHashMap<List<Object>, SDBMExpr> uniquer = new ConcurrentHashMap<>(256);

    @Getter
    private final int id;

    public SDBMContext() {
        this.id = NEXT_ID.getAndIncrement();
        logger.info("创建了一个 SDBMContext: #{}", id);
    }

    // --- 便捷工厂方法 ---

    public SDBMConstantExpr constant(long value) {
        return SDBMConstantExpr.of(this, value);
    }

    public SDBMDimExpr dim(int position) {
        return SDBMDimExpr.of(this, position);
    }

    public SDBMSymbolExpr symbol(int position) {
        return SDBMSymbolExpr.of(this, position);
    }

    /**
     * 返回 (kind, fields) 对应的唯一表达式实例，首次请求时创建。
     * 字段必须已经是规范形式：子表达式来自本上下文，数值字段已通过合法性检查。
     *
     * @param kind   变体标签。
     * @param fields 变体的字段值，顺序与各变体的构造函数一致。
     * @return 唯一的表达式实例。
     */
    SDBMExpr intern(SDBMExprKind kind, Object... fields) {
        List<Object> key = cacheKey(kind, fields);
        SDBMExpr cached = uniquer.get(key);
        if (cached != null) {
            return cached;
        }
        return uniquer.computeIfAbsent(key, k -> {
            SDBMExpr created = create(kind, fields);
            logger.debug("SDBMContext #{}: 创建了一个新的 {} 表达式: {}", id, kind.getSymbol(), created);
            return created;
        });
    }

    /**
     * @return 当前已唯一化的表达式数量。
     */
    public int size() {
        return uniquer.size();
    }

    private static List<Object> cacheKey(SDBMExprKind kind, Object[] fields) {
        List<Object> key = new ArrayList<>(fields.length + 1);
        key.add(kind);
        Collections.addAll(key, fields);
        return Collections.unmodifiableList(key);
    }

    private SDBMExpr create(SDBMExprKind kind, Object[] fields) {
        return switch (kind) {
            case CONSTANT -> new SDBMConstantExpr(this, (Long) fields[0]);
            case DIM -> new SDBMDimExpr(this, (Integer) fields[0]);
            case SYMBOL -> new SDBMSymbolExpr(this, (Integer) fields[0]);
            case STRIPE -> new SDBMStripeExpr(this, (SDBMExpr) fields[0], (SDBMConstantExpr) fields[1]);
            case NEG -> new SDBMNegExpr(this, (SDBMExpr) fields[0]);
            case SUM -> new SDBMSumExpr(this, (SDBMExpr) fields[0], (SDBMConstantExpr) fields[1]);
            case DIFF -> new SDBMDiffExpr(this, (SDBMExpr) fields[0], (SDBMExpr) fields[1]);
        };
    }

    @Override
    public String toString() {
        return "SDBMContext#" + id;
    }
}
