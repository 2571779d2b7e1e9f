package org.sdbm.expressions.sdbm;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 输入变量 (维度或符号) 的公共基类。维度与符号的位置是两个互相独立的命名空间。
 */
@Getter
public abstract class SDBMInputExpr extends SDBMExpr {

    private final int position;

    SDBMInputExpr(SDBMContext context, SDBMExprKind kind, int position, int hashCode) {
        super(context, kind, hashCode);
        this.position = position;
    }

    static void checkPosition(int position, String operation) {
        if (position < 0) {
            throw new IllegalArgumentException(operation + ": 位置必须是非负整数，实际为 " + position);
        }
    }

    @Override
    public List<SDBMExpr> getOperands() {
        return Collections.emptyList();
    }
}
