package com.pivotcalc.backend.formula;

/**
 * 公式执行时解析字段引用与合计函数的回调，由求值上下文实现。
 * 所有方法返回 null 表示没有值。
 */
public interface FormulaContext {
    Object resolveValue(int valueIndex);

    Object resolveRowTotal(int valueIndex);

    Object resolveColumnTotal(int valueIndex);

    Object resolveGrandTotal(int valueIndex);

    Object resolveParentRowTotal(int valueIndex);

    Object resolveParentColumnTotal(int valueIndex);

    /** 把解析到的值转换为数值，无法转换返回 null */
    Double toNumber(Object value);
}
