package com.pivotcalc.backend.aggregator;

/**
 * 单个 (值字段, 单元格) 的聚合状态。
 * <p>
 * 构建阶段只调用 {@link #add} 与 {@link #merge}；构建完成后只读。
 * 任意切分原始值序列、分别累加再合并，结果应与单次累加一致
 * （计数、求和精确一致，方差类在浮点误差内一致）。
 */
public interface AggregationState {
    /** 每个原始值调用一次 */
    void add(Object value);

    /**
     * 合并同类型聚合器产生的另一个状态。
     *
     * @throws IllegalArgumentException 两个状态不属于同一种聚合类型
     */
    void merge(AggregationState other);

    /** 聚合结果，没有有效输入时为 null（计数类返回 0）。多次调用结果相同。 */
    Object getResult();
}
