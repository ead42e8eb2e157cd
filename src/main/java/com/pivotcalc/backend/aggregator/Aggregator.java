package com.pivotcalc.backend.aggregator;

/**
 * 聚合器接口：描述一种聚合类型，并为每个透视单元格创建独立的可合并状态。
 */
public interface Aggregator {
    /** 聚合类型，注册表按它索引 */
    AggregateType type();

    /** 展示名称，如 Sum、Distinct Count */
    String name();

    /** 创建一个空的聚合状态 */
    AggregationState createState();
}
