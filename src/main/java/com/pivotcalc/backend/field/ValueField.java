package com.pivotcalc.backend.field;

import com.pivotcalc.backend.aggregator.AggregateType;
import com.pivotcalc.backend.aggregator.Aggregator;
import com.pivotcalc.backend.aggregator.AggregatorRegistry;

/**
 * 值字段：透视单元格里展示的一个度量。
 * <p>
 * 没有公式（或公式编译失败）时是普通字段，直接读取聚合结果；
 * 公式编译成功时是计算字段，结果由公式求值得到。
 */
public class ValueField {
    private final String key;
    private final String header;
    private final AggregateType aggregateType;
    private final Aggregator customAggregator;
    private final String formula;
    private final ValueDisplayMode displayMode;

    private ValueField(Builder builder) {
        this.key = builder.key;
        this.header = builder.header;
        this.aggregateType = builder.aggregateType;
        this.customAggregator = builder.customAggregator;
        this.formula = builder.formula;
        this.displayMode = builder.displayMode == null ? ValueDisplayMode.VALUE : builder.displayMode;
    }

    public static Builder builder(String key) {
        return new Builder().key(key);
    }

    public static ValueField of(String key, AggregateType type) {
        return builder(key).aggregate(type).build();
    }

    public static ValueField calculated(String key, String formula) {
        return builder(key).formula(formula).build();
    }

    /**
     * 解析该字段使用的聚合器：自定义聚合器优先于聚合类型；
     * 两者都无法解析时返回 null，该字段在所有单元格中都没有值。
     */
    public Aggregator resolveAggregator(AggregatorRegistry registry) {
        if(customAggregator != null) {
            return customAggregator;
        }
        if(aggregateType == null || aggregateType == AggregateType.CUSTOM || registry == null) {
            return null;
        }
        return registry.get(aggregateType);
    }

    /** 是否声明了公式（是否编译成功由求值器决定） */
    public boolean hasFormula() {
        return formula != null && !formula.isBlank();
    }

    /** 展示名称：优先 header，其次 key */
    public String displayName() {
        if(header != null && !header.isBlank()) {
            return header;
        }
        return key == null ? "" : key;
    }

    public String getKey() {
        return key;
    }

    public String getHeader() {
        return header;
    }

    public AggregateType getAggregateType() {
        return aggregateType;
    }

    public Aggregator getCustomAggregator() {
        return customAggregator;
    }

    public String getFormula() {
        return formula;
    }

    public ValueDisplayMode getDisplayMode() {
        return displayMode;
    }

    @Override
    public String toString() {
        return "ValueField(" + displayName() + ")";
    }

    public static class Builder {
        private String key;
        private String header;
        private AggregateType aggregateType = AggregateType.SUM;
        private Aggregator customAggregator;
        private String formula;
        private ValueDisplayMode displayMode = ValueDisplayMode.VALUE;

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder header(String header) {
            this.header = header;
            return this;
        }

        public Builder aggregate(AggregateType aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder customAggregator(Aggregator customAggregator) {
            this.customAggregator = customAggregator;
            return this;
        }

        public Builder formula(String formula) {
            this.formula = formula;
            return this;
        }

        public Builder displayMode(ValueDisplayMode displayMode) {
            this.displayMode = displayMode;
            return this;
        }

        public ValueField build() {
            return new ValueField(this);
        }
    }
}
