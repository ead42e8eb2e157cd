package com.pivotcalc.backend.aggregator;

import com.google.common.base.Preconditions;
import com.pivotcalc.backend.utils.PivotNumeric;
import com.pivotcalc.common.Error;

/**
 * 内置聚合器的公共部分：持有类型与数值转换器，并提供合并时的类型检查。
 */
public abstract class AbstractAggregator implements Aggregator {
    protected final AggregateType type;
    protected final PivotNumeric numeric;

    protected AbstractAggregator(AggregateType type, PivotNumeric numeric) {
        this.type = type;
        this.numeric = numeric == null ? PivotNumeric.DEFAULT : numeric;
    }

    @Override
    public AggregateType type() {
        return type;
    }

    @Override
    public String name() {
        return type.displayName();
    }

    @Override
    public String toString() {
        return name();
    }

    /**
     * 校验 other 与 self 为同一状态类，返回转型后的 other。
     */
    protected static <S extends AggregationState> S sameKind(AggregationState self, AggregationState other, Class<S> stateClass) {
        Preconditions.checkNotNull(other, "other");
        if(!stateClass.isInstance(other) || other.getClass() != self.getClass()) {
            throw Error.IncompatibleStateException;
        }
        return stateClass.cast(other);
    }

    /**
     * 比较两个值：两个 {@link Number} 按 double 比较；其余要求实现 {@link Comparable}
     * 且类型兼容，否则视为不可比较。
     *
     * @return 比较结果，不可比较时返回 null
     */
    @SuppressWarnings("unchecked")
    protected static Integer compareValues(Object left, Object right) {
        if(left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if(!(left instanceof Comparable) || !(right instanceof Comparable)) {
            return null;
        }
        if(!left.getClass().isInstance(right) && !right.getClass().isInstance(left)) {
            return null;
        }
        return ((Comparable<Object>) left).compareTo(right);
    }
}
