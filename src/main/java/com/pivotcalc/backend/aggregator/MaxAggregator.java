package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

/**
 * 保留见过的最大可比较值，结果保持原始类型（字符串、日期等均可）。
 */
public class MaxAggregator extends AbstractAggregator {

    public MaxAggregator(PivotNumeric numeric) {
        super(AggregateType.MAX, numeric);
    }

    @Override
    public AggregationState createState() {
        return new MaxState();
    }

    private static final class MaxState implements AggregationState {
        private Object max;

        @Override
        public void add(Object value) {
            if(!(value instanceof Comparable)) {
                return;
            }
            if(max == null) {
                max = value;
                return;
            }
            Integer cmp = compareValues(value, max);
            if(cmp != null && cmp > 0) {
                max = value;
            }
        }

        @Override
        public void merge(AggregationState other) {
            MaxState state = sameKind(this, other, MaxState.class);
            if(state.max != null) {
                add(state.max);
            }
        }

        @Override
        public Object getResult() {
            return max;
        }
    }
}
