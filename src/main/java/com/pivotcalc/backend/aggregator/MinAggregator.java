package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

/**
 * 保留见过的最小可比较值，结果保持原始类型（字符串、日期等均可）。
 */
public class MinAggregator extends AbstractAggregator {

    public MinAggregator(PivotNumeric numeric) {
        super(AggregateType.MIN, numeric);
    }

    @Override
    public AggregationState createState() {
        return new MinState();
    }

    private static final class MinState implements AggregationState {
        private Object min;

        @Override
        public void add(Object value) {
            if(!(value instanceof Comparable)) {
                return;
            }
            if(min == null) {
                min = value;
                return;
            }
            Integer cmp = compareValues(value, min);
            if(cmp != null && cmp < 0) {
                min = value;
            }
        }

        @Override
        public void merge(AggregationState other) {
            MinState state = sameKind(this, other, MinState.class);
            if(state.min != null) {
                add(state.min);
            }
        }

        @Override
        public Object getResult() {
            return min;
        }
    }
}
