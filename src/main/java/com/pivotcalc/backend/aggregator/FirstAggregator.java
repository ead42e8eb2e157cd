package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

public class FirstAggregator extends AbstractAggregator {

    public FirstAggregator(PivotNumeric numeric) {
        super(AggregateType.FIRST, numeric);
    }

    @Override
    public AggregationState createState() {
        return new FirstState();
    }

    private static final class FirstState implements AggregationState {
        private Object value;

        @Override
        public void add(Object v) {
            if(value == null && v != null) {
                value = v;
            }
        }

        @Override
        public void merge(AggregationState other) {
            FirstState state = sameKind(this, other, FirstState.class);
            // 自身已有值时保持不变，合并顺序即"先来后到"
            if(value == null) {
                value = state.value;
            }
        }

        @Override
        public Object getResult() {
            return value;
        }
    }
}
