package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

public class LastAggregator extends AbstractAggregator {

    public LastAggregator(PivotNumeric numeric) {
        super(AggregateType.LAST, numeric);
    }

    @Override
    public AggregationState createState() {
        return new LastState();
    }

    private static final class LastState implements AggregationState {
        private Object value;

        @Override
        public void add(Object v) {
            if(v != null) {
                value = v;
            }
        }

        @Override
        public void merge(AggregationState other) {
            LastState state = sameKind(this, other, LastState.class);
            if(state.value != null) {
                value = state.value;
            }
        }

        @Override
        public Object getResult() {
            return value;
        }
    }
}
