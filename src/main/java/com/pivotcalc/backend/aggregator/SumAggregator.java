package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

public class SumAggregator extends AbstractAggregator {

    public SumAggregator(PivotNumeric numeric) {
        super(AggregateType.SUM, numeric);
    }

    @Override
    public AggregationState createState() {
        return new SumState(numeric);
    }

    private static final class SumState implements AggregationState {
        private final PivotNumeric numeric;
        private double sum = 0;
        private long count = 0;

        SumState(PivotNumeric numeric) {
            this.numeric = numeric;
        }

        @Override
        public void add(Object value) {
            Double v = numeric.toDouble(value);
            if(v != null) {
                sum += v;
                count++;
            }
        }

        @Override
        public void merge(AggregationState other) {
            SumState state = sameKind(this, other, SumState.class);
            sum += state.sum;
            count += state.count;
        }

        @Override
        public Object getResult() {
            return count == 0 ? null : sum;
        }
    }
}
