package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

public class AvgAggregator extends AbstractAggregator {

    public AvgAggregator(PivotNumeric numeric) {
        super(AggregateType.AVERAGE, numeric);
    }

    @Override
    public AggregationState createState() {
        return new AvgState(numeric);
    }

    private static final class AvgState implements AggregationState {
        private final PivotNumeric numeric;
        private double sum = 0;
        private long count = 0;

        AvgState(PivotNumeric numeric) {
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
            AvgState state = sameKind(this, other, AvgState.class);
            sum += state.sum;
            count += state.count;
        }

        @Override
        public Object getResult() {
            if(count == 0) {
                return null;
            }
            return sum / count;
        }
    }
}
