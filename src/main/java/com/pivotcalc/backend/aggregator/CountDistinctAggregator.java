package com.pivotcalc.backend.aggregator;

import java.util.HashSet;
import java.util.Set;

import com.pivotcalc.backend.utils.PivotNumeric;

public class CountDistinctAggregator extends AbstractAggregator {

    public CountDistinctAggregator(PivotNumeric numeric) {
        super(AggregateType.COUNT_DISTINCT, numeric);
    }

    @Override
    public AggregationState createState() {
        return new CountDistinctState();
    }

    private static final class CountDistinctState implements AggregationState {
        private final Set<Object> values = new HashSet<>();

        @Override
        public void add(Object value) {
            if(value != null) {
                values.add(value);
            }
        }

        @Override
        public void merge(AggregationState other) {
            values.addAll(sameKind(this, other, CountDistinctState.class).values);
        }

        @Override
        public Object getResult() {
            return (long) values.size();
        }
    }
}
