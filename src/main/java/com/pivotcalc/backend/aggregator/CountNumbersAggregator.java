package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

/**
 * 只统计能转换为数值的值。
 */
public class CountNumbersAggregator extends AbstractAggregator {

    public CountNumbersAggregator(PivotNumeric numeric) {
        super(AggregateType.COUNT_NUMBERS, numeric);
    }

    @Override
    public AggregationState createState() {
        return new CountNumbersState(numeric);
    }

    private static final class CountNumbersState implements AggregationState {
        private final PivotNumeric numeric;
        private long count = 0;

        CountNumbersState(PivotNumeric numeric) {
            this.numeric = numeric;
        }

        @Override
        public void add(Object value) {
            if(numeric.isNumber(value)) {
                count++;
            }
        }

        @Override
        public void merge(AggregationState other) {
            count += sameKind(this, other, CountNumbersState.class).count;
        }

        @Override
        public Object getResult() {
            return count;
        }
    }
}
