package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

/**
 * 统计非 null 值的个数，不要求可转为数值。
 */
public class CountAggregator extends AbstractAggregator {

    public CountAggregator(PivotNumeric numeric) {
        super(AggregateType.COUNT, numeric);
    }

    @Override
    public AggregationState createState() {
        return new CountState();
    }

    private static final class CountState implements AggregationState {
        private long count = 0;

        @Override
        public void add(Object value) {
            if(value != null) {
                count++;
            }
        }

        @Override
        public void merge(AggregationState other) {
            count += sameKind(this, other, CountState.class).count;
        }

        @Override
        public Object getResult() {
            return count;
        }
    }
}
