package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

/**
 * 标准差聚合器，累加与合并全部委托给对应的方差状态，结果取平方根。
 */
public class StdDevAggregator extends AbstractAggregator {
    private final boolean population;

    public StdDevAggregator(boolean population, PivotNumeric numeric) {
        super(population ? AggregateType.STD_DEV_P : AggregateType.STD_DEV, numeric);
        this.population = population;
    }

    @Override
    public AggregationState createState() {
        return new StdDevState(population, numeric);
    }

    private static final class StdDevState implements AggregationState {
        private final VarianceAggregator.VarianceState variance;

        StdDevState(boolean population, PivotNumeric numeric) {
            this.variance = new VarianceAggregator.VarianceState(population, numeric);
        }

        @Override
        public void add(Object value) {
            variance.add(value);
        }

        @Override
        public void merge(AggregationState other) {
            variance.mergeFrom(sameKind(this, other, StdDevState.class).variance);
        }

        @Override
        public Object getResult() {
            Object v = variance.getResult();
            if(v == null) {
                return null;
            }
            return Math.sqrt((Double) v);
        }
    }
}
