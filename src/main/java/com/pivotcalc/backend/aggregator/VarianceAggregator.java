package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;
import com.pivotcalc.common.Error;

/**
 * 方差聚合器，单遍 Welford 累加，合并使用 Chan 的并行方差公式：
 * <pre>
 *     n    = n_a + n_b
 *     d    = mean_b - mean_a
 *     M2   = M2_a + M2_b + d * d * n_a * n_b / n
 *     mean = (mean_a * n_a + mean_b * n_b) / n
 * </pre>
 * 样本方差为 M2 / (n - 1)（n &gt; 1），总体方差为 M2 / n（n &ge; 1）。
 */
public class VarianceAggregator extends AbstractAggregator {
    private final boolean population;

    public VarianceAggregator(boolean population, PivotNumeric numeric) {
        super(population ? AggregateType.VARIANCE_P : AggregateType.VARIANCE, numeric);
        this.population = population;
    }

    @Override
    public AggregationState createState() {
        return new VarianceState(population, numeric);
    }

    static final class VarianceState implements AggregationState {
        private final boolean population;
        private final PivotNumeric numeric;
        private long count;
        private double mean;
        private double m2;

        VarianceState(boolean population, PivotNumeric numeric) {
            this.population = population;
            this.numeric = numeric;
        }

        @Override
        public void add(Object value) {
            Double v = numeric.toDouble(value);
            if(v == null) {
                return;
            }
            count++;
            double delta = v - mean;
            mean += delta / count;
            double delta2 = v - mean;
            m2 += delta * delta2;
        }

        @Override
        public void merge(AggregationState other) {
            VarianceState state = sameKind(this, other, VarianceState.class);
            mergeFrom(state);
        }

        void mergeFrom(VarianceState state) {
            if(state.population != population) {
                throw Error.IncompatibleStateException;
            }
            if(state.count == 0) {
                return;
            }
            if(count == 0) {
                count = state.count;
                mean = state.mean;
                m2 = state.m2;
                return;
            }
            long total = count + state.count;
            double delta = state.mean - mean;
            m2 += state.m2 + delta * delta * count * state.count / total;
            mean = (mean * count + state.mean * state.count) / total;
            count = total;
        }

        @Override
        public Object getResult() {
            if(count == 0) {
                return null;
            }
            if(population) {
                return m2 / count;
            }
            return count > 1 ? m2 / (count - 1) : null;
        }
    }
}
