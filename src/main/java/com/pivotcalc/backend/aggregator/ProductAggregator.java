package com.pivotcalc.backend.aggregator;

import com.pivotcalc.backend.utils.PivotNumeric;

public class ProductAggregator extends AbstractAggregator {

    public ProductAggregator(PivotNumeric numeric) {
        super(AggregateType.PRODUCT, numeric);
    }

    @Override
    public AggregationState createState() {
        return new ProductState(numeric);
    }

    private static final class ProductState implements AggregationState {
        private final PivotNumeric numeric;
        private double product = 1d;
        private long count = 0;

        ProductState(PivotNumeric numeric) {
            this.numeric = numeric;
        }

        @Override
        public void add(Object value) {
            Double v = numeric.toDouble(value);
            if(v != null) {
                product *= v;
                count++;
            }
        }

        @Override
        public void merge(AggregationState other) {
            ProductState state = sameKind(this, other, ProductState.class);
            // 空状态的乘积是 1，但不能把它当成一次有效输入
            if(state.count > 0) {
                product *= state.product;
                count += state.count;
            }
        }

        @Override
        public Object getResult() {
            return count == 0 ? null : product;
        }
    }
}
