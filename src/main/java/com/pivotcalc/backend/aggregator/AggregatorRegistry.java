package com.pivotcalc.backend.aggregator;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pivotcalc.backend.utils.PivotNumeric;
import com.pivotcalc.common.Error;

/**
 * 聚合类型 -> 聚合器 的注册表。
 * <p>
 * 构造时注册全部 14 个内置聚合器，允许调用方按类型覆盖或补充自定义聚合器；
 * 查询未注册的类型返回 null，由调用方回退到值字段上直接提供的自定义聚合器。
 */
public class AggregatorRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregatorRegistry.class);

    private final Map<AggregateType, Aggregator> aggregators = new EnumMap<>(AggregateType.class);
    private final PivotNumeric numeric;

    public AggregatorRegistry() {
        this(PivotNumeric.DEFAULT);
    }

    public AggregatorRegistry(PivotNumeric numeric) {
        this.numeric = numeric == null ? PivotNumeric.DEFAULT : numeric;
        register(new SumAggregator(this.numeric));
        register(new CountAggregator(this.numeric));
        register(new AvgAggregator(this.numeric));
        register(new MinAggregator(this.numeric));
        register(new MaxAggregator(this.numeric));
        register(new ProductAggregator(this.numeric));
        register(new CountNumbersAggregator(this.numeric));
        register(new CountDistinctAggregator(this.numeric));
        register(new StdDevAggregator(false, this.numeric));
        register(new StdDevAggregator(true, this.numeric));
        register(new VarianceAggregator(false, this.numeric));
        register(new VarianceAggregator(true, this.numeric));
        register(new FirstAggregator(this.numeric));
        register(new LastAggregator(this.numeric));
    }

    public void register(Aggregator aggregator) {
        if(aggregator == null || aggregator.type() == null) {
            throw Error.NullAggregatorException;
        }
        Aggregator previous = aggregators.put(aggregator.type(), aggregator);
        if(previous != null && previous != aggregator) {
            LOGGER.debug("Aggregator for {} replaced: {} -> {}", aggregator.type(), previous.name(), aggregator.name());
        }
    }

    public Aggregator get(AggregateType type) {
        if(type == null) {
            return null;
        }
        return aggregators.get(type);
    }

    public PivotNumeric getNumeric() {
        return numeric;
    }
}
