package com.pivotcalc.backend.cell;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.pivotcalc.backend.aggregator.Aggregator;
import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.aggregator.AggregationState;
import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.common.Error;

/**
 * 单个单元格的聚合状态容器，按值字段下标存放 {@link AggregationState}。
 * <p>
 * 构建阶段只追加（add / accept / merge），{@link #freeze()} 之后只读，
 * 此时多个读者并发求值是安全的。
 */
public class CellState {
    /** 无法解析聚合器的字段对应的槽位为 null */
    private final List<AggregationState> states;
    private boolean frozen;

    public CellState(List<AggregationState> states) {
        this.states = states;
    }

    /**
     * 按值字段列表创建一个空的单元格状态。
     */
    public static CellState of(List<ValueField> fields, AggregatorRegistry registry) {
        List<AggregationState> list = new ArrayList<>(fields.size());
        for (ValueField field : fields) {
            Aggregator aggregator = field == null ? null : field.resolveAggregator(registry);
            list.add(aggregator == null ? null : aggregator.createState());
        }
        return new CellState(list);
    }

    public void add(int valueIndex, Object value) {
        ensureWritable();
        if(valueIndex < 0 || valueIndex >= states.size()) {
            throw Error.ValueCountMismatchException;
        }
        AggregationState state = states.get(valueIndex);
        if(state != null) {
            state.add(value);
        }
    }

    /**
     * 一条记录调用一次，values[i] 是第 i 个值字段的原始值；
     * values 比字段少时，缺少的字段不累加。
     */
    public void accept(Object[] values) {
        ensureWritable();
        if(values == null) {
            return;
        }
        if(values.length > states.size()) {
            throw Error.ValueCountMismatchException;
        }
        for (int i = 0; i < values.length; i++) {
            AggregationState state = states.get(i);
            if(state != null) {
                state.add(values[i]);
            }
        }
    }

    /**
     * 逐字段合并另一个单元格状态（用于由子分组汇总出小计/总计）。
     */
    public void merge(CellState other) {
        ensureWritable();
        Preconditions.checkNotNull(other, "other");
        if(other.states.size() != states.size()) {
            throw Error.CellCountMismatchException;
        }
        for (int i = 0; i < states.size(); i++) {
            AggregationState mine = states.get(i);
            AggregationState theirs = other.states.get(i);
            if(mine != null && theirs != null) {
                mine.merge(theirs);
            }
        }
    }

    public Object getResult(int valueIndex) {
        if(valueIndex < 0 || valueIndex >= states.size()) {
            return null;
        }
        AggregationState state = states.get(valueIndex);
        return state == null ? null : state.getResult();
    }

    public List<Object> results() {
        List<Object> values = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            values.add(getResult(i));
        }
        return values;
    }

    public int size() {
        return states.size();
    }

    public CellState freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void ensureWritable() {
        if(frozen) {
            throw Error.CellStateFrozenException;
        }
    }
}
