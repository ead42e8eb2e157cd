package com.pivotcalc.backend.cell;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.common.Error;

/**
 * 由已经分好组的记录构建单元格状态。
 * <p>
 * 调用方负责把每条记录路由到 (行路径, 列路径) 叶子；每条记录到达时即累加进
 * 所有 (行前缀 x 列前缀) 单元格，小计与总计因此与按记录顺序单遍计算一致
 * （First / Last 等依赖顺序的聚合同样成立）。{@link #build()} 只负责冻结。
 * <p>
 * 非线程安全：单个构建过程只允许一个写者。
 */
public class CellStateBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CellStateBuilder.class);

    private final List<ValueField> fields;
    private final AggregatorRegistry registry;
    private final Map<CellKey, CellState> cells = new LinkedHashMap<>();
    private final Set<List<Object>> rowPaths = new LinkedHashSet<>();
    private final Set<List<Object>> columnPaths = new LinkedHashSet<>();
    private final Map<List<Object>, List<Object>> rowParents = new HashMap<>();
    private final Map<List<Object>, List<Object>> columnParents = new HashMap<>();
    private long records;
    private boolean built;

    public CellStateBuilder(List<ValueField> fields, AggregatorRegistry registry) {
        this.fields = fields;
        this.registry = registry;
        rowPaths.add(CellKey.EMPTY_PATH);
        columnPaths.add(CellKey.EMPTY_PATH);
        cells.put(CellKey.grandTotal(), CellState.of(fields, registry));
    }

    /**
     * 累加一条记录。
     *
     * @param rowPath    该记录所属的行分组路径
     * @param columnPath 该记录所属的列分组路径
     * @param values     按值字段下标排列的原始值
     */
    public CellStateBuilder add(List<?> rowPath, List<?> columnPath, Object[] values) {
        if(built) {
            throw Error.BuilderClosedException;
        }
        if(values != null && values.length > fields.size()) {
            throw Error.ValueCountMismatchException;
        }
        CellKey leaf = CellKey.of(rowPath, columnPath);
        List<List<Object>> rowPrefixes = prefixes(leaf.getRowPath(), rowPaths, rowParents);
        List<List<Object>> columnPrefixes = prefixes(leaf.getColumnPath(), columnPaths, columnParents);
        for (List<Object> row : rowPrefixes) {
            for (List<Object> column : columnPrefixes) {
                CellKey target = CellKey.of(row, column);
                CellState state = cells.get(target);
                if(state == null) {
                    state = CellState.of(fields, registry);
                    cells.put(target, state);
                }
                state.accept(values);
            }
        }
        records++;
        return this;
    }

    public PivotCells build() {
        if(built) {
            throw Error.BuilderClosedException;
        }
        built = true;
        for (CellState state : cells.values()) {
            state.freeze();
        }
        LOGGER.debug("Built {} cells from {} records", cells.size(), records);
        return new PivotCells(cells, rowParents, columnParents, new ArrayList<>(rowPaths), new ArrayList<>(columnPaths));
    }

    /**
     * 返回 path 的全部前缀（含空路径与自身），同时登记路径与父路径表。
     */
    private static List<List<Object>> prefixes(List<Object> path,
                                               Set<List<Object>> known,
                                               Map<List<Object>, List<Object>> parents) {
        List<List<Object>> result = new ArrayList<>(path.size() + 1);
        List<Object> parent = CellKey.EMPTY_PATH;
        result.add(parent);
        for (int len = 1; len <= path.size(); len++) {
            List<Object> prefix = CellKey.path(path.subList(0, len));
            known.add(prefix);
            parents.putIfAbsent(prefix, parent);
            result.add(prefix);
            parent = prefix;
        }
        return result;
    }
}
