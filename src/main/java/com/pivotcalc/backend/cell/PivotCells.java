package com.pivotcalc.backend.cell;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 构建完成、已冻结的单元格状态集合，连同行/列父路径表一起交给求值器。
 */
public class PivotCells {
    private final Map<CellKey, CellState> cellStates;
    private final Map<List<Object>, List<Object>> rowParentPaths;
    private final Map<List<Object>, List<Object>> columnParentPaths;
    private final List<List<Object>> rowPaths;
    private final List<List<Object>> columnPaths;

    public PivotCells(Map<CellKey, CellState> cellStates,
                      Map<List<Object>, List<Object>> rowParentPaths,
                      Map<List<Object>, List<Object>> columnParentPaths,
                      List<List<Object>> rowPaths,
                      List<List<Object>> columnPaths) {
        this.cellStates = Collections.unmodifiableMap(cellStates);
        this.rowParentPaths = rowParentPaths == null ? Collections.emptyMap() : Collections.unmodifiableMap(rowParentPaths);
        this.columnParentPaths = columnParentPaths == null ? Collections.emptyMap() : Collections.unmodifiableMap(columnParentPaths);
        this.rowPaths = rowPaths == null ? Collections.emptyList() : Collections.unmodifiableList(rowPaths);
        this.columnPaths = columnPaths == null ? Collections.emptyList() : Collections.unmodifiableList(columnPaths);
    }

    public Map<CellKey, CellState> getCellStates() {
        return cellStates;
    }

    public CellState get(List<?> rowPath, List<?> columnPath) {
        return cellStates.get(CellKey.of(rowPath, columnPath));
    }

    public Map<List<Object>, List<Object>> getRowParentPaths() {
        return rowParentPaths;
    }

    public Map<List<Object>, List<Object>> getColumnParentPaths() {
        return columnParentPaths;
    }

    /** 所有行路径（含空路径），父路径排在子路径之前 */
    public List<List<Object>> getRowPaths() {
        return rowPaths;
    }

    /** 所有列路径（含空路径），父路径排在子路径之前 */
    public List<List<Object>> getColumnPaths() {
        return columnPaths;
    }

    public int size() {
        return cellStates.size();
    }
}
