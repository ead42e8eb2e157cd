package com.pivotcalc.backend.cell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 透视单元格坐标：行路径 + 列路径。空路径表示该维度的总计。
 * 两个 key 相等当且仅当两条路径逐元素相等（允许 null 元素）。
 */
public final class CellKey {

    public static final List<Object> EMPTY_PATH = Collections.emptyList();

    private final List<Object> rowPath;
    private final List<Object> columnPath;
    private final int hash;

    private CellKey(List<Object> rowPath, List<Object> columnPath) {
        this.rowPath = rowPath;
        this.columnPath = columnPath;
        this.hash = Objects.hash(rowPath, columnPath);
    }

    public static CellKey of(List<?> rowPath, List<?> columnPath) {
        return new CellKey(path(rowPath), path(columnPath));
    }

    /** 总计单元格 (空路径, 空路径) */
    public static CellKey grandTotal() {
        return new CellKey(EMPTY_PATH, EMPTY_PATH);
    }

    /** 复制为不可变路径，null 视为空路径 */
    public static List<Object> path(List<?> values) {
        if(values == null || values.isEmpty()) {
            return EMPTY_PATH;
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static List<Object> path(Object... values) {
        if(values == null || values.length == 0) {
            return EMPTY_PATH;
        }
        return path(Arrays.asList(values));
    }

    /** 去掉最后一个元素得到父路径；空路径的父路径是它自己 */
    public static List<Object> truncate(List<Object> path) {
        if(path.isEmpty()) {
            return path;
        }
        return path(path.subList(0, path.size() - 1));
    }

    public List<Object> getRowPath() {
        return rowPath;
    }

    public List<Object> getColumnPath() {
        return columnPath;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof CellKey)) {
            return false;
        }
        CellKey other = (CellKey) o;
        return hash == other.hash && rowPath.equals(other.rowPath) && columnPath.equals(other.columnPath);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "CellKey" + rowPath + columnPath;
    }
}
