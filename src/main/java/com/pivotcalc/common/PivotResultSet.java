package com.pivotcalc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 透视求值结果：每行是一个单元格，前两列为行标签和列标签，其后每个值字段一列。
 * 值已格式化为字符串，缺失值为 "NULL"。
 */
public class PivotResultSet {
    public static final String ROW_HEADER = "Row";
    public static final String COLUMN_HEADER = "Column";
    /** 标签列数：行标签、列标签 */
    public static final int LABEL_COLUMNS = 2;

    private final List<String> valueHeaders;
    private final List<CellRow> cellRows;

    public PivotResultSet(List<String> valueHeaders, List<CellRow> cellRows) {
        this.valueHeaders = valueHeaders == null ? Collections.emptyList() : valueHeaders;
        this.cellRows = cellRows == null ? Collections.emptyList() : cellRows;
    }

    public List<String> getValueHeaders() {
        return valueHeaders;
    }

    public List<CellRow> getCellRows() {
        return cellRows;
    }

    /** 没有值字段也没有单元格 */
    public boolean isEmpty() {
        return valueHeaders.isEmpty() && cellRows.isEmpty();
    }

    /**
     * 完整列头：Row、Column，然后是各值字段的显示名。
     */
    public List<String> getHeaders() {
        List<String> headers = new ArrayList<>(LABEL_COLUMNS + valueHeaders.size());
        headers.add(ROW_HEADER);
        headers.add(COLUMN_HEADER);
        headers.addAll(valueHeaders);
        return headers;
    }

    /**
     * 展开为字符串行，列顺序与 {@link #getHeaders()} 一致。
     */
    public List<List<String>> getRows() {
        List<List<String>> rows = new ArrayList<>(cellRows.size());
        for (CellRow row : cellRows) {
            rows.add(row.toList());
        }
        return rows;
    }

    public static class CellRow {
        private final String rowLabel;
        private final String columnLabel;
        private final List<String> values;

        public CellRow(String rowLabel, String columnLabel, List<String> values) {
            this.rowLabel = rowLabel;
            this.columnLabel = columnLabel;
            this.values = values == null ? Collections.emptyList() : values;
        }

        public String getRowLabel() {
            return rowLabel;
        }

        public String getColumnLabel() {
            return columnLabel;
        }

        public List<String> getValues() {
            return values;
        }

        public List<String> toList() {
            List<String> line = new ArrayList<>(LABEL_COLUMNS + values.size());
            line.add(rowLabel);
            line.add(columnLabel);
            line.addAll(values);
            return line;
        }
    }
}
