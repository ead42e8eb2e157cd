package com.pivotcalc.common;

import java.util.ArrayList;
import java.util.List;

/**
 * 透视定义：值字段列表 + 已分组的记录。
 * 既是 shell 读取的 JSON 文件格式，也是 REST 请求体的一部分。
 */
public class PivotDefinition {

    private List<FieldSpec> fields = new ArrayList<>();
    private List<RecordSpec> records = new ArrayList<>();

    public List<FieldSpec> getFields() {
        return fields;
    }

    public void setFields(List<FieldSpec> fields) {
        this.fields = fields;
    }

    public List<RecordSpec> getRecords() {
        return records;
    }

    public void setRecords(List<RecordSpec> records) {
        this.records = records;
    }

    /**
     * 值字段定义。aggregate 为聚合类型名（默认 sum），displayMode 为展示方式名（默认 value）。
     */
    public static class FieldSpec {
        private String key;
        private String header;
        private String aggregate;
        private String formula;
        private String displayMode;

        public FieldSpec() {
        }

        public FieldSpec(String key, String aggregate, String formula) {
            this.key = key;
            this.aggregate = aggregate;
            this.formula = formula;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getHeader() {
            return header;
        }

        public void setHeader(String header) {
            this.header = header;
        }

        public String getAggregate() {
            return aggregate;
        }

        public void setAggregate(String aggregate) {
            this.aggregate = aggregate;
        }

        public String getFormula() {
            return formula;
        }

        public void setFormula(String formula) {
            this.formula = formula;
        }

        public String getDisplayMode() {
            return displayMode;
        }

        public void setDisplayMode(String displayMode) {
            this.displayMode = displayMode;
        }
    }

    /**
     * 一条已路由到 (row, column) 叶子的记录，values[i] 对应第 i 个值字段。
     */
    public static class RecordSpec {
        private List<Object> row = new ArrayList<>();
        private List<Object> column = new ArrayList<>();
        private List<Object> values = new ArrayList<>();

        public RecordSpec() {
        }

        public RecordSpec(List<Object> row, List<Object> column, List<Object> values) {
            this.row = row;
            this.column = column;
            this.values = values;
        }

        public List<Object> getRow() {
            return row;
        }

        public void setRow(List<Object> row) {
            this.row = row;
        }

        public List<Object> getColumn() {
            return column;
        }

        public void setColumn(List<Object> column) {
            this.column = column;
        }

        public List<Object> getValues() {
            return values;
        }

        public void setValues(List<Object> values) {
            this.values = values;
        }
    }
}
